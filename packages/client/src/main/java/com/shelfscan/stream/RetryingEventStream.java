package com.shelfscan.stream;

import com.shelfscan.exception.ClientErrorException;
import com.shelfscan.exception.ConnectionFailureException;
import com.shelfscan.exception.ExceptionUtil;
import com.shelfscan.exception.MalformedEventException;
import com.shelfscan.exception.RetriesExhaustedException;
import com.shelfscan.model.StreamEvent;
import java.io.IOException;
import java.time.Duration;
import java.util.NoSuchElementException;
import okhttp3.Call;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * {@link EventStream} over an OkHttp call that reconnects on connection-level failures.
 *
 * <p>A failure to connect, an I/O error while reading, a 5xx response or the body ending before a
 * terminal event all count as connection failures and trigger a reconnect after the backoff
 * delay, up to the policy's total attempt count. A 4xx response is not retried. Nothing is read
 * after the first terminal event.
 */
final class RetryingEventStream implements EventStream {
  private static final org.slf4j.Logger log =
      com.shelfscan.logging.LoggingService.getLogger(RetryingEventStream.class);

  /** Creates a fresh, not yet executed stream call for each attempt. */
  @FunctionalInterface
  interface CallFactory {
    Call newCall();
  }

  private final String label;
  private final CallFactory callFactory;
  private final StreamEventParser parser;
  private final BackoffPolicy policy;
  private final Sleeper sleeper;

  private final Object lock = new Object();
  private volatile boolean closed;
  private Call currentCall;
  private Response currentResponse;
  private ServerSentEventReader reader;

  private volatile int attempts;
  private StreamEvent pending;
  private boolean terminalSeen;

  RetryingEventStream(
      String label,
      CallFactory callFactory,
      StreamEventParser parser,
      BackoffPolicy policy,
      Sleeper sleeper) {
    this.label = label;
    this.callFactory = callFactory;
    this.parser = parser;
    this.policy = policy;
    this.sleeper = sleeper;
  }

  @Override
  public boolean hasNext() {
    if (pending != null) {
      return true;
    }
    if (terminalSeen || closed) {
      return false;
    }
    pending = advance();
    return pending != null;
  }

  @Override
  public StreamEvent next() {
    if (!hasNext()) {
      throw new NoSuchElementException("Stream for " + label + " is finished");
    }
    StreamEvent event = pending;
    pending = null;
    if (event.isTerminal()) {
      terminalSeen = true;
      releaseConnection();
    }
    return event;
  }

  @Override
  public int attempts() {
    return attempts;
  }

  @Override
  public void close() {
    Call call;
    synchronized (lock) {
      if (closed) {
        return;
      }
      closed = true;
      call = currentCall;
    }
    if (call != null) {
      call.cancel();
    }
    releaseConnection();
  }

  private StreamEvent advance() {
    while (true) {
      if (closed) {
        return null;
      }
      try {
        if (reader == null) {
          open();
        }
        ServerSentEventReader current;
        synchronized (lock) {
          current = reader;
        }
        if (current == null) {
          return null;
        }
        ServerSentEventReader.RawEvent raw = current.next();
        if (raw == null) {
          throw new ConnectionFailureException(0, "Stream ended before a terminal event");
        }
        try {
          StreamEvent event = parser.parse(raw.event(), raw.data());
          if (event instanceof StreamEvent.Unknown unknown) {
            log.debug("[{}] Ignoring unknown stream event '{}'", label, unknown.name());
          }
          return event;
        } catch (MalformedEventException e) {
          log.warn("[{}] Skipping stream record: {}", label, e.getMessage());
        }
      } catch (IOException | ConnectionFailureException e) {
        releaseConnection();
        if (closed) {
          return null;
        }
        if (attempts >= policy.maxAttempts()) {
          throw new RetriesExhaustedException(attempts, e);
        }
        Duration delay = policy.delayAfter(attempts);
        log.warn(
            "[{}] Stream attempt {}/{} failed ({}), reconnecting in {} ms",
            label,
            attempts,
            policy.maxAttempts(),
            ExceptionUtil.extractErrorMessage(e),
            delay.toMillis());
        try {
          sleeper.sleep(delay);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          close();
          return null;
        }
      }
    }
  }

  private void open() throws IOException {
    Call call;
    synchronized (lock) {
      if (closed) {
        throw new IOException("Stream closed");
      }
      attempts++;
      call = callFactory.newCall();
      currentCall = call;
    }
    log.debug("[{}] Opening stream, attempt {}/{}", label, attempts, policy.maxAttempts());
    Response response = call.execute();
    int code = response.code();
    if (code >= 500) {
      response.close();
      throw new ConnectionFailureException(code, "Stream open failed with HTTP " + code);
    }
    if (!response.isSuccessful()) {
      try (response) {
        throw new ClientErrorException("Stream", code, StreamClient.readProblem(response));
      }
    }
    ResponseBody body = response.body();
    if (body == null) {
      response.close();
      throw new ConnectionFailureException(code, "Stream response had no body");
    }
    synchronized (lock) {
      currentResponse = response;
      reader = new ServerSentEventReader(body.source());
      if (closed) {
        // close() raced with the open; make sure the connection does not leak
        releaseConnection();
      }
    }
  }

  private void releaseConnection() {
    Response response;
    synchronized (lock) {
      response = currentResponse;
      currentResponse = null;
      reader = null;
      currentCall = null;
    }
    if (response != null) {
      try {
        response.close();
      } catch (RuntimeException e) {
        log.debug("[{}] Error closing stream response: {}", label, e.toString());
      }
    }
  }
}
