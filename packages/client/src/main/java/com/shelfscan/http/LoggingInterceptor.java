package com.shelfscan.http;

import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/**
 * Logs method, URL, status and latency of every call. Bodies are never logged: requests carry
 * image bytes and stream responses are consumed incrementally by the caller.
 */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.shelfscan.logging.LoggingService.getLogger(LoggingInterceptor.class);

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();

    long startTime = System.nanoTime();
    log.debug(
        "Sending request {} {} (body: {} bytes)",
        request.method(),
        request.url(),
        request.body() == null ? 0 : request.body().contentLength());

    Response response;
    try {
      response = chain.proceed(request);
    } catch (java.net.SocketTimeoutException e) {
      log.warn(
          "Request timed out: {} {} ({}ms)",
          request.method(),
          request.url(),
          elapsedMs(startTime));
      throw e;
    } catch (java.net.ConnectException e) {
      log.warn(
          "Connection error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsedMs(startTime),
          messageOrDefault(e, "Could not connect to server"));
      throw e;
    } catch (IOException e) {
      if ("Canceled".equalsIgnoreCase(e.getMessage())) {
        log.debug("Request canceled: {} {}", request.method(), request.url());
      } else {
        log.warn(
            "IO error: {} {} ({}ms): {}",
            request.method(),
            request.url(),
            elapsedMs(startTime),
            messageOrDefault(e, e.getClass().getSimpleName()));
      }
      throw e;
    }

    long durationMs = elapsedMs(startTime);
    if (response.isSuccessful()) {
      log.debug(
          "Received {} for {} {} in {} ms",
          response.code(),
          request.method(),
          request.url(),
          durationMs);
    } else {
      log.info(
          "Received {} for {} {} in {} ms",
          response.code(),
          request.method(),
          request.url(),
          durationMs);
    }
    return response;
  }

  private static long elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }

  private static String messageOrDefault(Exception e, String fallback) {
    String message = e.getMessage();
    return message == null || message.isEmpty() ? fallback : message;
  }
}
