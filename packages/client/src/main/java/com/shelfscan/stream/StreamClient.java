package com.shelfscan.stream;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shelfscan.exception.ClientErrorException;
import com.shelfscan.exception.ConnectionFailureException;
import com.shelfscan.exception.ExceptionUtil;
import com.shelfscan.exception.RateLimitedException;
import com.shelfscan.exception.StateException;
import com.shelfscan.http.ClientHeadersInterceptor;
import com.shelfscan.model.BookMetadata;
import com.shelfscan.model.ProblemDetails;
import com.shelfscan.model.ScanJob;
import com.shelfscan.model.SubmitReceipt;
import com.shelfscan.utility.JacksonUtility;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.jetbrains.annotations.NotNull;

/**
 * HTTP client for the two-phase scan protocol: submit an image, then consume the job's
 * server-sent event stream until a terminal event. Also fetches deferred results and releases
 * server-side resources.
 *
 * <p>Thread-safe; one instance is shared by all jobs.
 */
public class StreamClient {
  private static final org.slf4j.Logger log =
      com.shelfscan.logging.LoggingService.getLogger(StreamClient.class);

  static final String SUBMIT_PATH = "v3/jobs/scans";
  private static final MediaType JPEG = MediaType.get("image/jpeg");
  private static final TypeReference<List<BookMetadata>> BOOK_LIST = new TypeReference<>() {};

  private final HttpUrl baseUrl;
  private final OkHttpClient httpClient;
  private final OkHttpClient streamClient;
  private final BackoffPolicy backoffPolicy;
  private final Duration defaultRetryAfter;
  private final Sleeper sleeper;
  private final StreamEventParser parser;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  /**
   * @param baseUrl root of the recognition service, e.g. {@code https://api.example.net/}
   * @param httpClient client for submit, results and cleanup calls
   * @param streamClient client for event streams (long read timeout)
   * @param backoffPolicy reconnection policy for streams
   * @param defaultRetryAfter cooldown used when a 429 carries no usable {@code Retry-After}
   * @param sleeper waits between reconnection attempts
   */
  public StreamClient(
      String baseUrl,
      OkHttpClient httpClient,
      OkHttpClient streamClient,
      BackoffPolicy backoffPolicy,
      Duration defaultRetryAfter,
      Sleeper sleeper) {
    Objects.requireNonNull(baseUrl, "baseUrl");
    HttpUrl parsed = HttpUrl.parse(baseUrl.endsWith("/") ? baseUrl : baseUrl + "/");
    if (parsed == null) {
      throw new IllegalArgumentException("Invalid base URL: " + baseUrl);
    }
    this.baseUrl = parsed;
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.streamClient = Objects.requireNonNull(streamClient, "streamClient");
    this.backoffPolicy = Objects.requireNonNull(backoffPolicy, "backoffPolicy");
    this.defaultRetryAfter = Objects.requireNonNull(defaultRetryAfter, "defaultRetryAfter");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.parser = new StreamEventParser(mapper);
  }

  /**
   * Upload the job's image.
   *
   * @return receipt with job id, absolute stream URL and optional auth token
   * @throws RateLimitedException on HTTP 429
   * @throws ClientErrorException on other 4xx responses or an unusable success body
   * @throws ConnectionFailureException on 5xx responses or transport failure
   */
  public SubmitReceipt submit(ScanJob job) {
    RequestBody body =
        new MultipartBody.Builder()
            .setType(MultipartBody.FORM)
            .addFormDataPart("photos[]", "spine.jpg", RequestBody.create(job.imageBytes(), JPEG))
            .build();
    Request request =
        new Request.Builder()
            .url(resolve(SUBMIT_PATH))
            .header(ClientHeadersInterceptor.DEVICE_ID_HEADER, job.deviceIdentifier())
            .header("Accept", "application/json")
            .post(body)
            .build();

    try (Response response = httpClient.newCall(request).execute()) {
      int code = response.code();
      if (code == 429) {
        Duration retryAfter = parseRetryAfter(response.header("Retry-After"));
        log.info("Submit of {} rate limited, retry after {}s", job.localId(), retryAfter.toSeconds());
        throw new RateLimitedException(retryAfter);
      }
      if (code >= 500) {
        throw new ConnectionFailureException(code, "Submit failed with HTTP " + code);
      }
      if (!response.isSuccessful()) {
        throw new ClientErrorException(code, readProblem(response));
      }
      SubmitReceipt receipt = readReceipt(code, response.body());
      log.debug("Submitted {} as job {}", job.localId(), receipt.jobId());
      return receipt;
    } catch (IOException e) {
      throw new ConnectionFailureException(
          "Submit failed: " + ExceptionUtil.extractErrorMessage(e), e);
    }
  }

  /** Open the job's event stream with the default number of attempts. */
  public EventStream consumeStream(ScanJob job) {
    return consumeStream(job, backoffPolicy.maxAttempts());
  }

  /**
   * Open the job's event stream. No connection is made until the stream is first iterated.
   *
   * @param maxAttempts total connection attempts (initial attempt included)
   * @throws StateException if the job has not been submitted
   */
  public EventStream consumeStream(ScanJob job, int maxAttempts) {
    SubmitReceipt receipt =
        job.receipt()
            .orElseThrow(() -> new StateException("Job " + job.localId() + " is not submitted"));
    HttpUrl url = resolve(receipt.sseUrl());
    Request.Builder builder =
        new Request.Builder()
            .url(url)
            .header(ClientHeadersInterceptor.DEVICE_ID_HEADER, job.deviceIdentifier())
            .header("Accept", "text/event-stream")
            .header("Cache-Control", "no-cache")
            .get();
    if (StringUtils.isNotBlank(receipt.authToken())) {
      builder.header("Authorization", "Bearer " + receipt.authToken());
    }
    Request request = builder.build();
    return new RetryingEventStream(
        receipt.jobId(),
        () -> streamClient.newCall(request),
        parser,
        backoffPolicy.withMaxAttempts(maxAttempts),
        sleeper);
  }

  /**
   * Fetch the result list referenced by a {@code completed} event that carried no inline books.
   *
   * @throws ClientErrorException on 4xx or an unreadable body
   * @throws ConnectionFailureException on 5xx or transport failure
   */
  public List<BookMetadata> fetchResults(String resultsUrl, ScanJob job) {
    Request.Builder builder =
        new Request.Builder()
            .url(resolve(resultsUrl))
            .header(ClientHeadersInterceptor.DEVICE_ID_HEADER, job.deviceIdentifier())
            .header("Accept", "application/json")
            .get();
    if (StringUtils.isNotBlank(job.authToken())) {
      builder.header("Authorization", "Bearer " + job.authToken());
    }
    try (Response response = httpClient.newCall(builder.build()).execute()) {
      int code = response.code();
      if (code >= 500) {
        throw new ConnectionFailureException(code, "Results fetch failed with HTTP " + code);
      }
      if (!response.isSuccessful()) {
        throw new ClientErrorException("Results fetch", code, readProblem(response));
      }
      return readBooks(code, response.body());
    } catch (IOException e) {
      throw new ConnectionFailureException(
          "Results fetch failed: " + ExceptionUtil.extractErrorMessage(e), e);
    }
  }

  /**
   * Release server-side resources for a job. Never blocks and never throws; 200, 204 and 404 count
   * as success. The returned future completes with {@code true} on success and {@code false} on
   * any failure.
   */
  public CompletableFuture<Boolean> cleanup(String jobId, String authToken) {
    CompletableFuture<Boolean> result = new CompletableFuture<>();
    if (StringUtils.isBlank(jobId)) {
      result.complete(false);
      return result;
    }
    Request.Builder builder =
        new Request.Builder().url(resolve(SUBMIT_PATH + "/" + jobId + "/cleanup")).delete();
    if (StringUtils.isNotBlank(authToken)) {
      builder.header("Authorization", "Bearer " + authToken);
    }
    try {
      httpClient
          .newCall(builder.build())
          .enqueue(
              new Callback() {
                @Override
                public void onFailure(@NotNull Call call, @NotNull IOException e) {
                  log.warn(
                      "Cleanup failed for job {}: {}",
                      jobId,
                      ExceptionUtil.extractErrorMessage(e));
                  result.complete(false);
                }

                @Override
                public void onResponse(@NotNull Call call, @NotNull Response response) {
                  try (response) {
                    int code = response.code();
                    boolean ok = code == 200 || code == 204 || code == 404;
                    if (ok) {
                      log.debug("Cleanup done for job {} (HTTP {})", jobId, code);
                    } else {
                      log.warn("Cleanup for job {} returned HTTP {}", jobId, code);
                    }
                    result.complete(ok);
                  }
                }
              });
    } catch (RuntimeException e) {
      log.warn("Cleanup could not be scheduled for job {}: {}", jobId, e.toString());
      result.complete(false);
    }
    return result;
  }

  public BackoffPolicy backoffPolicy() {
    return backoffPolicy;
  }

  Duration parseRetryAfter(String header) {
    if (StringUtils.isBlank(header)) {
      return defaultRetryAfter;
    }
    double seconds = NumberUtils.toDouble(header.trim(), -1);
    if (seconds < 0) {
      log.debug("Unparsable Retry-After '{}', using default", header);
      return defaultRetryAfter;
    }
    return Duration.ofMillis((long) Math.ceil(seconds * 1000));
  }

  private SubmitReceipt readReceipt(int code, ResponseBody body) throws IOException {
    JsonNode root;
    try {
      root = body == null ? null : mapper.readTree(body.string());
    } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
      throw new ClientErrorException(code, "Submit response is not valid JSON", e);
    }
    if (root == null || !root.path("success").asBoolean(false)) {
      throw new ClientErrorException(code, "Submit response did not report success", null);
    }
    JsonNode data = root.path("data");
    String jobId = text(data, "jobId");
    String sseUrl = text(data, "sseUrl");
    if (jobId == null || sseUrl == null) {
      throw new ClientErrorException(code, "Submit response is missing jobId or sseUrl", null);
    }
    HttpUrl absolute = baseUrl.resolve(sseUrl);
    if (absolute == null) {
      throw new ClientErrorException(code, "Submit response has an invalid sseUrl: " + sseUrl, null);
    }
    return new SubmitReceipt(
        jobId, absolute.toString(), text(data, "authToken"), text(data, "statusUrl"));
  }

  private List<BookMetadata> readBooks(int code, ResponseBody body) throws IOException {
    try {
      JsonNode root = body == null ? null : mapper.readTree(body.string());
      JsonNode books = null;
      if (root != null && root.isArray()) {
        books = root;
      } else if (root != null && root.path("books").isArray()) {
        books = root.get("books");
      } else if (root != null && root.path("data").isArray()) {
        books = root.get("data");
      } else if (root != null && root.path("data").path("books").isArray()) {
        books = root.get("data").get("books");
      }
      if (books == null) {
        throw new ClientErrorException(code, "Results response contains no book array", null);
      }
      return mapper.convertValue(books, BOOK_LIST);
    } catch (com.fasterxml.jackson.core.JsonProcessingException | IllegalArgumentException e) {
      throw new ClientErrorException(code, "Results response could not be decoded", e);
    }
  }

  /** Best-effort decode of a problem-details body; never throws. */
  static ProblemDetails readProblem(Response response) {
    try {
      ResponseBody body = response.body();
      String raw = body == null ? "" : body.string();
      if (raw.isBlank()) {
        return ProblemDetails.empty();
      }
      return JacksonUtility.getJsonMapper().readValue(raw, ProblemDetails.class);
    } catch (Exception e) {
      log.debug("Could not decode error body (HTTP {}): {}", response.code(), e.toString());
      return ProblemDetails.empty();
    }
  }

  private HttpUrl resolve(String urlOrPath) {
    HttpUrl url = baseUrl.resolve(urlOrPath);
    if (url == null) {
      throw new IllegalArgumentException("Cannot resolve URL: " + urlOrPath);
    }
    return url;
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() || value.asText().isBlank() ? null : value.asText();
  }
}
