package com.shelfscan.http;

import java.time.Duration;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  /**
   * Client for short request/response calls (submit, results, cleanup).
   *
   * @param connectTimeout connection establishment timeout
   * @param deviceId value sent as {@code X-Device-ID}
   * @param userAgent value sent as {@code User-Agent}, may be null
   */
  public static OkHttpClient create(Duration connectTimeout, String deviceId, String userAgent) {
    return new OkHttpClient.Builder()
        .connectTimeout(connectTimeout)
        .readTimeout(connectTimeout)
        .writeTimeout(connectTimeout)
        .addInterceptor(new ClientHeadersInterceptor(deviceId, userAgent))
        .addInterceptor(new LoggingInterceptor())
        .build();
  }

  /**
   * Derive a client for long-lived event streams. Shares the connection pool and dispatcher of
   * {@code base}; the read timeout only needs to outlast the server's keep-alive interval.
   */
  public static OkHttpClient forStreaming(OkHttpClient base, Duration readTimeout) {
    return base.newBuilder().readTimeout(readTimeout).callTimeout(Duration.ZERO).build();
  }
}
