package com.shelfscan.http;

import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/** Adds the device identifier and user agent to every outgoing request. */
public class ClientHeadersInterceptor implements Interceptor {
  public static final String DEVICE_ID_HEADER = "X-Device-ID";

  private final String deviceId;
  private final String userAgent;

  public ClientHeadersInterceptor(String deviceId, String userAgent) {
    if (deviceId == null || deviceId.isBlank()) {
      throw new IllegalArgumentException("deviceId cannot be blank");
    }
    this.deviceId = deviceId;
    this.userAgent = userAgent;
  }

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request.Builder builder = chain.request().newBuilder();
    if (chain.request().header(DEVICE_ID_HEADER) == null) {
      builder.header(DEVICE_ID_HEADER, deviceId);
    }
    if (userAgent != null && !userAgent.isBlank()) {
      builder.header("User-Agent", userAgent);
    }
    return chain.proceed(builder.build());
  }
}
