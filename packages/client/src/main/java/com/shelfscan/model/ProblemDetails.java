package com.shelfscan.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Error body returned by the service on non-2xx responses. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProblemDetails(String message, String code, Boolean retryable) {

  public static ProblemDetails empty() {
    return new ProblemDetails(null, null, null);
  }
}
