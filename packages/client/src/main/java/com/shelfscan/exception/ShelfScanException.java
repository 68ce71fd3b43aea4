package com.shelfscan.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Base unchecked exception carrying an error code and optional diagnostic context. */
public class ShelfScanException extends RuntimeException {
  private final ShelfScanErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public ShelfScanException(ShelfScanErrorCode code, String message) {
    super(message);
    this.code = code == null ? ShelfScanErrorCode.UNKNOWN : code;
  }

  public ShelfScanException(ShelfScanErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code == null ? ShelfScanErrorCode.UNKNOWN : code;
  }

  public ShelfScanErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a diagnostic key/value and return this exception for chaining. */
  public ShelfScanException with(String key, Object value) {
    if (key != null) {
      context.put(key, value);
    }
    return this;
  }
}
