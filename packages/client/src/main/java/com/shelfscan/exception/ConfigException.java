package com.shelfscan.exception;

/** Invalid or missing configuration. */
public class ConfigException extends ShelfScanException {
  public ConfigException(String message) {
    super(ShelfScanErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(ShelfScanErrorCode.CONFIG_ERROR, message, cause);
  }
}
