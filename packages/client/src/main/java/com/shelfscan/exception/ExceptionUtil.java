package com.shelfscan.exception;

import java.util.function.Function;

/** Utility helpers for turning exceptions into log lines and user-facing failure reasons. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Produce a compact, single-line representation of a throwable's stack trace, capturing the top
   * frames in call order.
   *
   * <p>Example output: {@code com.example.Foo.bar (Foo.java:42) > com.example.App.main
   * (App.java:10)}
   *
   * @param t the throwable whose stack should be summarized (null returns empty string)
   * @param maxFrames maximum number of top stack frames to include; if <= 0, includes all frames
   * @return a single-line compact stack trace string
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  /** Convenience overload using a default of 10 frames. */
  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }

  /**
   * Extract a short human-readable message from a throwable, without stack information. Messages
   * of our own exceptions are returned verbatim; for anything else the innermost non-blank message
   * is prefixed with the exception type.
   *
   * @param t the throwable to extract the message from
   * @return the error message, or a default message if none is available
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }
    if (t instanceof ShelfScanException && !isBlank(t.getMessage())) {
      return t.getMessage();
    }

    Throwable current = t;
    Throwable best = null;
    while (current != null) {
      if (!isBlank(current.getMessage())) {
        best = current;
      }
      if (current.getCause() == current) break;
      current = current.getCause();
    }
    if (best == null) {
      return t.getClass().getSimpleName();
    }
    return best.getClass().getSimpleName() + ": " + best.getMessage().trim();
  }

  public static ShelfScanException rethrowIfUnchecked(
      Throwable t, Function<Throwable, ShelfScanException> supplier) {
    if (t instanceof ShelfScanException) {
      return (ShelfScanException) t;
    } else {
      return supplier.apply(t);
    }
  }

  private static boolean isBlank(String message) {
    return message == null || message.trim().isEmpty();
  }
}
