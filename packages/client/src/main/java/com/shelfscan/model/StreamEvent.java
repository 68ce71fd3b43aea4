package com.shelfscan.model;

import java.util.List;

/**
 * One message received over a job's event stream. Exactly one terminal event ({@link Completed},
 * {@link Failed} or {@link Canceled}) ends a stream; every other kind may repeat.
 */
public interface StreamEvent {

  default boolean isTerminal() {
    return false;
  }

  /** Free-form status text such as "Reading...". */
  record Progress(String message) implements StreamEvent {}

  /** One recognized book, delivered while the job is still running. */
  record BookResult(BookMetadata metadata) implements StreamEvent {}

  /** Annotated preview image with the number of spines detected. */
  record SegmentedPreview(byte[] imageBytes, int totalDetected) implements StreamEvent {}

  /** Per-book progress, {@code current} is 1-based. */
  record BookProgress(int current, int total, String stage) implements StreamEvent {}

  /** Enrichment fell back to a secondary source for one book. */
  record EnrichmentDegraded(String reason, String isbn, String title, String fallbackSource)
      implements StreamEvent {}

  /** Job finished. Results are inline, behind {@code resultsUrl}, or both absent. */
  record Completed(String resultsUrl, List<BookMetadata> inlineBooks) implements StreamEvent {
    @Override
    public boolean isTerminal() {
      return true;
    }

    public boolean hasInlineBooks() {
      return inlineBooks != null;
    }
  }

  /** Job failed on the server. */
  record Failed(String message, String code, boolean retryable) implements StreamEvent {
    @Override
    public boolean isTerminal() {
      return true;
    }
  }

  /** Job canceled on the server. */
  record Canceled() implements StreamEvent {
    @Override
    public boolean isTerminal() {
      return true;
    }
  }

  /** Keep-alive. */
  record Ping() implements StreamEvent {}

  /** An event name this client does not know; ignored. */
  record Unknown(String name) implements StreamEvent {}
}
