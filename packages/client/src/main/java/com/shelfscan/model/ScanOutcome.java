package com.shelfscan.model;

import java.util.List;

/**
 * Terminal result of one job as handed to the catalog collaborator.
 *
 * @param localId client-side id of the job
 * @param jobId server-side id, null when the job never got past submit
 * @param state one of COMPLETED, FAILED or CANCELED
 * @param books recognized books (empty unless completed)
 * @param failureReason human-readable reason, null when completed
 * @param failureCode server or client error code, may be null
 * @param retryable whether offering a retry to the user makes sense
 */
public record ScanOutcome(
    String localId,
    String jobId,
    JobState state,
    List<BookMetadata> books,
    String failureReason,
    String failureCode,
    boolean retryable) {

  public ScanOutcome {
    books = books == null ? List.of() : List.copyOf(books);
  }

  public static ScanOutcome completed(ScanJob job, List<BookMetadata> books) {
    return new ScanOutcome(
        job.localId(), job.jobId(), JobState.COMPLETED, books, null, null, false);
  }

  public static ScanOutcome failed(
      ScanJob job, String reason, String code, boolean retryable) {
    return new ScanOutcome(
        job.localId(), job.jobId(), JobState.FAILED, List.of(), reason, code, retryable);
  }

  public static ScanOutcome canceled(ScanJob job, String reason) {
    return new ScanOutcome(
        job.localId(), job.jobId(), JobState.CANCELED, List.of(), reason, null, true);
  }

  public boolean isSuccess() {
    return state == JobState.COMPLETED;
  }
}
