package com.shelfscan.exception;

import com.shelfscan.model.ProblemDetails;

/** A 4xx response other than 429, or a response body the client cannot use. */
public class ClientErrorException extends ScanApiException {
  private final ProblemDetails problem;

  public ClientErrorException(int statusCode, ProblemDetails problem) {
    this("Upload", statusCode, problem);
  }

  /**
   * @param operation short label of the rejected call, used in the message ("Upload", "Stream")
   */
  public ClientErrorException(String operation, int statusCode, ProblemDetails problem) {
    super(ShelfScanErrorCode.CLIENT_ERROR, statusCode, describe(operation, statusCode, problem));
    this.problem = problem == null ? ProblemDetails.empty() : problem;
  }

  /** A successful status whose body was not a valid envelope. */
  public ClientErrorException(int statusCode, String message, Throwable cause) {
    super(ShelfScanErrorCode.INVALID_RESPONSE, statusCode, message, cause);
    this.problem = new ProblemDetails(message, ShelfScanErrorCode.INVALID_RESPONSE.name(), false);
  }

  public ProblemDetails problem() {
    return problem;
  }

  @Override
  public boolean isRetryable() {
    return false;
  }

  private static String describe(String operation, int statusCode, ProblemDetails problem) {
    String detail = problem == null || problem.message() == null ? "" : ": " + problem.message();
    return operation + " rejected (HTTP " + statusCode + ")" + detail;
  }
}
