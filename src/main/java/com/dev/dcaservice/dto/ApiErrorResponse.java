package com.dev.dcaservice.dto;

/**
 * Standard error payload returned by the DCA API.
 */
public class ApiErrorResponse {

  private final int status;
  private final String error;
  private final String message;
  private final boolean retryable;

  /**
   * Creates a new standardized API error response.
   *
   * @param status HTTP status code
   * @param error short application-specific error code
   * @param message human-readable error description
   * @param retryable whether the same request may succeed later
   */
  public ApiErrorResponse(int status, String error, String message, boolean retryable) {
    this.status = status;
    this.error = error;
    this.message = message;
    this.retryable = retryable;
  }

  public int getStatus() {
    return status;
  }

  public String getError() {
    return error;
  }

  public String getMessage() {
    return message;
  }

  public boolean isRetryable() {
    return retryable;
  }
}
