package com.dev.dcaservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Failure reasons reported to callers.
 *
 * <p>{@code retryable} tells an agent whether re-submitting the same request later can
 * succeed without any change to the order (for example after {@link #TOO_EARLY}).</p>
 */
public enum ErrorCode {
  INVALID_SCHEDULE(HttpStatus.BAD_REQUEST, false),
  INVALID_CONFIGURATION(HttpStatus.BAD_REQUEST, false),
  INSUFFICIENT_FEE(HttpStatus.BAD_REQUEST, false),
  ORDER_NOT_FOUND(HttpStatus.NOT_FOUND, false),
  NOT_ORDER_OWNER(HttpStatus.FORBIDDEN, false),
  UNAUTHORIZED(HttpStatus.FORBIDDEN, false),
  TOO_EARLY(HttpStatus.CONFLICT, true),
  PERIOD_ENDED(HttpStatus.CONFLICT, false),
  INSUFFICIENT_BALANCE(HttpStatus.CONFLICT, false),
  PRICE_BELOW_MINIMUM(HttpStatus.CONFLICT, true),
  PRICE_ABOVE_MAXIMUM(HttpStatus.CONFLICT, true),
  ALREADY_INITIALIZED(HttpStatus.CONFLICT, false),
  CUSTODY_TRANSFER_FAILED(HttpStatus.UNPROCESSABLE_ENTITY, true),
  EXCHANGE_REJECTED(HttpStatus.BAD_GATEWAY, true);

  private final HttpStatus status;
  private final boolean retryable;

  ErrorCode(HttpStatus status, boolean retryable) {
    this.status = status;
    this.retryable = retryable;
  }

  public HttpStatus getStatus() {
    return status;
  }

  public boolean isRetryable() {
    return retryable;
  }
}
