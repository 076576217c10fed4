package com.dev.dcaservice.controller;

import com.dev.dcaservice.dto.ApiErrorResponse;
import com.dev.dcaservice.exception.DcaException;
import com.dev.dcaservice.exception.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Centralized exception handling for REST controllers.
 *
 * <p>Maps engine rejections to the HTTP status of their {@link ErrorCode} so clients
 * receive clear, consistent error responses and can tell retryable failures apart.</p>
 */
@ControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  /**
   * Maps any {@link DcaException} to the status of its error code.
   */
  @ExceptionHandler(DcaException.class)
  public ResponseEntity<ApiErrorResponse> handleDcaException(DcaException ex) {
    ErrorCode code = ex.getErrorCode();
    log.warn("Request rejected: {} - {}", code, ex.getMessage());
    ApiErrorResponse body = new ApiErrorResponse(
        code.getStatus().value(),
        code.name(),
        ex.getMessage(),
        code.isRetryable());
    return ResponseEntity.status(code.getStatus()).body(body);
  }

  /**
   * Maps {@link IllegalArgumentException} to HTTP 400 Bad Request.
   */
  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    HttpStatus status = HttpStatus.BAD_REQUEST;
    ApiErrorResponse body = new ApiErrorResponse(
        status.value(),
        "BAD_REQUEST",
        ex.getMessage(),
        false);
    return ResponseEntity.status(status).body(body);
  }
}
