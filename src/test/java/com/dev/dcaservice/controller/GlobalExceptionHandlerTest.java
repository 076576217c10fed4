package com.dev.dcaservice.controller;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.dev.dcaservice.dto.ApiErrorResponse;
import com.dev.dcaservice.exception.ErrorCode;
import com.dev.dcaservice.exception.ExecutionRejectedException;
import com.dev.dcaservice.exception.NotOrderOwnerException;
import com.dev.dcaservice.exception.OrderNotFoundException;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Unit tests for GlobalExceptionHandler.
 */
class GlobalExceptionHandlerTest {

  private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

  @Test
  void testOrderNotFound_Maps404() {
    UUID id = UUID.randomUUID();

    ResponseEntity<ApiErrorResponse> response =
        handler.handleDcaException(new OrderNotFoundException(id));

    assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
    assertEquals("ORDER_NOT_FOUND", response.getBody().getError());
    assertEquals("Order not found: " + id, response.getBody().getMessage());
    assertFalse(response.getBody().isRetryable());
  }

  @Test
  void testPriceRejection_MapsConflictAndRetryable() {
    ResponseEntity<ApiErrorResponse> response = handler.handleDcaException(
        new ExecutionRejectedException(ErrorCode.PRICE_ABOVE_MAXIMUM, "too high"));

    assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
    assertEquals(409, response.getBody().getStatus());
    assertTrue(response.getBody().isRetryable());
  }

  @Test
  void testNotOwner_MapsForbidden() {
    ResponseEntity<ApiErrorResponse> response =
        handler.handleDcaException(new NotOrderOwnerException("not yours"));

    assertEquals(HttpStatus.FORBIDDEN, response.getStatusCode());
  }

  @Test
  void testIllegalArgument_MapsBadRequest() {
    ResponseEntity<ApiErrorResponse> response =
        handler.handleIllegalArgument(new IllegalArgumentException("bad"));

    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
    assertEquals("bad", response.getBody().getMessage());
  }
}
