package com.dev.dcaservice.exception;

/**
 * Thrown when funds could not be moved into or out of custody.
 */
public class CustodyTransferFailedException extends DcaException {

  public CustodyTransferFailedException(String message) {
    super(ErrorCode.CUSTODY_TRANSFER_FAILED, message);
  }

  public CustodyTransferFailedException(String message, Throwable cause) {
    super(ErrorCode.CUSTODY_TRANSFER_FAILED, message, cause);
  }
}
