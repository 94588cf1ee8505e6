package com.orderdesk.orderservice.exception;

public class StorageFailureException extends OrderDeskException {

  public StorageFailureException(String message, Throwable cause) {
    super(ErrorKind.STORAGE_FAILURE, message, cause);
  }
}
