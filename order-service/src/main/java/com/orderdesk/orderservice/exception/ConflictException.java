package com.orderdesk.orderservice.exception;

public class ConflictException extends OrderDeskException {

  public ConflictException(String message) {
    super(ErrorKind.CONFLICT, message);
  }

  public ConflictException(String message, Throwable cause) {
    super(ErrorKind.CONFLICT, message, cause);
  }
}
