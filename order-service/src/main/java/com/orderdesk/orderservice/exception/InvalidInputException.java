package com.orderdesk.orderservice.exception;

/** The request itself is malformed: bad ids, ranges, quantities or search terms. */
public class InvalidInputException extends OrderDeskException {

  public InvalidInputException(String message) {
    super(ErrorKind.INVALID_INPUT, message);
  }
}
