package com.orderdesk.orderservice.exception;

/**
 * The request is well formed but a business rule forbids it in the current state, e.g. deleting a
 * customer who still has orders or editing an order after its edit window closed.
 */
public class InvalidOperationException extends OrderDeskException {

  public InvalidOperationException(String message) {
    super(ErrorKind.INVALID_OPERATION, message);
  }
}
