package com.orderdesk.orderservice.exception;

public class NotFoundException extends OrderDeskException {

  public NotFoundException(String message) {
    super(ErrorKind.NOT_FOUND, message);
  }

  public static NotFoundException of(String entity, Long id) {
    return new NotFoundException(entity + " not found with id: " + id);
  }
}
