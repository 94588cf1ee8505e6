package com.orderdesk.orderservice.exception;

import lombok.Getter;

/** Base type of every business failure raised by the order desk services. */
@Getter
public abstract class OrderDeskException extends RuntimeException {
  private final ErrorKind kind;

  protected OrderDeskException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  protected OrderDeskException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }
}
