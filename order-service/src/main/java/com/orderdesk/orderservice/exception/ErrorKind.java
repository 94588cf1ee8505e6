package com.orderdesk.orderservice.exception;

public enum ErrorKind {
  NOT_FOUND,
  INVALID_INPUT,
  INVALID_OPERATION,
  CONFLICT,
  STORAGE_FAILURE
}
