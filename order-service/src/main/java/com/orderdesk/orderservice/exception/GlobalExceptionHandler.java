package com.orderdesk.orderservice.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.net.URI;
import java.time.Instant;
import java.util.Locale;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} bodies. Every body carries the error kind and
 * a timestamp.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(OrderDeskException.class)
  public ProblemDetail handleOrderDesk(OrderDeskException ex) {
    HttpStatus status = statusOf(ex.getKind());
    if (status.is5xxServerError()) {
      log.error("Request failed: {}", ex.getMessage(), ex);
    } else {
      log.warn("Request rejected ({}): {}", ex.getKind(), ex.getMessage());
    }
    return problem(status, ex.getKind(), ex.getMessage());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    log.warn("Bad request: {}", ex.getMessage());
    return problem(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_INPUT, ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
    log.warn("Validation failed: {}", ex.getMessage());
    String detail =
        ex.getBindingResult().getFieldErrors().stream()
            .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
            .reduce((a, b) -> a + "; " + b)
            .orElse("Validation failed");
    ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_INPUT, detail);
    problem.setTitle("Validation Error");
    return problem;
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ProblemDetail handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    log.warn("Unreadable parameter {}: {}", ex.getName(), ex.getValue());
    return problem(
        HttpStatus.BAD_REQUEST,
        ErrorKind.INVALID_INPUT,
        "Invalid value '" + ex.getValue() + "' for parameter " + ex.getName());
  }

  @ExceptionHandler(DataAccessException.class)
  public ProblemDetail handleDataAccess(DataAccessException ex) {
    log.error("Storage failure", ex);
    return problem(
        HttpStatus.INTERNAL_SERVER_ERROR, ErrorKind.STORAGE_FAILURE, "The record store failed");
  }

  @ExceptionHandler(Exception.class)
  public ProblemDetail handleGeneric(Exception ex) {
    log.error("Internal server error", ex);
    return problem(
        HttpStatus.INTERNAL_SERVER_ERROR, ErrorKind.STORAGE_FAILURE, "An unexpected error occurred");
  }

  static HttpStatus statusOf(ErrorKind kind) {
    switch (kind) {
      case NOT_FOUND:
        return HttpStatus.NOT_FOUND;
      case INVALID_INPUT:
        return HttpStatus.BAD_REQUEST;
      case INVALID_OPERATION:
        return HttpStatus.UNPROCESSABLE_ENTITY;
      case CONFLICT:
        return HttpStatus.CONFLICT;
      default:
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
  }

  private ProblemDetail problem(HttpStatus status, ErrorKind kind, String detail) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
    problem.setTitle(status.getReasonPhrase());
    problem.setType(
        URI.create(
            "https://orderdesk.com/errors/"
                + kind.name().toLowerCase(Locale.ROOT).replace('_', '-')));
    problem.setProperty("kind", kind.name());
    problem.setProperty("timestamp", Instant.now().toString());
    return problem;
  }
}
