package com.orderdesk.orderservice.service;

import com.orderdesk.orderservice.exception.InvalidInputException;

import java.math.BigDecimal;
import java.time.Instant;

/** Argument checks shared by the services. Every failure is an {@link InvalidInputException}. */
public final class RequestGuards {

  private RequestGuards() {}

  public static long requirePositiveId(Long id, String name) {
    if (id == null || id <= 0) {
      throw new InvalidInputException(name + " must be a positive number, got " + id);
    }
    return id;
  }

  public static void requireNonNegative(BigDecimal value, String name) {
    if (value != null && value.signum() < 0) {
      throw new InvalidInputException(name + " must not be negative");
    }
  }

  public static void requirePositive(BigDecimal value, String name) {
    if (value == null || value.signum() <= 0) {
      throw new InvalidInputException(name + " must be greater than zero");
    }
  }

  public static void requireOrdered(BigDecimal min, BigDecimal max, String minName, String maxName) {
    if (min != null && max != null && min.compareTo(max) > 0) {
      throw new InvalidInputException(minName + " cannot be greater than " + maxName);
    }
  }

  public static void requireOrdered(Instant from, Instant to) {
    if (from != null && to != null && from.isAfter(to)) {
      throw new InvalidInputException("fromDate cannot be after toDate");
    }
  }

  public static int requireQuantity(Integer quantity) {
    if (quantity == null || quantity < 1) {
      throw new InvalidInputException("Quantity must be at least 1, got " + quantity);
    }
    return quantity;
  }

  /** Trims the term and rejects it when blank or shorter than {@code minLength}. */
  public static String requireSearchTerm(String term, int minLength) {
    if (term == null || term.isBlank()) {
      throw new InvalidInputException("Search term is required");
    }
    String trimmed = term.trim();
    if (trimmed.length() < minLength) {
      throw new InvalidInputException(
          "Search term must be at least " + minLength + " characters long");
    }
    return trimmed;
  }
}
