package com.orderdesk.orderservice.service;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Builds order numbers of the form {@code ORD} + UTC timestamp ({@code yyyyMMddHHmmss}) + a random
 * four digit suffix. Numbers are not guaranteed unique; the unique column on the order table is
 * the arbiter and callers retry on collision.
 */
@Component
public class OrderNumberGenerator {

  static final String PREFIX = "ORD";

  private static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

  public String generate(Instant createdAt) {
    int suffix = ThreadLocalRandom.current().nextInt(1000, 10000);
    return PREFIX + TIMESTAMP.format(createdAt) + suffix;
  }
}
