package com.orderdesk.orderservice.service;

import com.orderdesk.orderservice.exception.ConflictException;
import com.orderdesk.orderservice.exception.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;

import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Resolves optimistic locking failures into the error a caller can act on: the record was deleted
 * by someone else, or it was changed by someone else.
 */
final class ConcurrentWrites {

  private static final Logger log = LoggerFactory.getLogger(ConcurrentWrites.class);

  private ConcurrentWrites() {}

  static <T> T withConflictCheck(
      String entity, Long id, BooleanSupplier stillExists, Supplier<T> write) {
    try {
      return write.get();
    } catch (OptimisticLockingFailureException e) {
      if (!stillExists.getAsBoolean()) {
        log.warn("{} {} was deleted by a concurrent request", entity, id);
        throw new NotFoundException(entity + " with id " + id + " no longer exists");
      }
      log.warn("{} {} was modified by a concurrent request", entity, id);
      throw new ConflictException(
          entity + " with id " + id + " was modified by another request, reload and retry", e);
    }
  }

  static void runWithConflictCheck(
      String entity, Long id, BooleanSupplier stillExists, Runnable write) {
    withConflictCheck(
        entity,
        id,
        stillExists,
        () -> {
          write.run();
          return null;
        });
  }
}
