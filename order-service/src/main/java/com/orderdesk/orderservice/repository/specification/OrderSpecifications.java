package com.orderdesk.orderservice.repository.specification;

import com.orderdesk.orderservice.model.Order;
import org.springframework.data.jpa.domain.Specification;

import java.math.BigDecimal;
import java.time.Instant;

public final class OrderSpecifications {

  private OrderSpecifications() {}

  public static Specification<Order> filter(
      Long customerId, Instant from, Instant to, BigDecimal minAmount, BigDecimal maxAmount) {
    Specification<Order> spec = Specification.where(null);
    if (customerId != null) {
      spec = spec.and((root, query, cb) -> cb.equal(root.get("customer").get("id"), customerId));
    }
    if (from != null) {
      spec = spec.and((root, query, cb) -> cb.greaterThanOrEqualTo(root.get("orderDate"), from));
    }
    if (to != null) {
      spec = spec.and((root, query, cb) -> cb.lessThanOrEqualTo(root.get("orderDate"), to));
    }
    if (minAmount != null) {
      spec =
          spec.and(
              (root, query, cb) -> cb.greaterThanOrEqualTo(root.get("totalAmount"), minAmount));
    }
    if (maxAmount != null) {
      spec =
          spec.and((root, query, cb) -> cb.lessThanOrEqualTo(root.get("totalAmount"), maxAmount));
    }
    return spec;
  }
}
