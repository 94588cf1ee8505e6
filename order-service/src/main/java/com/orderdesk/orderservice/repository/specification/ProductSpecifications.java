package com.orderdesk.orderservice.repository.specification;

import com.orderdesk.orderservice.model.Product;
import com.orderdesk.orderservice.model.Supplier;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.JoinType;
import org.springframework.data.jpa.domain.Specification;

import java.math.BigDecimal;

public final class ProductSpecifications {

  private ProductSpecifications() {}

  public static Specification<Product> filter(
      Long supplierId,
      BigDecimal minPrice,
      BigDecimal maxPrice,
      Boolean discontinued,
      String search) {
    Specification<Product> spec = Specification.where(null);
    if (supplierId != null) {
      spec = spec.and((root, query, cb) -> cb.equal(root.get("supplier").get("id"), supplierId));
    }
    if (minPrice != null) {
      spec =
          spec.and(
              (root, query, cb) -> cb.greaterThanOrEqualTo(root.get("unitPrice"), minPrice));
    }
    if (maxPrice != null) {
      spec = spec.and((root, query, cb) -> cb.lessThanOrEqualTo(root.get("unitPrice"), maxPrice));
    }
    if (discontinued != null) {
      spec = spec.and((root, query, cb) -> cb.equal(root.get("discontinued"), discontinued));
    }
    if (SearchTerms.hasText(search)) {
      spec = spec.and(matching(search));
    }
    return spec;
  }

  /** Name, packaging or supplier company name contains the term. */
  public static Specification<Product> matching(String term) {
    return (root, query, cb) -> {
      Join<Product, Supplier> supplier = root.join("supplier", JoinType.INNER);
      return cb.or(
          SearchTerms.contains(cb, root.get("name"), term),
          SearchTerms.contains(cb, root.get("packaging"), term),
          SearchTerms.contains(cb, supplier.get("companyName"), term));
    };
  }
}
