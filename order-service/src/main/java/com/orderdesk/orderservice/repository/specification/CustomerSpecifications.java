package com.orderdesk.orderservice.repository.specification;

import com.orderdesk.orderservice.model.Customer;
import org.springframework.data.jpa.domain.Specification;

public final class CustomerSpecifications {

  private CustomerSpecifications() {}

  public static Specification<Customer> filter(String country, String city, String search) {
    Specification<Customer> spec = Specification.where(null);
    if (SearchTerms.hasText(country)) {
      spec = spec.and((root, query, cb) -> SearchTerms.contains(cb, root.get("country"), country));
    }
    if (SearchTerms.hasText(city)) {
      spec = spec.and((root, query, cb) -> SearchTerms.contains(cb, root.get("city"), city));
    }
    if (SearchTerms.hasText(search)) {
      spec =
          spec.and(
              (root, query, cb) ->
                  cb.or(
                      SearchTerms.contains(cb, root.get("firstName"), search),
                      SearchTerms.contains(cb, root.get("lastName"), search),
                      SearchTerms.contains(cb, root.get("phone"), search)));
    }
    return spec;
  }
}
