package com.orderdesk.orderservice.repository.specification;

import com.orderdesk.orderservice.model.Supplier;
import org.springframework.data.jpa.domain.Specification;

public final class SupplierSpecifications {

  private SupplierSpecifications() {}

  public static Specification<Supplier> filter(String country, String city, String search) {
    Specification<Supplier> spec = Specification.where(null);
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
                      SearchTerms.contains(cb, root.get("companyName"), search),
                      SearchTerms.contains(cb, root.get("contactName"), search),
                      SearchTerms.contains(cb, root.get("phone"), search)));
    }
    return spec;
  }

  /** Wider match used by the search endpoint: also looks at city and country. */
  public static Specification<Supplier> matching(String term) {
    return (root, query, cb) ->
        cb.or(
            SearchTerms.contains(cb, root.get("companyName"), term),
            SearchTerms.contains(cb, root.get("contactName"), term),
            SearchTerms.contains(cb, root.get("phone"), term),
            SearchTerms.contains(cb, root.get("city"), term),
            SearchTerms.contains(cb, root.get("country"), term));
  }
}
