package com.orderdesk.orderservice.service;

import com.orderdesk.querysupport.paging.PageResult;
import com.orderdesk.querysupport.paging.PageSpec;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.List;

/** Runs a filtered, sorted query for one page and converts the result to a {@link PageResult}. */
final class PagedQueries {

  private PagedQueries() {}

  static <T> PageResult<T> fetch(
      JpaSpecificationExecutor<T> repository, Specification<T> filter, Sort sort, PageSpec spec) {
    // Offsets past Integer.MAX_VALUE cannot be expressed as a PageRequest and hold no rows.
    if (spec.offset() + spec.getPageSize() > Integer.MAX_VALUE) {
      return PageResult.of(List.of(), repository.count(filter), spec);
    }
    Page<T> page =
        repository.findAll(filter, PageRequest.of(spec.zeroBasedPage(), spec.getPageSize(), sort));
    return PageResult.of(page.getContent(), page.getTotalElements(), spec);
  }
}
