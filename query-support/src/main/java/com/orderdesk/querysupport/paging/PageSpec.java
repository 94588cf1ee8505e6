package com.orderdesk.querysupport.paging;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Normalised paging request. Out-of-range values never fail: a page below 1 becomes 1 and a page
 * size outside [1, {@value #MAX_PAGE_SIZE}] becomes {@value #DEFAULT_PAGE_SIZE}.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class PageSpec {
  public static final int DEFAULT_PAGE = 1;
  public static final int DEFAULT_PAGE_SIZE = 10;
  public static final int MAX_PAGE_SIZE = 100;

  private final int page;
  private final int pageSize;

  private PageSpec(int page, int pageSize) {
    this.page = page;
    this.pageSize = pageSize;
  }

  public static PageSpec of(Integer page, Integer pageSize) {
    int normalisedPage = page == null || page < 1 ? DEFAULT_PAGE : page;
    int normalisedSize =
        pageSize == null || pageSize < 1 || pageSize > MAX_PAGE_SIZE ? DEFAULT_PAGE_SIZE : pageSize;
    return new PageSpec(normalisedPage, normalisedSize);
  }

  /** Zero-based index of the page, as used by Spring Data's PageRequest. */
  public int zeroBasedPage() {
    return page - 1;
  }

  public long offset() {
    return (long) (page - 1) * pageSize;
  }
}
