package com.orderdesk.querysupport.paging;

import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.function.Function;

/** One page of records plus the metadata a client needs to walk the rest. */
@Getter
@ToString
public final class PageResult<T> {
  private final List<T> content;
  private final long totalCount;
  private final int page;
  private final int pageSize;
  private final int totalPages;

  private PageResult(List<T> content, long totalCount, int page, int pageSize) {
    this.content = List.copyOf(content);
    this.totalCount = totalCount;
    this.page = page;
    this.pageSize = pageSize;
    this.totalPages = totalPages(totalCount, pageSize);
  }

  public static <T> PageResult<T> of(List<T> content, long totalCount, PageSpec spec) {
    if (totalCount < 0) {
      throw new IllegalArgumentException("totalCount must not be negative: " + totalCount);
    }
    return new PageResult<>(content, totalCount, spec.getPage(), spec.getPageSize());
  }

  /** Slices an already sorted in-memory list. */
  public static <T> PageResult<T> slice(List<T> sorted, PageSpec spec) {
    long offset = spec.offset();
    if (offset >= sorted.size()) {
      return of(List.of(), sorted.size(), spec);
    }
    int from = (int) offset;
    int to = Math.min(sorted.size(), from + spec.getPageSize());
    return of(sorted.subList(from, to), sorted.size(), spec);
  }

  public static int totalPages(long totalCount, int pageSize) {
    return (int) ((totalCount + pageSize - 1) / pageSize);
  }

  public <R> PageResult<R> map(Function<? super T, ? extends R> mapper) {
    List<R> mapped = content.stream().<R>map(mapper).toList();
    return new PageResult<>(mapped, totalCount, page, pageSize);
  }

  public boolean isEmpty() {
    return content.isEmpty();
  }
}
