package com.orderdesk.orderservice.controller;

import com.orderdesk.querysupport.paging.PageResult;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;

import java.util.List;

/** Paged listings return the records as the body and the paging metadata as headers. */
final class PageHeaders {

  static final String TOTAL_COUNT = "X-Total-Count";
  static final String PAGE = "X-Page";
  static final String PAGE_SIZE = "X-Page-Size";
  static final String TOTAL_PAGES = "X-Total-Pages";

  private PageHeaders() {}

  static <T> ResponseEntity<List<T>> ok(PageResult<T> page) {
    HttpHeaders headers = new HttpHeaders();
    headers.add(TOTAL_COUNT, String.valueOf(page.getTotalCount()));
    headers.add(PAGE, String.valueOf(page.getPage()));
    headers.add(PAGE_SIZE, String.valueOf(page.getPageSize()));
    headers.add(TOTAL_PAGES, String.valueOf(page.getTotalPages()));
    return ResponseEntity.ok().headers(headers).body(page.getContent());
  }
}
