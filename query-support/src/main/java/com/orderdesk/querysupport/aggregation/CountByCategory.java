package com.orderdesk.querysupport.aggregation;

import lombok.Value;

/** Number of records sharing one category value, e.g. customers per country. */
@Value
public class CountByCategory {
  String category;
  long count;
}
