package com.orderdesk.orderservice.service.statistics;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Sales of a single product within an optional date range. When no range is requested, {@code
 * from} and {@code to} report the first and last sale.
 */
@Value
public class ProductSales {
  Long productId;
  String productName;
  long totalQuantitySold;
  BigDecimal totalRevenue;
  long orderCount;
  double averageQuantityPerOrder;
  BigDecimal averagePrice;
  Instant from;
  Instant to;
}
