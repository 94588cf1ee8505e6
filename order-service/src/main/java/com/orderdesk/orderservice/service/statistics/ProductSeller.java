package com.orderdesk.orderservice.service.statistics;

import lombok.Value;

import java.math.BigDecimal;

/** Sales of one product summed over order items, used by the best-seller rankings. */
@Value
public class ProductSeller {
  Long productId;
  String productName;
  long totalQuantitySold;
  BigDecimal totalRevenue;
}
