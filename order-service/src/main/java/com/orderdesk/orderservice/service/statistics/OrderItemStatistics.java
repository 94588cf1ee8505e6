package com.orderdesk.orderservice.service.statistics;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class OrderItemStatistics {
  long totalOrderItems;
  long totalQuantitySold;
  BigDecimal totalRevenue;
  BigDecimal averagePrice;
  double averageQuantityPerItem;
  List<ProductSeller> topSellingProducts;
}
