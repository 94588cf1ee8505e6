package com.orderdesk.orderservice.service.statistics;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class OrderStatistics {
  Overview overview;
  WindowSummary today;
  WindowSummary last7Days;
  WindowSummary last30Days;
  TopCustomer topCustomer;
  List<RevenuePoint> monthlyTrends;

  @Value
  public static class Overview {
    long totalOrders;
    BigDecimal totalRevenue;
    BigDecimal averageOrderValue;
  }

  @Value
  public static class WindowSummary {
    long orders;
    BigDecimal revenue;
  }

  @Value
  public static class TopCustomer {
    Long customerId;
    String customerName;
    long totalOrders;
    BigDecimal totalSpent;
  }
}
