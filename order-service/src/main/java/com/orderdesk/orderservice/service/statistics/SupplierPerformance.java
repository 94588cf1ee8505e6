package com.orderdesk.orderservice.service.statistics;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class SupplierPerformance {
  SupplierSummary supplier;
  ProductOverview productOverview;
  SalesMetrics salesMetrics;
  List<MonthlySales> salesTrends;
  List<TopProduct> topProducts;

  @Value
  public static class SupplierSummary {
    Long id;
    String companyName;
    String contactName;
    String country;
  }

  @Value
  public static class ProductOverview {
    long totalProducts;
    long activeProducts;
    long discontinuedProducts;
    BigDecimal averageProductPrice;
  }

  @Value
  public static class SalesMetrics {
    long totalQuantitySold;
    BigDecimal totalRevenue;
    long totalOrders;
    BigDecimal averageOrderValue;
  }

  @Value
  public static class MonthlySales {
    String period;
    long quantity;
    BigDecimal revenue;
  }

  @Value
  public static class TopProduct {
    Long productId;
    String name;
    BigDecimal unitPrice;
    boolean discontinued;
    long quantitySold;
    BigDecimal revenue;
  }
}
