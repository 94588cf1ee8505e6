package com.orderdesk.orderservice.service.statistics;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class ProductStatistics {
  Overview overview;
  PricedProduct mostExpensive;
  PricedProduct cheapest;
  List<SupplierBreakdown> bySupplier;
  List<ProductSeller> topSelling;

  @Value
  public static class Overview {
    long totalProducts;
    long activeProducts;
    long discontinuedProducts;
    BigDecimal averagePrice;
  }

  @Value
  public static class PricedProduct {
    Long productId;
    String name;
    BigDecimal unitPrice;
  }

  @Value
  public static class SupplierBreakdown {
    Long supplierId;
    String supplierName;
    long productCount;
    long activeCount;
    BigDecimal averagePrice;
  }
}
