package com.orderdesk.orderservice.service.statistics;

import com.orderdesk.querysupport.aggregation.CountByCategory;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class SupplierStatistics {
  Overview overview;
  List<CountByCategory> topCountries;
  List<ProductCount> topSuppliersByProductCount;
  List<Revenue> topSuppliersByRevenue;

  @Value
  public static class Overview {
    long totalSuppliers;
    long suppliersWithProducts;
    long suppliersWithoutProducts;
    long suppliersWithActiveProducts;
  }

  @Value
  public static class ProductCount {
    Long supplierId;
    String companyName;
    String country;
    long totalProducts;
    long activeProducts;
  }

  @Value
  public static class Revenue {
    Long supplierId;
    String companyName;
    BigDecimal totalRevenue;
  }
}
