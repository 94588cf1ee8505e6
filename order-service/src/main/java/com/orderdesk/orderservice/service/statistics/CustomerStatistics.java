package com.orderdesk.orderservice.service.statistics;

import com.orderdesk.querysupport.aggregation.CountByCategory;
import lombok.Value;

import java.util.List;

@Value
public class CustomerStatistics {
  long totalCustomers;
  long customersWithOrders;
  long customersWithoutOrders;
  List<CountByCategory> topCountries;
}
