package com.orderdesk.orderservice.service.statistics;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class RevenuePoint {
  String period;
  long orderCount;
  BigDecimal revenue;
}
