package com.orderdesk.orderservice.service.statistics;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/** Order count and revenue per calendar bucket, oldest bucket first. */
@Value
public class RevenueByPeriod {
  String unit;
  Instant from;
  Instant to;
  List<RevenuePoint> data;
}
