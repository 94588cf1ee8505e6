package com.orderdesk.orderservice.service;

import lombok.Value;

/** One requested line of a new order. */
@Value
public class OrderLine {
  Long productId;
  Integer quantity;
}
