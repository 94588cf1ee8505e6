package com.orderdesk.orderservice.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OrderDto {
  private Long id;
  private String orderNumber;
  private Instant orderDate;
  private Long customerId;
  private String customerName;
  private BigDecimal totalAmount;
  private List<OrderItemDto> items;
}
