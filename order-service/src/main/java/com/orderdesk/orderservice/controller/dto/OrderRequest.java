package com.orderdesk.orderservice.controller.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of an order creation request. Item level rules (known product, active product, quantity at
 * least one) are checked by the order service in item order, after the customer lookup.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OrderRequest {
  @NotNull private Long customerId;
  private List<OrderItemRequest> items;

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class OrderItemRequest {
    private Long productId;
    private Integer quantity;
  }
}
