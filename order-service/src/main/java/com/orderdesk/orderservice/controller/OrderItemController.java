package com.orderdesk.orderservice.controller;

import com.orderdesk.orderservice.controller.dto.OrderItemDto;
import com.orderdesk.orderservice.controller.dto.QuantityUpdateRequest;
import com.orderdesk.orderservice.controller.mapper.DtoMapper;
import com.orderdesk.orderservice.service.OrderItemService;
import com.orderdesk.orderservice.service.statistics.OrderItemStatistics;
import com.orderdesk.orderservice.service.statistics.ProductSales;
import com.orderdesk.orderservice.service.statistics.SalesStatisticsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/order-items")
public class OrderItemController {

  private static final Logger log = LoggerFactory.getLogger(OrderItemController.class);

  private final OrderItemService orderItemService;
  private final SalesStatisticsService statisticsService;
  private final DtoMapper mapper;

  @Autowired
  public OrderItemController(
      OrderItemService orderItemService,
      SalesStatisticsService statisticsService,
      DtoMapper mapper) {
    this.orderItemService = orderItemService;
    this.statisticsService = statisticsService;
    this.mapper = mapper;
  }

  @GetMapping("/order/{orderId}")
  public List<OrderItemDto> listOrderItems(@PathVariable Long orderId) {
    log.info("Listing items of order {}", orderId);
    return orderItemService.listOrderItems(orderId).stream().map(mapper::toDto).toList();
  }

  @GetMapping("/{id}")
  public OrderItemDto getOrderItem(@PathVariable Long id) {
    log.info("Getting order item {}", id);
    return mapper.toDto(orderItemService.getOrderItem(id));
  }

  // PUT /api/order-items/{id}  Body: {"quantity": 3}
  @PutMapping("/{id}")
  public ResponseEntity<Void> updateQuantity(
      @PathVariable Long id, @RequestBody QuantityUpdateRequest request) {
    log.info("Updating quantity of order item {} to {}", id, request.getQuantity());
    orderItemService.updateQuantity(id, request.getQuantity());
    return ResponseEntity.noContent().build();
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteOrderItem(@PathVariable Long id) {
    log.info("Deleting order item {}", id);
    orderItemService.deleteOrderItem(id);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/product/{productId}/sales")
  public ProductSales getProductSales(
      @PathVariable Long productId,
      @RequestParam(required = false) Instant fromDate,
      @RequestParam(required = false) Instant toDate) {
    log.info("Computing sales of product {} from {} to {}", productId, fromDate, toDate);
    return statisticsService.productSales(productId, fromDate, toDate);
  }

  @GetMapping("/statistics")
  public OrderItemStatistics getStatistics() {
    log.info("Computing order item statistics");
    return statisticsService.orderItemStatistics();
  }
}
