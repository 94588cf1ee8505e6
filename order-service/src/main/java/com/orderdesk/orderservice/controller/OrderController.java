package com.orderdesk.orderservice.controller;

import com.orderdesk.orderservice.controller.dto.OrderDto;
import com.orderdesk.orderservice.controller.dto.OrderRequest;
import com.orderdesk.orderservice.controller.mapper.DtoMapper;
import com.orderdesk.orderservice.model.Order;
import com.orderdesk.orderservice.service.OrderService;
import com.orderdesk.orderservice.service.statistics.OrderStatistics;
import com.orderdesk.orderservice.service.statistics.RevenueByPeriod;
import com.orderdesk.orderservice.service.statistics.SalesStatisticsService;
import com.orderdesk.querysupport.paging.PageSpec;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/orders")
public class OrderController {

  private static final Logger log = LoggerFactory.getLogger(OrderController.class);

  private final OrderService orderService;
  private final SalesStatisticsService statisticsService;
  private final DtoMapper mapper;

  @Autowired
  public OrderController(
      OrderService orderService, SalesStatisticsService statisticsService, DtoMapper mapper) {
    this.orderService = orderService;
    this.statisticsService = statisticsService;
    this.mapper = mapper;
    log.info("OrderController initialized.");
  }

  @GetMapping
  public ResponseEntity<List<OrderDto>> listOrders(
      @RequestParam(required = false) Long customerId,
      @RequestParam(required = false) Instant fromDate,
      @RequestParam(required = false) Instant toDate,
      @RequestParam(required = false) BigDecimal minAmount,
      @RequestParam(required = false) BigDecimal maxAmount,
      @RequestParam(required = false) Integer page,
      @RequestParam(required = false) Integer pageSize) {
    log.info(
        "Listing orders customerId={}, dates=[{}, {}], amounts=[{}, {}], page={}",
        customerId,
        fromDate,
        toDate,
        minAmount,
        maxAmount,
        page);
    return PageHeaders.ok(
        orderService
            .listOrders(
                customerId, fromDate, toDate, minAmount, maxAmount, PageSpec.of(page, pageSize))
            .map(mapper::toDto));
  }

  @GetMapping("/{id}")
  public OrderDto getOrder(@PathVariable Long id) {
    log.info("Received request to get order with ID: {}", id);
    return mapper.toDto(orderService.getOrder(id));
  }

  @GetMapping("/number/{orderNumber}")
  public OrderDto getOrderByNumber(@PathVariable String orderNumber) {
    log.info("Received request to get order with number: {}", orderNumber);
    return mapper.toDto(orderService.getOrderByNumber(orderNumber));
  }

  @GetMapping("/customer/{customerId}")
  public List<OrderDto> listOrdersByCustomer(@PathVariable Long customerId) {
    return orderService.listOrdersByCustomer(customerId).stream().map(mapper::toDto).toList();
  }

  @GetMapping("/recent")
  public List<OrderDto> listRecentOrders(@RequestParam(defaultValue = "7") int days) {
    log.info("Listing orders of the last {} days", days);
    return orderService.listRecentOrders(days).stream().map(mapper::toDto).toList();
  }

  /**
   * POST /api/orders Body: {"customerId": 1, "items": [{"productId": 3, "quantity": 2}]}. Prices
   * are taken from the catalogue, never from the request.
   */
  @PostMapping
  public ResponseEntity<OrderDto> createOrder(@Valid @RequestBody OrderRequest request) {
    log.info("Received order creation request for customerId: {}", request.getCustomerId());
    Order order = orderService.createOrder(request.getCustomerId(), mapper.toOrderLines(request));
    return ResponseEntity.created(URI.create("/api/orders/" + order.getId()))
        .body(mapper.toDto(order));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteOrder(@PathVariable Long id) {
    log.info("Received request to delete order {}", id);
    orderService.deleteOrder(id);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/statistics")
  public OrderStatistics getStatistics() {
    log.info("Computing order statistics");
    return statisticsService.orderStatistics();
  }

  /** GET /api/orders/revenue-by-period?fromDate=...&toDate=...&period=day|week|month */
  @GetMapping("/revenue-by-period")
  public RevenueByPeriod getRevenueByPeriod(
      @RequestParam(required = false) Instant fromDate,
      @RequestParam(required = false) Instant toDate,
      @RequestParam(defaultValue = "day") String period) {
    log.info("Revenue by {} from {} to {}", period, fromDate, toDate);
    return statisticsService.revenueByPeriod(fromDate, toDate, period);
  }
}
