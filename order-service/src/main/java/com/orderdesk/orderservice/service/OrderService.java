package com.orderdesk.orderservice.service;

import com.orderdesk.orderservice.config.OrderDeskProperties;
import com.orderdesk.orderservice.exception.ConflictException;
import com.orderdesk.orderservice.exception.InvalidInputException;
import com.orderdesk.orderservice.exception.InvalidOperationException;
import com.orderdesk.orderservice.exception.NotFoundException;
import com.orderdesk.orderservice.exception.StorageFailureException;
import com.orderdesk.orderservice.model.Customer;
import com.orderdesk.orderservice.model.Order;
import com.orderdesk.orderservice.model.OrderItem;
import com.orderdesk.orderservice.model.Product;
import com.orderdesk.orderservice.repository.CustomerRepository;
import com.orderdesk.orderservice.repository.OrderRepository;
import com.orderdesk.orderservice.repository.ProductRepository;
import com.orderdesk.orderservice.repository.specification.OrderSpecifications;
import com.orderdesk.querysupport.paging.PageResult;
import com.orderdesk.querysupport.paging.PageSpec;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

@Service
public class OrderService {

  private static final Logger log = LoggerFactory.getLogger(OrderService.class);

  static final Sort DEFAULT_SORT =
      Sort.by(Sort.Direction.DESC, "orderDate").and(Sort.by(Sort.Direction.DESC, "id"));

  static final int MAX_RECENT_DAYS = 365;

  private final OrderRepository orderRepository;
  private final CustomerRepository customerRepository;
  private final ProductRepository productRepository;
  private final OrderNumberGenerator orderNumberGenerator;
  private final TransactionTemplate transactionTemplate;
  private final OrderDeskProperties properties;
  private final Clock clock;

  @Autowired
  public OrderService(
      OrderRepository orderRepository,
      CustomerRepository customerRepository,
      ProductRepository productRepository,
      OrderNumberGenerator orderNumberGenerator,
      TransactionTemplate transactionTemplate,
      OrderDeskProperties properties,
      Clock clock) {
    this.orderRepository = orderRepository;
    this.customerRepository = customerRepository;
    this.productRepository = productRepository;
    this.orderNumberGenerator = orderNumberGenerator;
    this.transactionTemplate = transactionTemplate;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Creates an order with its items in one transaction. Each item takes the product's current
   * price; the order total is the exact sum of the line totals.
   *
   * <p>A generated order number can collide with an existing one. The insert is then repeated in a
   * fresh transaction with a new number, up to the configured number of attempts.
   */
  public Order createOrder(Long customerId, List<OrderLine> lines) {
    RequestGuards.requirePositiveId(customerId, "Customer id");
    int attempts = properties.orders().orderNumberAttempts();

    for (int attempt = 1; attempt <= attempts; attempt++) {
      Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
      String orderNumber = orderNumberGenerator.generate(now);
      try {
        Order order =
            transactionTemplate.execute(
                status -> insertOrder(customerId, lines, now, orderNumber));
        log.info(
            "Order {} created with ID: {} for customer {}, total {}",
            order.getOrderNumber(),
            order.getId(),
            customerId,
            order.getTotalAmount());
        return order;
      } catch (DataIntegrityViolationException e) {
        if (!orderRepository.existsByOrderNumber(orderNumber)) {
          log.error("Could not store order for customer {}", customerId, e);
          throw new StorageFailureException("Order could not be stored", e);
        }
        log.warn(
            "Order number {} already taken (attempt {} of {}), retrying",
            orderNumber,
            attempt,
            attempts);
      }
    }
    throw new ConflictException(
        "Could not allocate a unique order number after " + attempts + " attempts");
  }

  @NotNull
  private Order insertOrder(
      Long customerId, List<OrderLine> lines, Instant orderDate, String orderNumber) {
    Customer customer =
        customerRepository
            .findById(customerId)
            .orElseThrow(() -> NotFoundException.of("Customer", customerId));
    if (lines == null || lines.isEmpty()) {
      throw new InvalidInputException("An order must contain at least one item");
    }

    Order order = new Order();
    order.setCustomer(customer);
    order.setOrderDate(orderDate);
    order.setOrderNumber(orderNumber);
    order.setTotalAmount(BigDecimal.ZERO);

    for (OrderLine line : lines) {
      Long productId = line.getProductId();
      RequestGuards.requirePositiveId(productId, "Product id");
      Product product =
          productRepository
              .findById(productId)
              .orElseThrow(() -> NotFoundException.of("Product", productId));
      if (product.isDiscontinued()) {
        log.warn("Rejecting order for customer {}: product {} is discontinued", customerId, productId);
        throw new InvalidOperationException(
            "Product '" + product.getName() + "' (id " + productId + ") is discontinued");
      }
      int quantity = RequestGuards.requireQuantity(line.getQuantity());
      order.addOrderItem(new OrderItem(product, quantity));
    }

    return orderRepository.saveAndFlush(order);
  }

  @Transactional(readOnly = true)
  public Order getOrder(Long id) {
    RequestGuards.requirePositiveId(id, "Order id");
    return orderRepository.findById(id).orElseThrow(() -> NotFoundException.of("Order", id));
  }

  @Transactional(readOnly = true)
  public Order getOrderByNumber(String orderNumber) {
    if (orderNumber == null || orderNumber.isBlank()) {
      throw new InvalidInputException("Order number is required");
    }
    String trimmed = orderNumber.trim();
    return orderRepository
        .findByOrderNumber(trimmed)
        .orElseThrow(() -> new NotFoundException("Order not found with number: " + trimmed));
  }

  @Transactional(readOnly = true)
  public PageResult<Order> listOrders(
      Long customerId,
      Instant fromDate,
      Instant toDate,
      BigDecimal minAmount,
      BigDecimal maxAmount,
      PageSpec page) {
    if (customerId != null) {
      RequestGuards.requirePositiveId(customerId, "customerId");
    }
    RequestGuards.requireOrdered(fromDate, toDate);
    RequestGuards.requireNonNegative(minAmount, "minAmount");
    RequestGuards.requireNonNegative(maxAmount, "maxAmount");
    RequestGuards.requireOrdered(minAmount, maxAmount, "minAmount", "maxAmount");
    return PagedQueries.fetch(
        orderRepository,
        OrderSpecifications.filter(customerId, fromDate, toDate, minAmount, maxAmount),
        DEFAULT_SORT,
        page);
  }

  @Transactional(readOnly = true)
  public List<Order> listOrdersByCustomer(Long customerId) {
    RequestGuards.requirePositiveId(customerId, "Customer id");
    if (!customerRepository.existsById(customerId)) {
      throw NotFoundException.of("Customer", customerId);
    }
    return orderRepository.findByCustomerId(customerId, DEFAULT_SORT);
  }

  /** Newest orders placed within the last {@code days} days, capped by the configured limit. */
  @Transactional(readOnly = true)
  public List<Order> listRecentOrders(int days) {
    if (days < 1 || days > MAX_RECENT_DAYS) {
      throw new InvalidInputException("Days must be between 1 and " + MAX_RECENT_DAYS);
    }
    Instant since = clock.instant().minus(Duration.ofDays(days));
    return orderRepository.findByOrderDateGreaterThanEqual(
        since, PageRequest.of(0, properties.orders().recentLimit(), DEFAULT_SORT));
  }

  /** Deletes an order together with its items while it is still inside the edit window. */
  public void deleteOrder(Long id) {
    RequestGuards.requirePositiveId(id, "Order id");
    ConcurrentWrites.runWithConflictCheck(
        "Order",
        id,
        () -> orderRepository.existsById(id),
        () ->
            transactionTemplate.executeWithoutResult(
                status -> {
                  Order order = getOrder(id);
                  requireEditable(order);
                  orderRepository.delete(order);
                  orderRepository.flush();
                  log.info("Order {} deleted with {} items", id, order.getOrderItems().size());
                }));
  }

  public void requireEditable(Order order) {
    Duration editWindow = properties.orders().editWindow();
    if (!order.isEditableAt(clock.instant(), editWindow)) {
      log.warn("Order {} is outside its edit window", order.getId());
      throw new InvalidOperationException(
          "Order "
              + order.getOrderNumber()
              + " can no longer be modified: it was placed more than "
              + editWindow.toHours()
              + " hours ago");
    }
  }
}
