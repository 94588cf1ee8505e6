package com.orderdesk.orderservice.service.statistics;

import com.orderdesk.orderservice.config.OrderDeskProperties;
import com.orderdesk.orderservice.exception.InvalidInputException;
import com.orderdesk.orderservice.exception.NotFoundException;
import com.orderdesk.orderservice.model.Order;
import com.orderdesk.orderservice.model.OrderItem;
import com.orderdesk.orderservice.model.Product;
import com.orderdesk.orderservice.repository.OrderItemRepository;
import com.orderdesk.orderservice.repository.OrderRepository;
import com.orderdesk.orderservice.repository.ProductRepository;
import com.orderdesk.orderservice.service.RequestGuards;
import com.orderdesk.querysupport.aggregation.Aggregations;
import com.orderdesk.querysupport.aggregation.PeriodBucketer;
import com.orderdesk.querysupport.aggregation.PeriodKey;
import com.orderdesk.querysupport.aggregation.PeriodUnit;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.stream.Collectors;

/** Revenue and sales figures derived from orders and their items. */
@Service
public class SalesStatisticsService {

  private static final Logger log = LoggerFactory.getLogger(SalesStatisticsService.class);

  static final Duration DEFAULT_REVENUE_RANGE = Duration.ofDays(30);

  private final OrderRepository orderRepository;
  private final OrderItemRepository orderItemRepository;
  private final ProductRepository productRepository;
  private final OrderDeskProperties properties;
  private final Clock clock;

  @Autowired
  public SalesStatisticsService(
      OrderRepository orderRepository,
      OrderItemRepository orderItemRepository,
      ProductRepository productRepository,
      OrderDeskProperties properties,
      Clock clock) {
    this.orderRepository = orderRepository;
    this.orderItemRepository = orderItemRepository;
    this.productRepository = productRepository;
    this.properties = properties;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public OrderStatistics orderStatistics() {
    List<Order> orders = orderRepository.findAll();
    Instant now = clock.instant();
    Instant startOfToday =
        LocalDate.ofInstant(now, ZoneOffset.UTC).atStartOfDay().toInstant(ZoneOffset.UTC);
    Instant startOfTomorrow = startOfToday.plus(Duration.ofDays(1));

    BigDecimal revenue = Aggregations.sum(orders, Order::getTotalAmount);
    OrderStatistics.Overview overview =
        new OrderStatistics.Overview(
            orders.size(), revenue, Aggregations.ratio(revenue, orders.size()));

    Instant trendStart = now.atOffset(ZoneOffset.UTC).minusMonths(12).toInstant();
    List<Order> lastYear =
        orders.stream().filter(o -> !o.getOrderDate().isBefore(trendStart)).toList();

    return new OrderStatistics(
        overview,
        window(orders, startOfToday, startOfTomorrow),
        window(orders, startOfToday.minus(Duration.ofDays(7)), null),
        window(orders, startOfToday.minus(Duration.ofDays(30)), null),
        topCustomer(orders),
        revenuePoints(lastYear, PeriodUnit.MONTH));
  }

  @Transactional(readOnly = true)
  public OrderItemStatistics orderItemStatistics() {
    List<OrderItem> items = orderItemRepository.findAll();
    return new OrderItemStatistics(
        items.size(),
        Aggregations.sumLong(items, OrderItem::getQuantity),
        Aggregations.sum(items, OrderItem::getLineTotal),
        Aggregations.average(items, OrderItem::getUnitPrice),
        Aggregations.averageOf(items, OrderItem::getQuantity),
        BestSellers.rank(items, properties.statistics().topN()));
  }

  @Transactional(readOnly = true)
  public ProductSales productSales(Long productId, Instant from, Instant to) {
    RequestGuards.requirePositiveId(productId, "Product id");
    RequestGuards.requireOrdered(from, to);
    Product product =
        productRepository
            .findById(productId)
            .orElseThrow(() -> NotFoundException.of("Product", productId));

    List<OrderItem> items =
        orderItemRepository.findByProductId(productId).stream()
            .filter(i -> from == null || !i.getOrder().getOrderDate().isBefore(from))
            .filter(i -> to == null || !i.getOrder().getOrderDate().isAfter(to))
            .toList();

    long quantity = Aggregations.sumLong(items, OrderItem::getQuantity);
    long orderCount = items.stream().map(i -> i.getOrder().getId()).distinct().count();
    List<Instant> saleDates = items.stream().map(i -> i.getOrder().getOrderDate()).toList();
    Instant firstSale = saleDates.stream().min(Comparator.naturalOrder()).orElse(null);
    Instant lastSale = saleDates.stream().max(Comparator.naturalOrder()).orElse(null);

    return new ProductSales(
        product.getId(),
        product.getName(),
        quantity,
        Aggregations.sum(items, OrderItem::getLineTotal),
        orderCount,
        Aggregations.ratio(quantity, orderCount),
        Aggregations.average(items, OrderItem::getUnitPrice),
        from != null ? from : firstSale,
        to != null ? to : lastSale);
  }

  /**
   * Groups orders placed between {@code from} and {@code to} (inclusive) by day, week or month of
   * their UTC date. Without bounds the last 30 days up to now are reported.
   */
  @Transactional(readOnly = true)
  public RevenueByPeriod revenueByPeriod(Instant from, Instant to, String unit) {
    PeriodUnit periodUnit;
    try {
      periodUnit = PeriodUnit.parse(unit);
    } catch (IllegalArgumentException e) {
      throw new InvalidInputException(e.getMessage());
    }
    Instant now = clock.instant();
    Instant end = to != null ? to : now;
    Instant start = from != null ? from : now.minus(DEFAULT_REVENUE_RANGE);
    RequestGuards.requireOrdered(start, end);

    List<Order> orders = orderRepository.findByOrderDateBetween(start, end);
    log.info(
        "Revenue by {} from {} to {} over {} orders",
        periodUnit.lowerCaseName(),
        start,
        end,
        orders.size());
    return new RevenueByPeriod(
        periodUnit.lowerCaseName(), start, end, revenuePoints(orders, periodUnit));
  }

  private List<RevenuePoint> revenuePoints(Collection<Order> orders, PeriodUnit unit) {
    SortedMap<PeriodKey, List<Order>> buckets =
        PeriodBucketer.group(orders, Order::getOrderDate, unit);
    return buckets.entrySet().stream()
        .map(
            e ->
                new RevenuePoint(
                    e.getKey().label(),
                    e.getValue().size(),
                    Aggregations.sum(e.getValue(), Order::getTotalAmount)))
        .toList();
  }

  @NotNull
  private OrderStatistics.WindowSummary window(List<Order> orders, Instant from, Instant until) {
    List<Order> inWindow =
        orders.stream()
            .filter(o -> !o.getOrderDate().isBefore(from))
            .filter(o -> until == null || o.getOrderDate().isBefore(until))
            .toList();
    return new OrderStatistics.WindowSummary(
        inWindow.size(), Aggregations.sum(inWindow, Order::getTotalAmount));
  }

  private OrderStatistics.TopCustomer topCustomer(List<Order> orders) {
    Map<Long, List<Order>> byCustomer =
        orders.stream().collect(Collectors.groupingBy(o -> o.getCustomer().getId()));
    List<OrderStatistics.TopCustomer> spenders =
        byCustomer.values().stream()
            .map(
                own ->
                    new OrderStatistics.TopCustomer(
                        own.get(0).getCustomer().getId(),
                        own.get(0).getCustomer().getFullName(),
                        own.size(),
                        Aggregations.sum(own, Order::getTotalAmount)))
            .toList();
    return Aggregations.topN(
            spenders,
            OrderStatistics.TopCustomer::getTotalSpent,
            OrderStatistics.TopCustomer::getCustomerId,
            1)
        .stream()
        .findFirst()
        .orElse(null);
  }
}
