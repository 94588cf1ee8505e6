package com.orderdesk.orderservice.service.statistics;

import com.orderdesk.orderservice.config.OrderDeskProperties;
import com.orderdesk.orderservice.exception.NotFoundException;
import com.orderdesk.orderservice.model.Customer;
import com.orderdesk.orderservice.model.OrderItem;
import com.orderdesk.orderservice.model.Product;
import com.orderdesk.orderservice.model.Supplier;
import com.orderdesk.orderservice.repository.CustomerRepository;
import com.orderdesk.orderservice.repository.OrderItemRepository;
import com.orderdesk.orderservice.repository.OrderRepository;
import com.orderdesk.orderservice.repository.ProductRepository;
import com.orderdesk.orderservice.repository.SupplierRepository;
import com.orderdesk.orderservice.service.RequestGuards;
import com.orderdesk.querysupport.aggregation.Aggregations;
import com.orderdesk.querysupport.aggregation.PeriodBucketer;
import com.orderdesk.querysupport.aggregation.PeriodKey;
import com.orderdesk.querysupport.aggregation.PeriodUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.stream.Collectors;

/** Statistics over the customer, supplier and product directories. */
@Service
public class DirectoryStatisticsService {

  private static final Logger log = LoggerFactory.getLogger(DirectoryStatisticsService.class);

  private final CustomerRepository customerRepository;
  private final SupplierRepository supplierRepository;
  private final ProductRepository productRepository;
  private final OrderRepository orderRepository;
  private final OrderItemRepository orderItemRepository;
  private final OrderDeskProperties properties;
  private final Clock clock;

  @Autowired
  public DirectoryStatisticsService(
      CustomerRepository customerRepository,
      SupplierRepository supplierRepository,
      ProductRepository productRepository,
      OrderRepository orderRepository,
      OrderItemRepository orderItemRepository,
      OrderDeskProperties properties,
      Clock clock) {
    this.customerRepository = customerRepository;
    this.supplierRepository = supplierRepository;
    this.productRepository = productRepository;
    this.orderRepository = orderRepository;
    this.orderItemRepository = orderItemRepository;
    this.properties = properties;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public CustomerStatistics customerStatistics() {
    List<Customer> customers = customerRepository.findAll();
    Set<Long> withOrders =
        orderRepository.findAll().stream()
            .map(order -> order.getCustomer().getId())
            .collect(Collectors.toSet());
    log.debug("Computing customer statistics over {} customers", customers.size());
    return new CustomerStatistics(
        customers.size(),
        withOrders.size(),
        customers.size() - withOrders.size(),
        Aggregations.countByCategory(customers, Customer::getCountry, topN()));
  }

  @Transactional(readOnly = true)
  public SupplierStatistics supplierStatistics() {
    List<Supplier> suppliers = supplierRepository.findAll();
    List<Product> products = productRepository.findAll();
    Map<Long, List<Product>> productsBySupplier =
        products.stream().collect(Collectors.groupingBy(p -> p.getSupplier().getId()));
    long withActive =
        productsBySupplier.values().stream()
            .filter(list -> list.stream().anyMatch(p -> !p.isDiscontinued()))
            .count();

    SupplierStatistics.Overview overview =
        new SupplierStatistics.Overview(
            suppliers.size(),
            productsBySupplier.size(),
            suppliers.size() - productsBySupplier.size(),
            withActive);

    List<SupplierStatistics.ProductCount> productCounts = new ArrayList<>();
    for (Supplier supplier : suppliers) {
      List<Product> own = productsBySupplier.getOrDefault(supplier.getId(), List.of());
      if (own.isEmpty()) {
        continue;
      }
      productCounts.add(
          new SupplierStatistics.ProductCount(
              supplier.getId(),
              supplier.getCompanyName(),
              supplier.getCountry(),
              own.size(),
              own.stream().filter(p -> !p.isDiscontinued()).count()));
    }

    Map<Long, List<OrderItem>> itemsBySupplier =
        orderItemRepository.findAll().stream()
            .collect(Collectors.groupingBy(i -> i.getProduct().getSupplier().getId()));
    List<SupplierStatistics.Revenue> revenues = new ArrayList<>();
    for (Supplier supplier : suppliers) {
      BigDecimal revenue =
          Aggregations.sum(
              itemsBySupplier.getOrDefault(supplier.getId(), List.of()), OrderItem::getLineTotal);
      if (revenue.signum() > 0) {
        revenues.add(
            new SupplierStatistics.Revenue(supplier.getId(), supplier.getCompanyName(), revenue));
      }
    }

    return new SupplierStatistics(
        overview,
        Aggregations.countByCategory(suppliers, Supplier::getCountry, topN()),
        Aggregations.topN(
            productCounts,
            SupplierStatistics.ProductCount::getTotalProducts,
            SupplierStatistics.ProductCount::getSupplierId,
            topN()),
        Aggregations.topN(
            revenues,
            SupplierStatistics.Revenue::getTotalRevenue,
            SupplierStatistics.Revenue::getSupplierId,
            topN()));
  }

  @Transactional(readOnly = true)
  public SupplierPerformance supplierPerformance(Long supplierId) {
    RequestGuards.requirePositiveId(supplierId, "Supplier id");
    Supplier supplier =
        supplierRepository
            .findById(supplierId)
            .orElseThrow(() -> NotFoundException.of("Supplier", supplierId));
    List<Product> products = productRepository.findBySupplierId(supplierId, Sort.by("id"));
    List<OrderItem> items = orderItemRepository.findByProductSupplierId(supplierId);

    long active = products.stream().filter(p -> !p.isDiscontinued()).count();
    SupplierPerformance.ProductOverview productOverview =
        new SupplierPerformance.ProductOverview(
            products.size(),
            active,
            products.size() - active,
            Aggregations.average(products, Product::getUnitPrice));

    BigDecimal revenue = Aggregations.sum(items, OrderItem::getLineTotal);
    long orderCount = items.stream().map(i -> i.getOrder().getId()).distinct().count();
    SupplierPerformance.SalesMetrics salesMetrics =
        new SupplierPerformance.SalesMetrics(
            Aggregations.sumLong(items, OrderItem::getQuantity),
            revenue,
            orderCount,
            Aggregations.ratio(revenue, orderCount));

    Instant trendStart = clock.instant().atOffset(ZoneOffset.UTC).minusMonths(12).toInstant();
    List<OrderItem> recentItems =
        items.stream().filter(i -> !i.getOrder().getOrderDate().isBefore(trendStart)).toList();
    SortedMap<PeriodKey, List<OrderItem>> byMonth =
        PeriodBucketer.group(recentItems, i -> i.getOrder().getOrderDate(), PeriodUnit.MONTH);
    List<SupplierPerformance.MonthlySales> trends =
        byMonth.entrySet().stream()
            .map(
                e ->
                    new SupplierPerformance.MonthlySales(
                        e.getKey().label(),
                        Aggregations.sumLong(e.getValue(), OrderItem::getQuantity),
                        Aggregations.sum(e.getValue(), OrderItem::getLineTotal)))
            .toList();

    List<SupplierPerformance.TopProduct> topProducts =
        BestSellers.rank(items, topN()).stream()
            .map(seller -> toTopProduct(seller, products))
            .toList();

    log.info("Computed performance of supplier {} over {} order items", supplierId, items.size());
    return new SupplierPerformance(
        new SupplierPerformance.SupplierSummary(
            supplier.getId(),
            supplier.getCompanyName(),
            supplier.getContactName(),
            supplier.getCountry()),
        productOverview,
        salesMetrics,
        trends,
        topProducts);
  }

  @Transactional(readOnly = true)
  public ProductStatistics productStatistics() {
    List<Product> products = productRepository.findAll();
    long active = products.stream().filter(p -> !p.isDiscontinued()).count();
    ProductStatistics.Overview overview =
        new ProductStatistics.Overview(
            products.size(),
            active,
            products.size() - active,
            Aggregations.average(products, Product::getUnitPrice));

    // Ties on price go to the lowest id
    ProductStatistics.PricedProduct mostExpensive =
        products.stream()
            .min(
                Comparator.comparing(Product::getUnitPrice)
                    .reversed()
                    .thenComparing(Product::getId))
            .map(this::toPricedProduct)
            .orElse(null);
    ProductStatistics.PricedProduct cheapest =
        products.stream()
            .min(Comparator.comparing(Product::getUnitPrice).thenComparing(Product::getId))
            .map(this::toPricedProduct)
            .orElse(null);

    Map<Long, List<Product>> bySupplierId =
        products.stream().collect(Collectors.groupingBy(p -> p.getSupplier().getId()));
    List<ProductStatistics.SupplierBreakdown> breakdown =
        bySupplierId.values().stream()
            .map(
                own ->
                    new ProductStatistics.SupplierBreakdown(
                        own.get(0).getSupplier().getId(),
                        own.get(0).getSupplier().getCompanyName(),
                        own.size(),
                        own.stream().filter(p -> !p.isDiscontinued()).count(),
                        Aggregations.average(own, Product::getUnitPrice)))
            .sorted(
                Comparator.comparingLong(ProductStatistics.SupplierBreakdown::getProductCount)
                    .reversed()
                    .thenComparing(ProductStatistics.SupplierBreakdown::getSupplierId))
            .toList();

    return new ProductStatistics(
        overview,
        mostExpensive,
        cheapest,
        breakdown,
        BestSellers.rank(orderItemRepository.findAll(), topN()));
  }

  private ProductStatistics.PricedProduct toPricedProduct(Product product) {
    return new ProductStatistics.PricedProduct(
        product.getId(), product.getName(), product.getUnitPrice());
  }

  private SupplierPerformance.TopProduct toTopProduct(
      ProductSeller seller, List<Product> products) {
    Product product =
        products.stream()
            .filter(p -> p.getId().equals(seller.getProductId()))
            .findFirst()
            .orElseThrow(
                () -> new IllegalStateException("Unknown product " + seller.getProductId()));
    return new SupplierPerformance.TopProduct(
        product.getId(),
        product.getName(),
        product.getUnitPrice(),
        product.isDiscontinued(),
        seller.getTotalQuantitySold(),
        seller.getTotalRevenue());
  }

  private int topN() {
    return properties.statistics().topN();
  }
}
