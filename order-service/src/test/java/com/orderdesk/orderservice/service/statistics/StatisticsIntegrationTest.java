package com.orderdesk.orderservice.service.statistics;

import com.orderdesk.orderservice.exception.InvalidInputException;
import com.orderdesk.orderservice.exception.NotFoundException;
import com.orderdesk.orderservice.model.Customer;
import com.orderdesk.orderservice.model.Product;
import com.orderdesk.orderservice.model.Supplier;
import com.orderdesk.orderservice.service.OrderLine;
import com.orderdesk.orderservice.service.OrderService;
import com.orderdesk.orderservice.support.IntegrationTestSupport;
import com.orderdesk.querysupport.aggregation.CountByCategory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class StatisticsIntegrationTest extends IntegrationTestSupport {

  @Autowired private OrderService orderService;

  @Autowired private SalesStatisticsService salesStatistics;

  @Autowired private DirectoryStatisticsService directoryStatistics;

  @Test
  void emptyStore_shouldYieldZerosNotNulls() {
    OrderStatistics orders = salesStatistics.orderStatistics();
    assertThat(orders.getOverview().getTotalOrders()).isZero();
    assertThat(orders.getOverview().getTotalRevenue()).isEqualByComparingTo("0");
    assertThat(orders.getOverview().getAverageOrderValue()).isEqualByComparingTo("0");
    assertThat(orders.getTopCustomer()).isNull();
    assertThat(orders.getMonthlyTrends()).isEmpty();

    OrderItemStatistics items = salesStatistics.orderItemStatistics();
    assertThat(items.getAveragePrice()).isEqualByComparingTo("0");
    assertThat(items.getAverageQuantityPerItem()).isZero();

    ProductStatistics products = directoryStatistics.productStatistics();
    assertThat(products.getOverview().getAveragePrice()).isEqualByComparingTo("0");
    assertThat(products.getMostExpensive()).isNull();
    assertThat(products.getCheapest()).isNull();
  }

  @Test
  void revenueByWeek_shouldStayOrderedAcrossNewYear() {
    Customer customer = customer("Ada", "Lovelace", "UK");
    Product product = product("Coffee", supplier("Beans Ltd", "UK"), "10.00");
    placeOrderAt("2024-12-30T10:00:00Z", customer, product, 1);
    placeOrderAt("2024-12-31T23:00:00Z", customer, product, 2);
    placeOrderAt("2025-01-02T08:00:00Z", customer, product, 3);

    RevenueByPeriod weekly =
        salesStatistics.revenueByPeriod(
            Instant.parse("2024-12-01T00:00:00Z"), Instant.parse("2025-01-31T00:00:00Z"), "WEEK");

    assertThat(weekly.getUnit()).isEqualTo("week");
    assertThat(weekly.getData()).extracting(RevenuePoint::getPeriod)
        .containsExactly("2024-W53", "2025-W01");
    assertThat(weekly.getData().get(0).getOrderCount()).isEqualTo(2);
    assertThat(weekly.getData().get(0).getRevenue()).isEqualByComparingTo("30.00");
    assertThat(weekly.getData().get(1).getRevenue()).isEqualByComparingTo("30.00");

    RevenueByPeriod monthly =
        salesStatistics.revenueByPeriod(
            Instant.parse("2024-12-01T00:00:00Z"), Instant.parse("2025-01-31T00:00:00Z"), "month");
    assertThat(monthly.getData()).extracting(RevenuePoint::getPeriod)
        .containsExactly("2024-12", "2025-01");
  }

  @Test
  void revenueByPeriod_shouldValidateArguments() {
    assertThatThrownBy(() -> salesStatistics.revenueByPeriod(null, null, "year"))
        .isInstanceOf(InvalidInputException.class);
    assertThatThrownBy(
            () ->
                salesStatistics.revenueByPeriod(
                    Instant.parse("2025-02-01T00:00:00Z"), Instant.parse("2025-01-01T00:00:00Z"), "day"))
        .isInstanceOf(InvalidInputException.class);

    RevenueByPeriod defaults = salesStatistics.revenueByPeriod(null, null, null);
    assertThat(defaults.getUnit()).isEqualTo("day");
    assertThat(defaults.getTo()).isEqualTo(clock.instant());
    assertThat(defaults.getData()).isEmpty();
  }

  @Test
  void orderStatistics_shouldSplitTimeWindowsAndPickTopCustomer() {
    Customer ada = customer("Ada", "Lovelace", "UK");
    Customer alan = customer("Alan", "Turing", "UK");
    Product product = product("Coffee", supplier("Beans Ltd", "UK"), "10.00");
    placeOrderAt("2025-06-15T01:00:00Z", ada, product, 1);
    placeOrderAt("2025-06-12T10:00:00Z", alan, product, 2);
    placeOrderAt("2025-05-25T10:00:00Z", alan, product, 3);
    placeOrderAt("2024-01-10T10:00:00Z", ada, product, 1);
    clock.set(Instant.parse("2025-06-15T12:00:00Z"));

    OrderStatistics stats = salesStatistics.orderStatistics();

    assertThat(stats.getOverview().getTotalOrders()).isEqualTo(4);
    assertThat(stats.getOverview().getTotalRevenue()).isEqualByComparingTo("70.00");
    assertThat(stats.getOverview().getAverageOrderValue()).isEqualByComparingTo("17.50");
    assertThat(stats.getToday().getOrders()).isEqualTo(1);
    assertThat(stats.getLast7Days().getOrders()).isEqualTo(2);
    assertThat(stats.getLast30Days().getRevenue()).isEqualByComparingTo("60.00");
    assertThat(stats.getTopCustomer().getCustomerName()).isEqualTo("Alan Turing");
    assertThat(stats.getTopCustomer().getTotalSpent()).isEqualByComparingTo("50.00");
    assertThat(stats.getMonthlyTrends()).extracting(RevenuePoint::getPeriod)
        .containsExactly("2025-05", "2025-06");
  }

  @Test
  void productSalesAndBestSellers_shouldAggregateItems() {
    Customer customer = customer("Ada", "Lovelace", "UK");
    Supplier supplier = supplier("Beans Ltd", "UK");
    Product coffee = product("Coffee", supplier, "10.00");
    Product tea = product("Tea", supplier, "4.00");
    Product cocoa = product("Cocoa", supplier, "6.00");
    placeOrderAt("2025-06-10T10:00:00Z", customer, coffee, 2);
    orderService.createOrder(
        customer.getId(), List.of(new OrderLine(coffee.getId(), 1), new OrderLine(tea.getId(), 3)));

    ProductSales coffeeSales = salesStatistics.productSales(coffee.getId(), null, null);
    assertThat(coffeeSales.getTotalQuantitySold()).isEqualTo(3);
    assertThat(coffeeSales.getTotalRevenue()).isEqualByComparingTo("30.00");
    assertThat(coffeeSales.getOrderCount()).isEqualTo(2);
    assertThat(coffeeSales.getAverageQuantityPerOrder()).isEqualTo(1.5);
    assertThat(coffeeSales.getFrom()).isEqualTo(Instant.parse("2025-06-10T10:00:00Z"));

    ProductSales cocoaSales = salesStatistics.productSales(cocoa.getId(), null, null);
    assertThat(cocoaSales.getTotalQuantitySold()).isZero();
    assertThat(cocoaSales.getTotalRevenue()).isEqualByComparingTo("0");
    assertThat(cocoaSales.getAverageQuantityPerOrder()).isZero();
    assertThatThrownBy(() -> salesStatistics.productSales(999_999L, null, null))
        .isInstanceOf(NotFoundException.class);

    // coffee and tea both sold 3: the lower id ranks first
    OrderItemStatistics itemStats = salesStatistics.orderItemStatistics();
    assertThat(itemStats.getTotalOrderItems()).isEqualTo(3);
    assertThat(itemStats.getTopSellingProducts()).extracting(ProductSeller::getProductName)
        .containsExactly("Coffee", "Tea");
  }

  @Test
  void directoryStatistics_shouldCountCategoriesAndRankSuppliers() {
    Customer buyer = customer("Ada", "Lovelace", "UK");
    customer("Hans", "Muster", "Germany");
    customer("Erika", "Muster", "Germany");
    Supplier big = supplier("Big Co", "USA");
    Supplier small = supplier("Small Co", "UK");
    supplier("Empty Co", "UK");
    Product one = product("One", big, "5.00");
    product("Two", big, "15.00");
    discontinuedProduct("Three", small, "1.00");
    placeOrderAt("2025-06-14T10:00:00Z", buyer, one, 2);

    CustomerStatistics customers = directoryStatistics.customerStatistics();
    assertThat(customers.getTotalCustomers()).isEqualTo(3);
    assertThat(customers.getCustomersWithOrders()).isEqualTo(1);
    assertThat(customers.getTopCountries())
        .containsExactly(new CountByCategory("Germany", 2), new CountByCategory("UK", 1));

    SupplierStatistics suppliers = directoryStatistics.supplierStatistics();
    assertThat(suppliers.getOverview().getSuppliersWithProducts()).isEqualTo(2);
    assertThat(suppliers.getOverview().getSuppliersWithoutProducts()).isEqualTo(1);
    assertThat(suppliers.getOverview().getSuppliersWithActiveProducts()).isEqualTo(1);
    assertThat(suppliers.getTopSuppliersByProductCount())
        .extracting(SupplierStatistics.ProductCount::getCompanyName)
        .containsExactly("Big Co", "Small Co");
    assertThat(suppliers.getTopSuppliersByRevenue()).singleElement()
        .satisfies(r -> assertThat(r.getTotalRevenue()).isEqualByComparingTo("10.00"));

    SupplierPerformance performance = directoryStatistics.supplierPerformance(big.getId());
    assertThat(performance.getProductOverview().getAverageProductPrice()).isEqualByComparingTo("10.00");
    assertThat(performance.getSalesMetrics().getTotalOrders()).isEqualTo(1);
    assertThat(performance.getSalesMetrics().getAverageOrderValue()).isEqualByComparingTo("10.00");
    assertThat(performance.getSalesTrends()).extracting(SupplierPerformance.MonthlySales::getPeriod)
        .containsExactly("2025-06");
    assertThat(performance.getTopProducts()).extracting(SupplierPerformance.TopProduct::getName)
        .containsExactly("One");

    ProductStatistics products = directoryStatistics.productStatistics();
    assertThat(products.getMostExpensive().getName()).isEqualTo("Two");
    assertThat(products.getCheapest().getName()).isEqualTo("Three");
    assertThat(products.getBySupplier()).extracting(ProductStatistics.SupplierBreakdown::getSupplierName)
        .containsExactly("Big Co", "Small Co");
  }

  private void placeOrderAt(String instant, Customer customer, Product product, int quantity) {
    clock.set(Instant.parse(instant));
    orderService.createOrder(customer.getId(), List.of(new OrderLine(product.getId(), quantity)));
  }
}
