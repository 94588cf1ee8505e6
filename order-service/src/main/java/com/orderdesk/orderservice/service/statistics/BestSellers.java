package com.orderdesk.orderservice.service.statistics;

import com.orderdesk.orderservice.model.OrderItem;
import com.orderdesk.orderservice.model.Product;
import com.orderdesk.querysupport.aggregation.Aggregations;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** Ranks products by quantity sold across a set of order items. */
final class BestSellers {

  private BestSellers() {}

  static Map<Long, List<OrderItem>> byProductId(Collection<OrderItem> items) {
    return items.stream()
        .collect(
            Collectors.groupingBy(
                item -> item.getProduct().getId(), LinkedHashMap::new, Collectors.toList()));
  }

  static List<ProductSeller> rank(Collection<OrderItem> items, int limit) {
    List<ProductSeller> sellers =
        byProductId(items).values().stream().map(BestSellers::toSeller).toList();
    return Aggregations.topN(
        sellers, ProductSeller::getTotalQuantitySold, ProductSeller::getProductId, limit);
  }

  private static ProductSeller toSeller(List<OrderItem> itemsOfOneProduct) {
    Product product = itemsOfOneProduct.get(0).getProduct();
    return new ProductSeller(
        product.getId(),
        product.getName(),
        Aggregations.sumLong(itemsOfOneProduct, OrderItem::getQuantity),
        Aggregations.sum(itemsOfOneProduct, OrderItem::getLineTotal));
  }
}
