package com.orderdesk.orderservice.service;

import com.orderdesk.orderservice.exception.InvalidOperationException;
import com.orderdesk.orderservice.exception.NotFoundException;
import com.orderdesk.orderservice.model.Order;
import com.orderdesk.orderservice.model.OrderItem;
import com.orderdesk.orderservice.repository.OrderItemRepository;
import com.orderdesk.orderservice.repository.OrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * Changes to the items of an existing order. Every change re-derives the order total in the same
 * transaction as the item change.
 */
@Service
public class OrderItemService {

  private static final Logger log = LoggerFactory.getLogger(OrderItemService.class);

  private final OrderItemRepository orderItemRepository;
  private final OrderRepository orderRepository;
  private final OrderService orderService;
  private final TransactionTemplate transactionTemplate;

  @Autowired
  public OrderItemService(
      OrderItemRepository orderItemRepository,
      OrderRepository orderRepository,
      OrderService orderService,
      TransactionTemplate transactionTemplate) {
    this.orderItemRepository = orderItemRepository;
    this.orderRepository = orderRepository;
    this.orderService = orderService;
    this.transactionTemplate = transactionTemplate;
  }

  @Transactional(readOnly = true)
  public OrderItem getOrderItem(Long id) {
    RequestGuards.requirePositiveId(id, "Order item id");
    return orderItemRepository
        .findById(id)
        .orElseThrow(() -> NotFoundException.of("Order item", id));
  }

  @Transactional(readOnly = true)
  public List<OrderItem> listOrderItems(Long orderId) {
    RequestGuards.requirePositiveId(orderId, "Order id");
    if (!orderRepository.existsById(orderId)) {
      throw NotFoundException.of("Order", orderId);
    }
    return orderItemRepository.findByOrderIdOrderByIdAsc(orderId);
  }

  public OrderItem updateQuantity(Long itemId, Integer quantity) {
    RequestGuards.requirePositiveId(itemId, "Order item id");
    return ConcurrentWrites.withConflictCheck(
        "Order item",
        itemId,
        () -> orderItemRepository.existsById(itemId),
        () ->
            transactionTemplate.execute(
                status -> {
                  OrderItem item = getOrderItem(itemId);
                  Order order = item.getOrder();
                  orderService.requireEditable(order);
                  int newQuantity = RequestGuards.requireQuantity(quantity);
                  int oldQuantity = item.getQuantity();
                  order.changeItemQuantity(item, newQuantity);
                  orderRepository.saveAndFlush(order);
                  log.info(
                      "Order item {} quantity {} -> {}, order {} total now {}",
                      itemId,
                      oldQuantity,
                      newQuantity,
                      order.getId(),
                      order.getTotalAmount());
                  return item;
                }));
  }

  public void deleteOrderItem(Long itemId) {
    RequestGuards.requirePositiveId(itemId, "Order item id");
    ConcurrentWrites.runWithConflictCheck(
        "Order item",
        itemId,
        () -> orderItemRepository.existsById(itemId),
        () ->
            transactionTemplate.executeWithoutResult(
                status -> {
                  OrderItem item = getOrderItem(itemId);
                  Order order = item.getOrder();
                  orderService.requireEditable(order);
                  if (order.getOrderItems().size() <= 1) {
                    log.warn("Refusing to delete item {}: last item of order {}", itemId, order.getId());
                    throw new InvalidOperationException(
                        "Cannot delete the last item of an order, delete the order instead");
                  }
                  order.removeOrderItem(item);
                  orderRepository.saveAndFlush(order);
                  log.info(
                      "Order item {} removed, order {} total now {}",
                      itemId,
                      order.getId(),
                      order.getTotalAmount());
                }));
  }
}
