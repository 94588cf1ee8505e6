package com.orderdesk.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate root of an order. {@link #totalAmount} always equals the sum of the line totals of
 * {@link #orderItems}; every mutation of the item list goes through this class so the two move
 * together.
 */
@Entity
@Table(
    name = "customer_orders",
    indexes = {
      @Index(name = "idx_orders_date", columnList = "order_date"),
      @Index(name = "idx_orders_customer", columnList = "customer_id")
    })
@Getter
@Setter
@ToString(exclude = "orderItems")
@NoArgsConstructor
public class Order {
  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "order_date", nullable = false)
  private Instant orderDate;

  @Column(name = "order_number", nullable = false, unique = true, length = 24)
  private String orderNumber;

  @Column(name = "total_amount", nullable = false, precision = 12, scale = 2)
  private BigDecimal totalAmount = BigDecimal.ZERO;

  @ManyToOne(fetch = FetchType.EAGER, optional = false)
  @JoinColumn(name = "customer_id", nullable = false)
  private Customer customer;

  @OneToMany(
      mappedBy = "order",
      cascade = CascadeType.ALL,
      orphanRemoval = true,
      fetch = FetchType.EAGER)
  @OrderBy("id")
  private List<OrderItem> orderItems = new ArrayList<>();

  @Version private Long version;

  public void addOrderItem(OrderItem item) {
    this.orderItems.add(item);
    item.setOrder(this);
    this.totalAmount = this.totalAmount.add(item.getLineTotal());
  }

  /** Changes the quantity of one of this order's items and shifts the total by the difference. */
  public void changeItemQuantity(OrderItem item, int newQuantity) {
    int difference = newQuantity - item.getQuantity();
    item.setQuantity(newQuantity);
    this.totalAmount =
        this.totalAmount.add(item.getUnitPrice().multiply(BigDecimal.valueOf(difference)));
  }

  public void removeOrderItem(OrderItem item) {
    if (orderItems.remove(item)) {
      this.totalAmount = this.totalAmount.subtract(item.getLineTotal());
    }
  }

  public boolean isEditableAt(Instant now, Duration editWindow) {
    return !orderDate.plus(editWindow).isBefore(now);
  }
}
