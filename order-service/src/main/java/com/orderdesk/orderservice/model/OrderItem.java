package com.orderdesk.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;

@Entity
@Table(
    name = "order_items",
    indexes = {
      @Index(name = "idx_order_items_order", columnList = "order_id"),
      @Index(name = "idx_order_items_product", columnList = "product_id")
    })
@Getter
@Setter
@ToString(exclude = "order")
@NoArgsConstructor
public class OrderItem {
  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @ManyToOne(fetch = FetchType.EAGER, optional = false)
  @JoinColumn(name = "order_id", nullable = false)
  private Order order;

  @ManyToOne(fetch = FetchType.EAGER, optional = false)
  @JoinColumn(name = "product_id", nullable = false)
  private Product product;

  // Price at the time the order was placed; later catalogue price changes never touch it
  @Column(name = "unit_price", nullable = false, precision = 10, scale = 2)
  private BigDecimal unitPrice;

  @Column(nullable = false)
  private int quantity;

  @Version private Long version;

  public OrderItem(Product product, int quantity) {
    this.product = product;
    this.unitPrice = product.getUnitPrice();
    this.quantity = quantity;
  }

  public BigDecimal getLineTotal() {
    return unitPrice.multiply(BigDecimal.valueOf(quantity));
  }
}
