package com.orderdesk.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;

@Entity
@Table(
    name = "products",
    indexes = {
      @Index(name = "idx_products_name", columnList = "name"),
      @Index(name = "idx_products_supplier", columnList = "supplier_id")
    })
@Getter
@Setter
@ToString
@NoArgsConstructor
public class Product {
  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false, length = 100)
  private String name;

  // Loaded eagerly: every product view shows the supplier's company name
  @ManyToOne(fetch = FetchType.EAGER, optional = false)
  @JoinColumn(name = "supplier_id", nullable = false)
  private Supplier supplier;

  @Column(name = "unit_price", nullable = false, precision = 10, scale = 2)
  private BigDecimal unitPrice;

  @Column(name = "package_desc", length = 100)
  private String packaging;

  @Column(nullable = false)
  private boolean discontinued;

  @Version private Long version;

  public Product(String name, Supplier supplier, BigDecimal unitPrice, String packaging) {
    this.name = name;
    this.supplier = supplier;
    this.unitPrice = unitPrice;
    this.packaging = packaging;
  }
}
