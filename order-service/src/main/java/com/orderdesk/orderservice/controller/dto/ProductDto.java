package com.orderdesk.orderservice.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProductDto {
  private Long id;
  private String name;
  private Long supplierId;
  private String supplierName;
  private BigDecimal unitPrice;
  private String packaging;
  private boolean discontinued;
}
