package com.orderdesk.orderservice.controller.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProductRequest {
  @NotBlank
  @Size(max = 100)
  private String name;

  @NotNull private Long supplierId;

  @NotNull
  @DecimalMin(value = "0.00", inclusive = false)
  @Digits(integer = 8, fraction = 2)
  private BigDecimal unitPrice;

  @Size(max = 100)
  private String packaging;

  private boolean discontinued;
}
