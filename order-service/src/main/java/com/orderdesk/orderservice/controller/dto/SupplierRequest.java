package com.orderdesk.orderservice.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SupplierRequest {
  @NotBlank
  @Size(max = 100)
  private String companyName;

  @Size(max = 100)
  private String contactName;

  @Size(max = 100)
  private String city;

  @Size(max = 50)
  private String country;

  @Size(max = 20)
  private String phone;

  @Size(max = 20)
  private String fax;
}
