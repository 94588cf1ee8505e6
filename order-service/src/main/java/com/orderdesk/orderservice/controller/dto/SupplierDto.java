package com.orderdesk.orderservice.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SupplierDto {
  private Long id;
  private String companyName;
  private String contactName;
  private String city;
  private String country;
  private String phone;
  private String fax;
}
