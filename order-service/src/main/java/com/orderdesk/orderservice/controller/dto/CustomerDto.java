package com.orderdesk.orderservice.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CustomerDto {
  private Long id;
  private String firstName;
  private String lastName;
  private String fullName;
  private String city;
  private String country;
  private String phone;
}
