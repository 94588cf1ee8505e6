package com.orderdesk.orderservice.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Body of customer create and update requests. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CustomerRequest {
  @NotBlank
  @Size(max = 50)
  private String firstName;

  @NotBlank
  @Size(max = 50)
  private String lastName;

  @Size(max = 100)
  private String city;

  @Size(max = 50)
  private String country;

  @Size(max = 20)
  private String phone;
}
