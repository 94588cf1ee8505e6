package com.orderdesk.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Entity
@Table(
    name = "customers",
    indexes = {
      @Index(name = "idx_customers_last_first", columnList = "last_name, first_name"),
      @Index(name = "idx_customers_country", columnList = "country")
    })
@Getter
@Setter
@ToString
@NoArgsConstructor
public class Customer {
  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "first_name", nullable = false, length = 50)
  private String firstName;

  @Column(name = "last_name", nullable = false, length = 50)
  private String lastName;

  @Column(length = 100)
  private String city;

  @Column(length = 50)
  private String country;

  @Column(length = 20)
  private String phone;

  @Version private Long version;

  public Customer(String firstName, String lastName, String city, String country, String phone) {
    this.firstName = firstName;
    this.lastName = lastName;
    this.city = city;
    this.country = country;
    this.phone = phone;
  }

  public String getFullName() {
    return firstName + " " + lastName;
  }
}
