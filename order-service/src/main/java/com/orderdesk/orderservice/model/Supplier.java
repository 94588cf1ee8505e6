package com.orderdesk.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Entity
@Table(
    name = "suppliers",
    indexes = {
      @Index(name = "idx_suppliers_company_name", columnList = "company_name"),
      @Index(name = "idx_suppliers_country", columnList = "country")
    })
@Getter
@Setter
@ToString
@NoArgsConstructor
public class Supplier {
  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "company_name", nullable = false, length = 100)
  private String companyName;

  @Column(name = "contact_name", length = 100)
  private String contactName;

  @Column(length = 100)
  private String city;

  @Column(length = 50)
  private String country;

  @Column(length = 20)
  private String phone;

  @Column(length = 20)
  private String fax;

  @Version private Long version;

  public Supplier(String companyName, String contactName, String city, String country) {
    this.companyName = companyName;
    this.contactName = contactName;
    this.city = city;
    this.country = country;
  }
}
