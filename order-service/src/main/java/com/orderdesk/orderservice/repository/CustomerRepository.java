package com.orderdesk.orderservice.repository;

import com.orderdesk.orderservice.model.Customer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CustomerRepository
    extends JpaRepository<Customer, Long>, JpaSpecificationExecutor<Customer> {

  @Query(
      "select distinct c.country from Customer c"
          + " where c.country is not null and trim(c.country) <> '' order by c.country")
  List<String> findDistinctCountries();

  @Query(
      "select distinct c.city from Customer c"
          + " where c.city is not null and trim(c.city) <> ''"
          + " and (:country is null or c.country = :country) order by c.city")
  List<String> findDistinctCities(@Param("country") String country);
}
