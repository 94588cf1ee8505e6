package com.orderdesk.orderservice.repository;

import com.orderdesk.orderservice.model.Supplier;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SupplierRepository
    extends JpaRepository<Supplier, Long>, JpaSpecificationExecutor<Supplier> {

  @Query(
      "select distinct s.country from Supplier s"
          + " where s.country is not null and trim(s.country) <> '' order by s.country")
  List<String> findDistinctCountries();

  @Query(
      "select distinct s.city from Supplier s"
          + " where s.city is not null and trim(s.city) <> ''"
          + " and (:country is null or s.country = :country) order by s.city")
  List<String> findDistinctCities(@Param("country") String country);
}
