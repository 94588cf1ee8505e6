package com.orderdesk.orderservice.repository;

import com.orderdesk.orderservice.model.Product;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProductRepository
    extends JpaRepository<Product, Long>, JpaSpecificationExecutor<Product> {

  boolean existsBySupplierId(Long supplierId);

  List<Product> findBySupplierId(Long supplierId, Sort sort);

  List<Product> findBySupplierIdAndDiscontinuedFalse(Long supplierId, Sort sort);

  List<Product> findByDiscontinued(boolean discontinued, Sort sort);
}
