package com.orderdesk.orderservice.repository;

import com.orderdesk.orderservice.model.Order;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface OrderRepository
    extends JpaRepository<Order, Long>, JpaSpecificationExecutor<Order> {

  boolean existsByCustomerId(Long customerId);

  boolean existsByOrderNumber(String orderNumber);

  Optional<Order> findByOrderNumber(String orderNumber);

  List<Order> findByCustomerId(Long customerId, Sort sort);

  List<Order> findByOrderDateGreaterThanEqual(Instant since, Pageable pageable);

  List<Order> findByOrderDateBetween(Instant from, Instant to);
}
