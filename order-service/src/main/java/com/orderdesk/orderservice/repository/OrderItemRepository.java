package com.orderdesk.orderservice.repository;

import com.orderdesk.orderservice.model.OrderItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OrderItemRepository extends JpaRepository<OrderItem, Long> {

  boolean existsByProductId(Long productId);

  List<OrderItem> findByOrderIdOrderByIdAsc(Long orderId);

  List<OrderItem> findByProductId(Long productId);

  List<OrderItem> findByProductSupplierId(Long supplierId);
}
