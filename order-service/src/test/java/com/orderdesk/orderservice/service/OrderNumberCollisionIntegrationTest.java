package com.orderdesk.orderservice.service;

import com.orderdesk.orderservice.exception.ConflictException;
import com.orderdesk.orderservice.model.Customer;
import com.orderdesk.orderservice.model.Order;
import com.orderdesk.orderservice.model.Product;
import com.orderdesk.orderservice.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.SpyBean;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class OrderNumberCollisionIntegrationTest extends IntegrationTestSupport {

  @Autowired private OrderService orderService;

  @SpyBean private OrderNumberGenerator orderNumberGenerator;

  private Customer customer;
  private Product product;

  @BeforeEach
  public void setup() {
    reset(orderNumberGenerator);
    customer = customer("Alan", "Turing", "UK");
    product = product("Enigma Rotor", supplier("Bletchley Supplies", "UK"), "99.00");
  }

  @Test
  void createOrder_shouldRetryWithFreshNumber_whenNumberAlreadyTaken() {
    Order first = orderService.createOrder(customer.getId(), List.of(new OrderLine(product.getId(), 1)));
    String taken = first.getOrderNumber();
    doReturn(taken).doCallRealMethod().when(orderNumberGenerator).generate(any());

    Order second = orderService.createOrder(customer.getId(), List.of(new OrderLine(product.getId(), 1)));

    assertThat(second.getOrderNumber()).isNotEqualTo(taken).startsWith("ORD");
    assertThat(orderRepository.count()).isEqualTo(2);
    // one call for the first order, two for the second
    verify(orderNumberGenerator, times(3)).generate(any());
  }

  @Test
  void createOrder_shouldGiveUpWithConflict_afterConfiguredAttempts() {
    Order first = orderService.createOrder(customer.getId(), List.of(new OrderLine(product.getId(), 1)));
    doReturn(first.getOrderNumber()).when(orderNumberGenerator).generate(any());

    assertThatThrownBy(
            () -> orderService.createOrder(customer.getId(), List.of(new OrderLine(product.getId(), 2))))
        .isInstanceOf(ConflictException.class);

    assertThat(orderRepository.count()).isEqualTo(1);
    verify(orderNumberGenerator, times(4)).generate(any());
  }
}
