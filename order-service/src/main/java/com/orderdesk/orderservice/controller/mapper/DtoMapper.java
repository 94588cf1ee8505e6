package com.orderdesk.orderservice.controller.mapper;

import com.orderdesk.orderservice.controller.dto.*;
import com.orderdesk.orderservice.model.*;
import com.orderdesk.orderservice.service.OrderLine;
import org.springframework.stereotype.Component;

import java.util.List;

/** Converts between entities and the JSON shapes exposed by the controllers. */
@Component
public class DtoMapper {

  public CustomerDto toDto(Customer customer) {
    return new CustomerDto(
        customer.getId(),
        customer.getFirstName(),
        customer.getLastName(),
        customer.getFullName(),
        customer.getCity(),
        customer.getCountry(),
        customer.getPhone());
  }

  public SupplierDto toDto(Supplier supplier) {
    return new SupplierDto(
        supplier.getId(),
        supplier.getCompanyName(),
        supplier.getContactName(),
        supplier.getCity(),
        supplier.getCountry(),
        supplier.getPhone(),
        supplier.getFax());
  }

  public ProductDto toDto(Product product) {
    return new ProductDto(
        product.getId(),
        product.getName(),
        product.getSupplier().getId(),
        product.getSupplier().getCompanyName(),
        product.getUnitPrice(),
        product.getPackaging(),
        product.isDiscontinued());
  }

  public OrderDto toDto(Order order) {
    return new OrderDto(
        order.getId(),
        order.getOrderNumber(),
        order.getOrderDate(),
        order.getCustomer().getId(),
        order.getCustomer().getFullName(),
        order.getTotalAmount(),
        order.getOrderItems().stream().map(this::toDto).toList());
  }

  public OrderItemDto toDto(OrderItem item) {
    return new OrderItemDto(
        item.getId(),
        item.getOrder().getId(),
        item.getProduct().getId(),
        item.getProduct().getName(),
        item.getUnitPrice(),
        item.getQuantity(),
        item.getLineTotal());
  }

  public Customer toEntity(CustomerRequest request) {
    return new Customer(
        request.getFirstName().trim(),
        request.getLastName().trim(),
        request.getCity(),
        request.getCountry(),
        request.getPhone());
  }

  public Supplier toEntity(SupplierRequest request) {
    Supplier supplier =
        new Supplier(
            request.getCompanyName().trim(),
            request.getContactName(),
            request.getCity(),
            request.getCountry());
    supplier.setPhone(request.getPhone());
    supplier.setFax(request.getFax());
    return supplier;
  }

  /** The supplier is resolved by the product service from {@link ProductRequest#getSupplierId()}. */
  public Product toEntity(ProductRequest request) {
    Product product =
        new Product(request.getName().trim(), null, request.getUnitPrice(), request.getPackaging());
    product.setDiscontinued(request.isDiscontinued());
    return product;
  }

  public List<OrderLine> toOrderLines(OrderRequest request) {
    if (request.getItems() == null) {
      return List.of();
    }
    return request.getItems().stream()
        .map(item -> new OrderLine(item.getProductId(), item.getQuantity()))
        .toList();
  }
}
