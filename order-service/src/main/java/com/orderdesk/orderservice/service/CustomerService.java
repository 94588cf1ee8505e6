package com.orderdesk.orderservice.service;

import com.orderdesk.orderservice.exception.InvalidOperationException;
import com.orderdesk.orderservice.exception.NotFoundException;
import com.orderdesk.orderservice.model.Customer;
import com.orderdesk.orderservice.model.Order;
import com.orderdesk.orderservice.repository.CustomerRepository;
import com.orderdesk.orderservice.repository.OrderRepository;
import com.orderdesk.orderservice.repository.specification.CustomerSpecifications;
import com.orderdesk.querysupport.paging.PageResult;
import com.orderdesk.querysupport.paging.PageSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

@Service
public class CustomerService {

  private static final Logger log = LoggerFactory.getLogger(CustomerService.class);

  static final Sort DEFAULT_SORT = Sort.by("lastName", "firstName", "id");

  private final CustomerRepository customerRepository;
  private final OrderRepository orderRepository;
  private final TransactionTemplate transactionTemplate;

  @Autowired
  public CustomerService(
      CustomerRepository customerRepository,
      OrderRepository orderRepository,
      TransactionTemplate transactionTemplate) {
    this.customerRepository = customerRepository;
    this.orderRepository = orderRepository;
    this.transactionTemplate = transactionTemplate;
  }

  @Transactional(readOnly = true)
  public Customer getCustomer(Long id) {
    RequestGuards.requirePositiveId(id, "Customer id");
    return customerRepository.findById(id).orElseThrow(() -> NotFoundException.of("Customer", id));
  }

  @Transactional(readOnly = true)
  public PageResult<Customer> listCustomers(
      String country, String city, String search, PageSpec page) {
    return PagedQueries.fetch(
        customerRepository, CustomerSpecifications.filter(country, city, search), DEFAULT_SORT, page);
  }

  @Transactional(readOnly = true)
  public List<Order> getCustomerOrders(Long id) {
    Customer customer = getCustomer(id);
    return orderRepository.findByCustomerId(customer.getId(), OrderService.DEFAULT_SORT);
  }

  @Transactional
  public Customer createCustomer(Customer details) {
    Customer customer =
        new Customer(
            details.getFirstName(),
            details.getLastName(),
            details.getCity(),
            details.getCountry(),
            details.getPhone());
    Customer saved = customerRepository.save(customer);
    log.info("Customer created with ID: {}", saved.getId());
    return saved;
  }

  public Customer updateCustomer(Long id, Customer details) {
    RequestGuards.requirePositiveId(id, "Customer id");
    return ConcurrentWrites.withConflictCheck(
        "Customer",
        id,
        () -> customerRepository.existsById(id),
        () ->
            transactionTemplate.execute(
                status -> {
                  Customer existing = getCustomer(id);
                  existing.setFirstName(details.getFirstName());
                  existing.setLastName(details.getLastName());
                  existing.setCity(details.getCity());
                  existing.setCountry(details.getCountry());
                  existing.setPhone(details.getPhone());
                  Customer saved = customerRepository.saveAndFlush(existing);
                  log.info("Customer {} updated", id);
                  return saved;
                }));
  }

  public void deleteCustomer(Long id) {
    RequestGuards.requirePositiveId(id, "Customer id");
    ConcurrentWrites.runWithConflictCheck(
        "Customer",
        id,
        () -> customerRepository.existsById(id),
        () ->
            transactionTemplate.executeWithoutResult(
                status -> {
                  Customer existing = getCustomer(id);
                  if (orderRepository.existsByCustomerId(id)) {
                    log.warn("Refusing to delete customer {}: it still has orders", id);
                    throw new InvalidOperationException(
                        "Cannot delete customer " + id + " because it has existing orders");
                  }
                  customerRepository.delete(existing);
                  customerRepository.flush();
                  log.info("Customer {} deleted", id);
                }));
  }

  @Transactional(readOnly = true)
  public List<String> listCountries() {
    return customerRepository.findDistinctCountries();
  }

  @Transactional(readOnly = true)
  public List<String> listCities(String country) {
    return customerRepository.findDistinctCities(
        country == null || country.isBlank() ? null : country.trim());
  }
}
