package com.orderdesk.orderservice.controller;

import com.orderdesk.orderservice.controller.dto.CustomerDto;
import com.orderdesk.orderservice.controller.dto.CustomerRequest;
import com.orderdesk.orderservice.controller.dto.OrderDto;
import com.orderdesk.orderservice.controller.mapper.DtoMapper;
import com.orderdesk.orderservice.model.Customer;
import com.orderdesk.orderservice.service.CustomerService;
import com.orderdesk.orderservice.service.statistics.CustomerStatistics;
import com.orderdesk.orderservice.service.statistics.DirectoryStatisticsService;
import com.orderdesk.querysupport.paging.PageSpec;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.List;

@RestController
@RequestMapping("/api/customers")
public class CustomerController {

  private static final Logger log = LoggerFactory.getLogger(CustomerController.class);

  private final CustomerService customerService;
  private final DirectoryStatisticsService statisticsService;
  private final DtoMapper mapper;

  @Autowired
  public CustomerController(
      CustomerService customerService,
      DirectoryStatisticsService statisticsService,
      DtoMapper mapper) {
    this.customerService = customerService;
    this.statisticsService = statisticsService;
    this.mapper = mapper;
  }

  /** GET /api/customers?country=&city=&search=&page=1&pageSize=10 */
  @GetMapping
  public ResponseEntity<List<CustomerDto>> listCustomers(
      @RequestParam(required = false) String country,
      @RequestParam(required = false) String city,
      @RequestParam(required = false) String search,
      @RequestParam(required = false) Integer page,
      @RequestParam(required = false) Integer pageSize) {
    log.info("Listing customers country={}, city={}, search={}, page={}", country, city, search, page);
    return PageHeaders.ok(
        customerService
            .listCustomers(country, city, search, PageSpec.of(page, pageSize))
            .map(mapper::toDto));
  }

  @GetMapping("/{id}")
  public CustomerDto getCustomer(@PathVariable Long id) {
    log.info("Getting customer with id {}", id);
    return mapper.toDto(customerService.getCustomer(id));
  }

  @GetMapping("/{id}/orders")
  public List<OrderDto> getCustomerOrders(@PathVariable Long id) {
    log.info("Getting orders of customer {}", id);
    return customerService.getCustomerOrders(id).stream().map(mapper::toDto).toList();
  }

  @PostMapping
  public ResponseEntity<CustomerDto> createCustomer(@Valid @RequestBody CustomerRequest request) {
    log.info("Creating customer {} {}", request.getFirstName(), request.getLastName());
    Customer created = customerService.createCustomer(mapper.toEntity(request));
    return ResponseEntity.created(URI.create("/api/customers/" + created.getId()))
        .body(mapper.toDto(created));
  }

  @PutMapping("/{id}")
  public ResponseEntity<Void> updateCustomer(
      @PathVariable Long id, @Valid @RequestBody CustomerRequest request) {
    log.info("Updating customer {}", id);
    customerService.updateCustomer(id, mapper.toEntity(request));
    return ResponseEntity.noContent().build();
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteCustomer(@PathVariable Long id) {
    log.info("Deleting customer {}", id);
    customerService.deleteCustomer(id);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/countries")
  public List<String> listCountries() {
    return customerService.listCountries();
  }

  @GetMapping("/cities")
  public List<String> listCities(@RequestParam(required = false) String country) {
    return customerService.listCities(country);
  }

  @GetMapping("/statistics")
  public CustomerStatistics getStatistics() {
    log.info("Computing customer statistics");
    return statisticsService.customerStatistics();
  }
}
