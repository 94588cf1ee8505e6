package com.orderdesk.orderservice.controller;

import com.orderdesk.orderservice.controller.dto.ProductDto;
import com.orderdesk.orderservice.controller.dto.SupplierDto;
import com.orderdesk.orderservice.controller.dto.SupplierRequest;
import com.orderdesk.orderservice.controller.mapper.DtoMapper;
import com.orderdesk.orderservice.model.Supplier;
import com.orderdesk.orderservice.service.SupplierService;
import com.orderdesk.orderservice.service.statistics.DirectoryStatisticsService;
import com.orderdesk.orderservice.service.statistics.SupplierPerformance;
import com.orderdesk.orderservice.service.statistics.SupplierStatistics;
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
@RequestMapping("/api/suppliers")
public class SupplierController {

  private static final Logger log = LoggerFactory.getLogger(SupplierController.class);

  private final SupplierService supplierService;
  private final DirectoryStatisticsService statisticsService;
  private final DtoMapper mapper;

  @Autowired
  public SupplierController(
      SupplierService supplierService,
      DirectoryStatisticsService statisticsService,
      DtoMapper mapper) {
    this.supplierService = supplierService;
    this.statisticsService = statisticsService;
    this.mapper = mapper;
  }

  @GetMapping
  public ResponseEntity<List<SupplierDto>> listSuppliers(
      @RequestParam(required = false) String country,
      @RequestParam(required = false) String city,
      @RequestParam(required = false) String search,
      @RequestParam(required = false) Integer page,
      @RequestParam(required = false) Integer pageSize) {
    log.info("Listing suppliers country={}, city={}, search={}, page={}", country, city, search, page);
    return PageHeaders.ok(
        supplierService
            .listSuppliers(country, city, search, PageSpec.of(page, pageSize))
            .map(mapper::toDto));
  }

  @GetMapping("/{id}")
  public SupplierDto getSupplier(@PathVariable Long id) {
    log.info("Getting supplier with id {}", id);
    return mapper.toDto(supplierService.getSupplier(id));
  }

  @GetMapping("/{id}/products")
  public List<ProductDto> getSupplierProducts(@PathVariable Long id) {
    return supplierService.getSupplierProducts(id).stream().map(mapper::toDto).toList();
  }

  @GetMapping("/{id}/products/active")
  public List<ProductDto> getSupplierActiveProducts(@PathVariable Long id) {
    return supplierService.getSupplierActiveProducts(id).stream().map(mapper::toDto).toList();
  }

  @GetMapping("/search/{term}")
  public List<SupplierDto> searchSuppliers(@PathVariable String term) {
    log.info("Searching suppliers for '{}'", term);
    return supplierService.searchSuppliers(term).stream().map(mapper::toDto).toList();
  }

  @PostMapping
  public ResponseEntity<SupplierDto> createSupplier(@Valid @RequestBody SupplierRequest request) {
    log.info("Creating supplier {}", request.getCompanyName());
    Supplier created = supplierService.createSupplier(mapper.toEntity(request));
    return ResponseEntity.created(URI.create("/api/suppliers/" + created.getId()))
        .body(mapper.toDto(created));
  }

  @PutMapping("/{id}")
  public ResponseEntity<Void> updateSupplier(
      @PathVariable Long id, @Valid @RequestBody SupplierRequest request) {
    log.info("Updating supplier {}", id);
    supplierService.updateSupplier(id, mapper.toEntity(request));
    return ResponseEntity.noContent().build();
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteSupplier(@PathVariable Long id) {
    log.info("Deleting supplier {}", id);
    supplierService.deleteSupplier(id);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/countries")
  public List<String> listCountries() {
    return supplierService.listCountries();
  }

  @GetMapping("/cities")
  public List<String> listCities(@RequestParam(required = false) String country) {
    return supplierService.listCities(country);
  }

  @GetMapping("/statistics")
  public SupplierStatistics getStatistics() {
    log.info("Computing supplier statistics");
    return statisticsService.supplierStatistics();
  }

  @GetMapping("/{id}/performance")
  public SupplierPerformance getPerformance(@PathVariable Long id) {
    log.info("Computing performance of supplier {}", id);
    return statisticsService.supplierPerformance(id);
  }
}
