package com.orderdesk.orderservice.controller;

import com.orderdesk.orderservice.controller.dto.PriceUpdateRequest;
import com.orderdesk.orderservice.controller.dto.ProductDto;
import com.orderdesk.orderservice.controller.dto.ProductRequest;
import com.orderdesk.orderservice.controller.mapper.DtoMapper;
import com.orderdesk.orderservice.model.Product;
import com.orderdesk.orderservice.service.ProductService;
import com.orderdesk.orderservice.service.statistics.DirectoryStatisticsService;
import com.orderdesk.orderservice.service.statistics.ProductStatistics;
import com.orderdesk.querysupport.paging.PageSpec;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.net.URI;
import java.util.List;

@RestController
@RequestMapping("/api/products")
public class ProductController {

  private static final Logger log = LoggerFactory.getLogger(ProductController.class);

  private final ProductService productService;
  private final DirectoryStatisticsService statisticsService;
  private final DtoMapper mapper;

  @Autowired
  public ProductController(
      ProductService productService,
      DirectoryStatisticsService statisticsService,
      DtoMapper mapper) {
    this.productService = productService;
    this.statisticsService = statisticsService;
    this.mapper = mapper;
  }

  @GetMapping
  public ResponseEntity<List<ProductDto>> listProducts(
      @RequestParam(required = false) Long supplierId,
      @RequestParam(required = false) BigDecimal minPrice,
      @RequestParam(required = false) BigDecimal maxPrice,
      @RequestParam(required = false) Boolean discontinued,
      @RequestParam(required = false) String search,
      @RequestParam(required = false) Integer page,
      @RequestParam(required = false) Integer pageSize) {
    log.info(
        "Listing products supplierId={}, price=[{}, {}], discontinued={}, search={}, page={}",
        supplierId,
        minPrice,
        maxPrice,
        discontinued,
        search,
        page);
    return PageHeaders.ok(
        productService
            .listProducts(
                supplierId, minPrice, maxPrice, discontinued, search, PageSpec.of(page, pageSize))
            .map(mapper::toDto));
  }

  @GetMapping("/{id}")
  public ProductDto getProduct(@PathVariable Long id) {
    log.info("Getting product with id {}", id);
    return mapper.toDto(productService.getProduct(id));
  }

  @GetMapping("/active")
  public List<ProductDto> listActiveProducts() {
    return productService.listActiveProducts().stream().map(mapper::toDto).toList();
  }

  @GetMapping("/discontinued")
  public List<ProductDto> listDiscontinuedProducts() {
    return productService.listDiscontinuedProducts().stream().map(mapper::toDto).toList();
  }

  @GetMapping("/supplier/{supplierId}")
  public List<ProductDto> listProductsBySupplier(@PathVariable Long supplierId) {
    return productService.listProductsBySupplier(supplierId).stream().map(mapper::toDto).toList();
  }

  @GetMapping("/search/{term}")
  public List<ProductDto> searchProducts(@PathVariable String term) {
    log.info("Searching products for '{}'", term);
    return productService.searchProducts(term).stream().map(mapper::toDto).toList();
  }

  @PostMapping
  public ResponseEntity<ProductDto> createProduct(@Valid @RequestBody ProductRequest request) {
    log.info("Creating product {} for supplier {}", request.getName(), request.getSupplierId());
    Product created = productService.createProduct(mapper.toEntity(request), request.getSupplierId());
    return ResponseEntity.created(URI.create("/api/products/" + created.getId()))
        .body(mapper.toDto(created));
  }

  @PutMapping("/{id}")
  public ResponseEntity<Void> updateProduct(
      @PathVariable Long id, @Valid @RequestBody ProductRequest request) {
    log.info("Updating product {}", id);
    productService.updateProduct(id, mapper.toEntity(request), request.getSupplierId());
    return ResponseEntity.noContent().build();
  }

  // PATCH /api/products/{id}/price  Body: {"unitPrice": 12.50}
  @PatchMapping("/{id}/price")
  public ProductDto updatePrice(
      @PathVariable Long id, @Valid @RequestBody PriceUpdateRequest request) {
    log.info("Updating price of product {} to {}", id, request.getUnitPrice());
    return mapper.toDto(productService.updateProductPrice(id, request.getUnitPrice()));
  }

  @PatchMapping("/{id}/discontinue")
  public ProductDto discontinueProduct(@PathVariable Long id) {
    log.info("Discontinuing product {}", id);
    return mapper.toDto(productService.discontinueProduct(id));
  }

  @PatchMapping("/{id}/reactivate")
  public ProductDto reactivateProduct(@PathVariable Long id) {
    log.info("Reactivating product {}", id);
    return mapper.toDto(productService.reactivateProduct(id));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteProduct(@PathVariable Long id) {
    log.info("Deleting product {}", id);
    productService.deleteProduct(id);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/statistics")
  public ProductStatistics getStatistics() {
    log.info("Computing product statistics");
    return statisticsService.productStatistics();
  }
}
