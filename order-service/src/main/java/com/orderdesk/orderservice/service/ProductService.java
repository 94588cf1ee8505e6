package com.orderdesk.orderservice.service;

import com.orderdesk.orderservice.config.OrderDeskProperties;
import com.orderdesk.orderservice.exception.InvalidOperationException;
import com.orderdesk.orderservice.exception.NotFoundException;
import com.orderdesk.orderservice.model.Product;
import com.orderdesk.orderservice.model.Supplier;
import com.orderdesk.orderservice.repository.OrderItemRepository;
import com.orderdesk.orderservice.repository.ProductRepository;
import com.orderdesk.orderservice.repository.SupplierRepository;
import com.orderdesk.orderservice.repository.specification.ProductSpecifications;
import com.orderdesk.querysupport.paging.PageResult;
import com.orderdesk.querysupport.paging.PageSpec;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.List;
import java.util.function.Consumer;

@Service
public class ProductService {

  private static final Logger log = LoggerFactory.getLogger(ProductService.class);

  static final Sort DEFAULT_SORT = Sort.by("name", "id");

  private final ProductRepository productRepository;
  private final SupplierRepository supplierRepository;
  private final OrderItemRepository orderItemRepository;
  private final TransactionTemplate transactionTemplate;
  private final OrderDeskProperties properties;

  @Autowired
  public ProductService(
      ProductRepository productRepository,
      SupplierRepository supplierRepository,
      OrderItemRepository orderItemRepository,
      TransactionTemplate transactionTemplate,
      OrderDeskProperties properties) {
    this.productRepository = productRepository;
    this.supplierRepository = supplierRepository;
    this.orderItemRepository = orderItemRepository;
    this.transactionTemplate = transactionTemplate;
    this.properties = properties;
  }

  @Transactional(readOnly = true)
  public Product getProduct(Long id) {
    RequestGuards.requirePositiveId(id, "Product id");
    return productRepository.findById(id).orElseThrow(() -> NotFoundException.of("Product", id));
  }

  @Transactional(readOnly = true)
  public PageResult<Product> listProducts(
      Long supplierId,
      BigDecimal minPrice,
      BigDecimal maxPrice,
      Boolean discontinued,
      String search,
      PageSpec page) {
    if (supplierId != null) {
      RequestGuards.requirePositiveId(supplierId, "supplierId");
    }
    RequestGuards.requireNonNegative(minPrice, "minPrice");
    RequestGuards.requireNonNegative(maxPrice, "maxPrice");
    RequestGuards.requireOrdered(minPrice, maxPrice, "minPrice", "maxPrice");
    return PagedQueries.fetch(
        productRepository,
        ProductSpecifications.filter(supplierId, minPrice, maxPrice, discontinued, search),
        DEFAULT_SORT,
        page);
  }

  @Transactional(readOnly = true)
  public List<Product> listActiveProducts() {
    return productRepository.findByDiscontinued(false, DEFAULT_SORT);
  }

  @Transactional(readOnly = true)
  public List<Product> listDiscontinuedProducts() {
    return productRepository.findByDiscontinued(true, DEFAULT_SORT);
  }

  @Transactional(readOnly = true)
  public List<Product> listProductsBySupplier(Long supplierId) {
    Supplier supplier = findSupplier(supplierId);
    return productRepository.findBySupplierId(supplier.getId(), DEFAULT_SORT);
  }

  @Transactional(readOnly = true)
  public List<Product> searchProducts(String term) {
    OrderDeskProperties.Search search = properties.search();
    String trimmed = RequestGuards.requireSearchTerm(term, search.minTermLength());
    return productRepository
        .findAll(
            ProductSpecifications.matching(trimmed),
            PageRequest.of(0, search.maxResults(), DEFAULT_SORT))
        .getContent();
  }

  @Transactional
  public Product createProduct(Product details, Long supplierId) {
    RequestGuards.requirePositive(details.getUnitPrice(), "Unit price");
    Supplier supplier = findSupplier(supplierId);
    Product product =
        new Product(details.getName(), supplier, details.getUnitPrice(), details.getPackaging());
    product.setDiscontinued(details.isDiscontinued());
    Product saved = productRepository.save(product);
    log.info("Product created with ID: {} for supplier {}", saved.getId(), supplierId);
    return saved;
  }

  public Product updateProduct(Long id, Product details, Long supplierId) {
    RequestGuards.requirePositiveId(id, "Product id");
    RequestGuards.requirePositive(details.getUnitPrice(), "Unit price");
    return modify(
        id,
        product -> {
          product.setSupplier(findSupplier(supplierId));
          product.setName(details.getName());
          product.setUnitPrice(details.getUnitPrice());
          product.setPackaging(details.getPackaging());
          product.setDiscontinued(details.isDiscontinued());
        });
  }

  /** Changes the catalogue price. Items of existing orders keep the price they were sold at. */
  public Product updateProductPrice(Long id, BigDecimal unitPrice) {
    RequestGuards.requirePositiveId(id, "Product id");
    RequestGuards.requirePositive(unitPrice, "Unit price");
    return modify(id, product -> product.setUnitPrice(unitPrice));
  }

  public Product discontinueProduct(Long id) {
    RequestGuards.requirePositiveId(id, "Product id");
    return modify(
        id,
        product -> {
          if (product.isDiscontinued()) {
            throw new InvalidOperationException("Product " + id + " is already discontinued");
          }
          product.setDiscontinued(true);
        });
  }

  public Product reactivateProduct(Long id) {
    RequestGuards.requirePositiveId(id, "Product id");
    return modify(
        id,
        product -> {
          if (!product.isDiscontinued()) {
            throw new InvalidOperationException("Product " + id + " is already active");
          }
          product.setDiscontinued(false);
        });
  }

  public void deleteProduct(Long id) {
    RequestGuards.requirePositiveId(id, "Product id");
    ConcurrentWrites.runWithConflictCheck(
        "Product",
        id,
        () -> productRepository.existsById(id),
        () ->
            transactionTemplate.executeWithoutResult(
                status -> {
                  Product existing = getProduct(id);
                  if (orderItemRepository.existsByProductId(id)) {
                    log.warn("Refusing to delete product {}: it appears in orders", id);
                    throw new InvalidOperationException(
                        "Cannot delete product "
                            + id
                            + " because it is used in orders, discontinue it instead");
                  }
                  productRepository.delete(existing);
                  productRepository.flush();
                  log.info("Product {} deleted", id);
                }));
  }

  private Product modify(Long id, Consumer<Product> change) {
    return ConcurrentWrites.withConflictCheck(
        "Product",
        id,
        () -> productRepository.existsById(id),
        () ->
            transactionTemplate.execute(
                status -> {
                  Product product = getProduct(id);
                  change.accept(product);
                  Product saved = productRepository.saveAndFlush(product);
                  log.info("Product {} updated", id);
                  return saved;
                }));
  }

  @NotNull
  private Supplier findSupplier(Long supplierId) {
    RequestGuards.requirePositiveId(supplierId, "Supplier id");
    return supplierRepository
        .findById(supplierId)
        .orElseThrow(() -> NotFoundException.of("Supplier", supplierId));
  }
}
