package com.orderdesk.orderservice.service;

import com.orderdesk.orderservice.config.OrderDeskProperties;
import com.orderdesk.orderservice.exception.InvalidOperationException;
import com.orderdesk.orderservice.exception.NotFoundException;
import com.orderdesk.orderservice.model.Product;
import com.orderdesk.orderservice.model.Supplier;
import com.orderdesk.orderservice.repository.ProductRepository;
import com.orderdesk.orderservice.repository.SupplierRepository;
import com.orderdesk.orderservice.repository.specification.SupplierSpecifications;
import com.orderdesk.querysupport.paging.PageResult;
import com.orderdesk.querysupport.paging.PageSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

@Service
public class SupplierService {

  private static final Logger log = LoggerFactory.getLogger(SupplierService.class);

  static final Sort DEFAULT_SORT = Sort.by("companyName", "id");

  private final SupplierRepository supplierRepository;
  private final ProductRepository productRepository;
  private final TransactionTemplate transactionTemplate;
  private final OrderDeskProperties properties;

  @Autowired
  public SupplierService(
      SupplierRepository supplierRepository,
      ProductRepository productRepository,
      TransactionTemplate transactionTemplate,
      OrderDeskProperties properties) {
    this.supplierRepository = supplierRepository;
    this.productRepository = productRepository;
    this.transactionTemplate = transactionTemplate;
    this.properties = properties;
  }

  @Transactional(readOnly = true)
  public Supplier getSupplier(Long id) {
    RequestGuards.requirePositiveId(id, "Supplier id");
    return supplierRepository.findById(id).orElseThrow(() -> NotFoundException.of("Supplier", id));
  }

  @Transactional(readOnly = true)
  public PageResult<Supplier> listSuppliers(
      String country, String city, String search, PageSpec page) {
    return PagedQueries.fetch(
        supplierRepository, SupplierSpecifications.filter(country, city, search), DEFAULT_SORT, page);
  }

  @Transactional(readOnly = true)
  public List<Product> getSupplierProducts(Long id) {
    Supplier supplier = getSupplier(id);
    return productRepository.findBySupplierId(supplier.getId(), ProductService.DEFAULT_SORT);
  }

  @Transactional(readOnly = true)
  public List<Product> getSupplierActiveProducts(Long id) {
    Supplier supplier = getSupplier(id);
    return productRepository.findBySupplierIdAndDiscontinuedFalse(
        supplier.getId(), ProductService.DEFAULT_SORT);
  }

  @Transactional(readOnly = true)
  public List<Supplier> searchSuppliers(String term) {
    OrderDeskProperties.Search search = properties.search();
    String trimmed = RequestGuards.requireSearchTerm(term, search.minTermLength());
    return supplierRepository
        .findAll(
            SupplierSpecifications.matching(trimmed),
            PageRequest.of(0, search.maxResults(), DEFAULT_SORT))
        .getContent();
  }

  @Transactional
  public Supplier createSupplier(Supplier details) {
    Supplier supplier = new Supplier();
    copyDetails(details, supplier);
    Supplier saved = supplierRepository.save(supplier);
    log.info("Supplier created with ID: {}", saved.getId());
    return saved;
  }

  public Supplier updateSupplier(Long id, Supplier details) {
    RequestGuards.requirePositiveId(id, "Supplier id");
    return ConcurrentWrites.withConflictCheck(
        "Supplier",
        id,
        () -> supplierRepository.existsById(id),
        () ->
            transactionTemplate.execute(
                status -> {
                  Supplier existing = getSupplier(id);
                  copyDetails(details, existing);
                  Supplier saved = supplierRepository.saveAndFlush(existing);
                  log.info("Supplier {} updated", id);
                  return saved;
                }));
  }

  public void deleteSupplier(Long id) {
    RequestGuards.requirePositiveId(id, "Supplier id");
    ConcurrentWrites.runWithConflictCheck(
        "Supplier",
        id,
        () -> supplierRepository.existsById(id),
        () ->
            transactionTemplate.executeWithoutResult(
                status -> {
                  Supplier existing = getSupplier(id);
                  if (productRepository.existsBySupplierId(id)) {
                    log.warn("Refusing to delete supplier {}: it still has products", id);
                    throw new InvalidOperationException(
                        "Cannot delete supplier " + id + " because it has existing products");
                  }
                  supplierRepository.delete(existing);
                  supplierRepository.flush();
                  log.info("Supplier {} deleted", id);
                }));
  }

  @Transactional(readOnly = true)
  public List<String> listCountries() {
    return supplierRepository.findDistinctCountries();
  }

  @Transactional(readOnly = true)
  public List<String> listCities(String country) {
    return supplierRepository.findDistinctCities(
        country == null || country.isBlank() ? null : country.trim());
  }

  private void copyDetails(Supplier from, Supplier to) {
    to.setCompanyName(from.getCompanyName());
    to.setContactName(from.getContactName());
    to.setCity(from.getCity());
    to.setCountry(from.getCountry());
    to.setPhone(from.getPhone());
    to.setFax(from.getFax());
  }
}
