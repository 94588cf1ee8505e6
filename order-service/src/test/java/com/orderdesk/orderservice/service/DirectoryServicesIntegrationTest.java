package com.orderdesk.orderservice.service;

import com.orderdesk.orderservice.exception.InvalidInputException;
import com.orderdesk.orderservice.exception.InvalidOperationException;
import com.orderdesk.orderservice.exception.NotFoundException;
import com.orderdesk.orderservice.model.Customer;
import com.orderdesk.orderservice.model.Product;
import com.orderdesk.orderservice.model.Supplier;
import com.orderdesk.orderservice.support.IntegrationTestSupport;
import com.orderdesk.querysupport.paging.PageResult;
import com.orderdesk.querysupport.paging.PageSpec;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DirectoryServicesIntegrationTest extends IntegrationTestSupport {

  @Autowired private CustomerService customerService;

  @Autowired private SupplierService supplierService;

  @Autowired private ProductService productService;

  @Autowired private OrderService orderService;

  @Test
  void listCustomers_shouldPageInNameOrder_andNormalisePaging() {
    for (int i = 25; i >= 1; i--) {
      customer("First" + i, String.format("Last%02d", i), i % 2 == 0 ? "Germany" : "France");
    }

    PageResult<Customer> third = customerService.listCustomers(null, null, null, PageSpec.of(3, 10));
    assertThat(third.getContent()).extracting(Customer::getLastName)
        .containsExactly("Last21", "Last22", "Last23", "Last24", "Last25");
    assertThat(third.getTotalCount()).isEqualTo(25);
    assertThat(third.getTotalPages()).isEqualTo(3);

    PageResult<Customer> beyond = customerService.listCustomers(null, null, null, PageSpec.of(4, 10));
    assertThat(beyond.getContent()).isEmpty();
    assertThat(beyond.getTotalCount()).isEqualTo(25);

    PageResult<Customer> defaulted = customerService.listCustomers(null, null, null, PageSpec.of(0, 101));
    assertThat(defaulted.getPage()).isEqualTo(1);
    assertThat(defaulted.getContent()).hasSize(10);
  }

  @Test
  void listCustomers_shouldReturnEmptyPage_whenOffsetExceedsIntRange() {
    customer("Maria", "Anders", "Germany");

    PageResult<Customer> last = customerService.listCustomers(null, null, null, PageSpec.of(Integer.MAX_VALUE, 10));
    assertThat(last.getContent()).isEmpty();
    assertThat(last.getTotalCount()).isEqualTo(1);
    assertThat(last.getPage()).isEqualTo(Integer.MAX_VALUE);

    PageResult<Customer> far = customerService.listCustomers(null, null, null, PageSpec.of(300_000_000, 10));
    assertThat(far.getContent()).isEmpty();
    assertThat(far.getTotalCount()).isEqualTo(1);
  }

  @Test
  void listCustomers_shouldFilterCaseInsensitively() {
    customer("Maria", "Anders", "Germany");
    customer("Ana", "Trujillo", "Mexico");
    customer("Thomas", "Hardy", "UK");

    assertThat(customerService.listCustomers("germ", null, null, PageSpec.of(1, 10)).getContent())
        .extracting(Customer::getLastName)
        .containsExactly("Anders");
    assertThat(customerService.listCustomers(null, null, "AN", PageSpec.of(1, 10)).getContent())
        .extracting(Customer::getLastName)
        .containsExactly("Anders", "Trujillo");
  }

  @Test
  void searchTerms_shouldMatchWildcardCharactersLiterally() {
    Supplier plain = supplier("Plain Foods", "UK");
    Supplier percent = supplier("100% Organic", "UK");

    assertThat(supplierService.searchSuppliers("0%")).extracting(Supplier::getId)
        .containsExactly(percent.getId());
    assertThat(supplierService.searchSuppliers("n_F")).isEmpty();
    assertThat(supplierService.searchSuppliers(" plain ")).extracting(Supplier::getId)
        .containsExactly(plain.getId());
  }

  @Test
  void search_shouldRejectBlankOrShortTerms() {
    assertThatThrownBy(() -> supplierService.searchSuppliers("  "))
        .isInstanceOf(InvalidInputException.class);
    assertThatThrownBy(() -> productService.searchProducts("a"))
        .isInstanceOf(InvalidInputException.class);
  }

  @Test
  void searchProducts_shouldLookAtSupplierNameToo() {
    Supplier tokyo = supplier("Tokyo Traders", "Japan");
    Supplier other = supplier("Other", "Japan");
    product("Ikura", tokyo, "31.00");
    product("Tokyo Tofu", other, "23.25");
    product("Konbu", other, "6.00");

    assertThat(productService.searchProducts("tokyo")).extracting(Product::getName)
        .containsExactly("Ikura", "Tokyo Tofu");
  }

  @Test
  void listProducts_shouldValidatePriceRange() {
    assertThatThrownBy(
            () ->
                productService.listProducts(
                    null, new BigDecimal("10"), new BigDecimal("5"), null, null, PageSpec.of(1, 10)))
        .isInstanceOf(InvalidInputException.class);
    assertThatThrownBy(
            () ->
                productService.listProducts(
                    null, new BigDecimal("-1"), null, null, null, PageSpec.of(1, 10)))
        .isInstanceOf(InvalidInputException.class);
    assertThatThrownBy(
            () -> productService.listProducts(0L, null, null, null, null, PageSpec.of(1, 10)))
        .isInstanceOf(InvalidInputException.class);
  }

  @Test
  void listProducts_shouldCombineFilters() {
    Supplier supplier = supplier("Pavlova", "Australia");
    product("Vegie-spread", supplier, "43.90");
    product("Pavlova", supplier, "17.45");
    discontinuedProduct("Alice Mutton", supplier, "39.00");

    PageResult<Product> result =
        productService.listProducts(
            supplier.getId(), new BigDecimal("20"), null, false, null, PageSpec.of(1, 10));

    assertThat(result.getContent()).extracting(Product::getName).containsExactly("Vegie-spread");
  }

  @Test
  void deleteCustomer_shouldBeRefused_whileOrdersExist() {
    Customer customer = customer("Ada", "Lovelace", "UK");
    Product product = product("Coffee", supplier("Beans Ltd", "UK"), "5.00");
    orderService.createOrder(customer.getId(), List.of(new OrderLine(product.getId(), 1)));

    assertThatThrownBy(() -> customerService.deleteCustomer(customer.getId()))
        .isInstanceOf(InvalidOperationException.class);
    assertThat(customerRepository.existsById(customer.getId())).isTrue();

    Customer idle = customer("Idle", "Person", "UK");
    customerService.deleteCustomer(idle.getId());
    assertThat(customerRepository.existsById(idle.getId())).isFalse();
  }

  @Test
  void deleteSupplier_shouldBeRefused_whileProductsExist() {
    Supplier supplier = supplier("Busy Ltd", "UK");
    product("Something", supplier, "1.00");

    assertThatThrownBy(() -> supplierService.deleteSupplier(supplier.getId()))
        .isInstanceOf(InvalidOperationException.class);
    assertThatThrownBy(() -> supplierService.deleteSupplier(999_999L))
        .isInstanceOf(NotFoundException.class);
  }

  @Test
  void deleteProduct_shouldBeRefused_onceOrdered_butCanBeDiscontinued() {
    Customer customer = customer("Ada", "Lovelace", "UK");
    Supplier supplier = supplier("Beans Ltd", "UK");
    Product ordered = product("Coffee", supplier, "5.00");
    Product unused = product("Decaf", supplier, "4.00");
    orderService.createOrder(customer.getId(), List.of(new OrderLine(ordered.getId(), 1)));

    assertThatThrownBy(() -> productService.deleteProduct(ordered.getId()))
        .isInstanceOf(InvalidOperationException.class)
        .hasMessageContaining("discontinue");
    assertThat(productService.discontinueProduct(ordered.getId()).isDiscontinued()).isTrue();
    assertThatThrownBy(() -> productService.discontinueProduct(ordered.getId()))
        .isInstanceOf(InvalidOperationException.class);
    assertThat(productService.reactivateProduct(ordered.getId()).isDiscontinued()).isFalse();
    assertThatThrownBy(() -> productService.reactivateProduct(ordered.getId()))
        .isInstanceOf(InvalidOperationException.class);

    productService.deleteProduct(unused.getId());
    assertThat(productRepository.existsById(unused.getId())).isFalse();
  }

  @Test
  void createProduct_shouldRequireSupplierAndPositivePrice() {
    Supplier supplier = supplier("Beans Ltd", "UK");
    Product details = new Product("Coffee", null, new BigDecimal("5.00"), "1 kg bag");

    Product created = productService.createProduct(details, supplier.getId());
    assertThat(created.getSupplier().getCompanyName()).isEqualTo("Beans Ltd");

    assertThatThrownBy(() -> productService.createProduct(details, 999_999L))
        .isInstanceOf(NotFoundException.class);
    Product free = new Product("Free", null, BigDecimal.ZERO, null);
    assertThatThrownBy(() -> productService.createProduct(free, supplier.getId()))
        .isInstanceOf(InvalidInputException.class);
    assertThatThrownBy(() -> productService.updateProductPrice(created.getId(), new BigDecimal("-1")))
        .isInstanceOf(InvalidInputException.class);
  }

  @Test
  void countriesAndCities_shouldBeDistinctAndSorted() {
    customerRepository.save(new Customer("A", "One", "Berlin", "Germany", null));
    customerRepository.save(new Customer("B", "Two", "Aachen", "Germany", null));
    customerRepository.save(new Customer("C", "Three", "Berlin", "Germany", null));
    customerRepository.save(new Customer("D", "Four", "Lyon", "France", null));
    customerRepository.save(new Customer("E", "Five", null, null, null));

    assertThat(customerService.listCountries()).containsExactly("France", "Germany");
    assertThat(customerService.listCities(null)).containsExactly("Aachen", "Berlin", "Lyon");
    assertThat(customerService.listCities("Germany")).containsExactly("Aachen", "Berlin");
  }

  @Test
  void updateCustomer_shouldOverwriteDetails() {
    Customer customer = customer("Ada", "Lovelace", "UK");

    customerService.updateCustomer(
        customer.getId(), new Customer("Augusta Ada", "King", "London", "UK", "555"));

    Customer reloaded = customerService.getCustomer(customer.getId());
    assertThat(reloaded.getFullName()).isEqualTo("Augusta Ada King");
    assertThat(reloaded.getCity()).isEqualTo("London");
    assertThatThrownBy(() -> customerService.updateCustomer(999_999L, reloaded))
        .isInstanceOf(NotFoundException.class);
  }
}
