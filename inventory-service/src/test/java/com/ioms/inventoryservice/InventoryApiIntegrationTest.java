package com.ioms.inventoryservice;

import com.ioms.inventoryservice.model.Brand;
import com.ioms.inventoryservice.model.Category;
import com.ioms.inventoryservice.model.Customer;
import com.ioms.inventoryservice.model.Order;
import com.ioms.inventoryservice.model.Payment;
import com.ioms.inventoryservice.model.PaymentMethod;
import com.ioms.inventoryservice.model.PaymentStatus;
import com.ioms.inventoryservice.model.Product;
import com.ioms.inventoryservice.model.Warehouse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP surface: related queries, confirmation actions and the error payloads they produce.
 */
@AutoConfigureMockMvc
class InventoryApiIntegrationTest extends AbstractIntegrationTest {

  @Autowired
  private MockMvc mockMvc;

  private Brand brand;
  private Category category;
  private Product phone;
  private Customer customer;

  @BeforeEach
  void setUp() {
    brand = brand("Acme");
    category = category("Phones");
    phone = product("Phone X", "PX-1", brand, category, Instant.parse("2024-05-01T12:00:00Z"));
    customer = customer("Ana Lopez", "ana@example.com");
  }

  @Test
  void should_return_related_query_envelope() throws Exception {
    mockMvc.perform(get("/api/v1/products/related")
            .param("join", "brand")
            .param("fields[product]", "name,sku")
            .param("fields[brand]", "name"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.count").value(1))
        .andExpect(jsonPath("$.results[0].name").value("Phone X"))
        .andExpect(jsonPath("$.results[0].sku").value("PX-1"))
        .andExpect(jsonPath("$.results[0].brand.name").value("Acme"))
        .andExpect(jsonPath("$.query").exists());
  }

  @Test
  void should_reject_unresolvable_join_path() throws Exception {
    mockMvc.perform(get("/api/v1/products/related").param("join", "brand.owner"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value("INVALID_PATH"))
        .andExpect(jsonPath("$.error").value(containsString("brand.owner")));
  }

  @Test
  void should_reject_filter_value_of_wrong_type() throws Exception {
    mockMvc.perform(get("/api/v1/stocks/related").param("filter[stock]", "qty__gte=many"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value("INVALID_FILTER_VALUE"));
  }

  @Test
  void should_confirm_order_and_report_insufficient_stock() throws Exception {
    stock(phone, warehouse("Main", "Izmir"), 3);
    Order small = order(customer, Instant.now(), 2, phone);
    Order large = order(customer, Instant.now(), 5, phone);

    mockMvc.perform(post("/api/v1/orders/{orderId}/confirm", small.getId()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("CONFIRMED"));

    mockMvc.perform(post("/api/v1/orders/{orderId}/confirm", large.getId()))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.errorCode").value("INSUFFICIENT_STOCK"))
        .andExpect(jsonPath("$.error").value("Insufficient stock for product 'Phone X'. Missing: 4"));

    mockMvc.perform(post("/api/v1/orders/{orderId}/confirm", small.getId()))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.errorCode").value("INVALID_STATE_TRANSITION"));
  }

  @Test
  void should_confirm_payment_once() throws Exception {
    Order order = order(customer, Instant.now(), 1, phone);
    Payment payment = paymentRepository.save(Payment.builder()
        .order(order)
        .method(PaymentMethod.CARD)
        .amount(new BigDecimal("100.00"))
        .build());

    mockMvc.perform(post("/api/v1/payments/{paymentId}/confirm", payment.getId()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("CONFIRMED"));

    mockMvc.perform(post("/api/v1/payments/{paymentId}/confirm", payment.getId()))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.errorCode").value("INVALID_STATE_TRANSITION"));
  }

  @Test
  void should_return_not_found_for_missing_order() throws Exception {
    mockMvc.perform(get("/api/v1/orders/{orderId}", UUID.randomUUID()))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.errorCode").value("RESOURCE_NOT_FOUND"));
  }

  @Test
  void should_refuse_to_delete_brand_with_products() throws Exception {
    mockMvc.perform(delete("/api/v1/brands/{brandId}", brand.getId()))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.errorCode").value("REFERENTIAL_INTEGRITY_VIOLATION"));
  }

  @Test
  void should_validate_request_bodies() throws Exception {
    mockMvc.perform(post("/api/v1/customers")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"fullName\":\"\",\"email\":\"not-an-email\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"))
        .andExpect(jsonPath("$.violations[?(@.field == 'email')].message").value("Email must be valid"));
  }

  @Test
  void should_create_customer() throws Exception {
    mockMvc.perform(post("/api/v1/customers")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"fullName\":\"Bo Chen\",\"email\":\"bo@example.com\"}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.id").exists())
        .andExpect(jsonPath("$.email").value("bo@example.com"));
  }

  @Test
  void should_combine_repeated_filter_parameters() throws Exception {
    product("Phone Y", "PY-1", brand, category, Instant.parse("2024-05-02T12:00:00Z"));

    mockMvc.perform(get("/api/v1/products/related")
            .param("filter[product]", "name__startswith=Phone")
            .param("filter[product]", "sku=PX-1")
            .param("fields[product]", "sku"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.count").value(1))
        .andExpect(jsonPath("$.results[0].sku").value("PX-1"));
  }

  @Test
  void should_report_derived_totals() throws Exception {
    // 1. ARRANGE
    Product inactive = productRepository.save(Product.builder()
        .name("Phone Old").sku("PO-1").price(new BigDecimal("50.00"))
        .brand(brand).category(category).isActive(false).build());
    Warehouse izmir = warehouse("Main", "Izmir");
    Warehouse ankara = warehouse("Backup", "Ankara");
    stock(phone, izmir, 7);
    stock(phone, ankara, 3);
    stock(inactive, izmir, 0);

    Order paid = order(customer, Instant.now(), 1, phone);
    Order unpaid = order(customer, Instant.now(), 1, phone);
    paymentRepository.save(Payment.builder().order(paid).method(PaymentMethod.CARD)
        .amount(new BigDecimal("100.00")).status(PaymentStatus.CONFIRMED).build());
    paymentRepository.save(Payment.builder().order(unpaid).method(PaymentMethod.COD)
        .amount(new BigDecimal("100.00")).build());

    // 2. ACT & ASSERT: only active products are counted
    mockMvc.perform(get("/api/v1/brands/{brandId}", brand.getId()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.productsCount").value(1));
    mockMvc.perform(get("/api/v1/categories"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].productsCount").value(1));

    // stock is summed over every warehouse
    mockMvc.perform(get("/api/v1/products/{productId}", phone.getId()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.totalStock").value(10));

    // empty stock rows do not count as stocked products
    mockMvc.perform(get("/api/v1/warehouses/{warehouseId}", izmir.getId()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.totalProducts").value(1));

    // only confirmed payments are spent
    mockMvc.perform(get("/api/v1/customers/{customerId}", customer.getId()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ordersCount").value(2))
        .andExpect(jsonPath("$.totalSpent").value(100.0));
    mockMvc.perform(get("/api/v1/customers"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].ordersCount").value(2))
        .andExpect(jsonPath("$[0].totalSpent").value(100.0));
  }

  @Test
  void should_list_active_products_below_stock_threshold() throws Exception {
    // 1. ARRANGE: Phone X holds 7, Tablet 12, Watch has no stock rows, Phone Old is inactive
    Warehouse izmir = warehouse("Main", "Izmir");
    Warehouse ankara = warehouse("Backup", "Ankara");
    stock(phone, izmir, 4);
    stock(phone, ankara, 3);
    stock(product("Tablet", "TB-1", brand, category, Instant.now()), izmir, 12);
    product("Watch", "WT-1", brand, category, Instant.now());
    Product inactive = productRepository.save(Product.builder()
        .name("Phone Old").sku("PO-1").price(new BigDecimal("50.00"))
        .brand(brand).category(category).isActive(false).build());
    stock(inactive, izmir, 1);

    // 2. ACT & ASSERT: default threshold of 10
    mockMvc.perform(get("/api/v1/products/low-stock"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(1))
        .andExpect(jsonPath("$[0].name").value("Phone X"))
        .andExpect(jsonPath("$[0].totalStock").value(7));

    // explicit threshold, ordered by name
    mockMvc.perform(get("/api/v1/products/low-stock").param("threshold", "13"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(2))
        .andExpect(jsonPath("$[0].name").value("Phone X"))
        .andExpect(jsonPath("$[1].name").value("Tablet"));

    mockMvc.perform(get("/api/v1/products/low-stock").param("threshold", "-1"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void should_refuse_to_delete_customer_with_orders() throws Exception {
    order(customer, Instant.now(), 1, phone);

    mockMvc.perform(delete("/api/v1/customers/{customerId}", customer.getId()))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.errorCode").value("REFERENTIAL_INTEGRITY_VIOLATION"));

    assertThat(customerRepository.existsById(customer.getId())).isTrue();
  }

  @Test
  void should_refuse_to_delete_ordered_product_but_delete_unordered_one() throws Exception {
    Warehouse izmir = warehouse("Main", "Izmir");
    order(customer, Instant.now(), 1, phone);
    Product unordered = product("Tablet", "TB-1", brand, category, Instant.now());
    stock(unordered, izmir, 5);

    mockMvc.perform(delete("/api/v1/products/{productId}", phone.getId()))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.errorCode").value("REFERENTIAL_INTEGRITY_VIOLATION"));

    mockMvc.perform(delete("/api/v1/products/{productId}", unordered.getId()))
        .andExpect(status().isNoContent());

    assertThat(productRepository.existsById(phone.getId())).isTrue();
    assertThat(productRepository.existsById(unordered.getId())).isFalse();
    assertThat(stockRepository.findAll()).isEmpty();
  }
}
