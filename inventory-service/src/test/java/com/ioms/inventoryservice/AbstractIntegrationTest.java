package com.ioms.inventoryservice;

import com.ioms.inventoryservice.model.Brand;
import com.ioms.inventoryservice.model.Category;
import com.ioms.inventoryservice.model.Customer;
import com.ioms.inventoryservice.model.Order;
import com.ioms.inventoryservice.model.OrderItem;
import com.ioms.inventoryservice.model.Product;
import com.ioms.inventoryservice.model.Stock;
import com.ioms.inventoryservice.model.Warehouse;
import com.ioms.inventoryservice.repository.BrandRepository;
import com.ioms.inventoryservice.repository.CategoryRepository;
import com.ioms.inventoryservice.repository.CustomerRepository;
import com.ioms.inventoryservice.repository.OrderItemRepository;
import com.ioms.inventoryservice.repository.OrderRepository;
import com.ioms.inventoryservice.repository.PaymentRepository;
import com.ioms.inventoryservice.repository.ProductRepository;
import com.ioms.inventoryservice.repository.StockRepository;
import com.ioms.inventoryservice.repository.WarehouseRepository;
import org.junit.jupiter.api.AfterEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Boots the whole service against a PostgreSQL container shared by every test class.
 * Tables are emptied after every test, children first.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Testcontainers
@ActiveProfiles("test")
public abstract class AbstractIntegrationTest {

  static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine");

  static {
    POSTGRES.start();
  }

  @DynamicPropertySource
  static void dynamicProperties(DynamicPropertyRegistry registry) {
    registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);
  }

  @Autowired
  protected BrandRepository brandRepository;
  @Autowired
  protected CategoryRepository categoryRepository;
  @Autowired
  protected ProductRepository productRepository;
  @Autowired
  protected WarehouseRepository warehouseRepository;
  @Autowired
  protected StockRepository stockRepository;
  @Autowired
  protected CustomerRepository customerRepository;
  @Autowired
  protected OrderRepository orderRepository;
  @Autowired
  protected OrderItemRepository orderItemRepository;
  @Autowired
  protected PaymentRepository paymentRepository;

  @AfterEach
  void cleanDatabase() {
    paymentRepository.deleteAllInBatch();
    orderItemRepository.deleteAllInBatch();
    orderRepository.deleteAllInBatch();
    stockRepository.deleteAllInBatch();
    productRepository.deleteAllInBatch();
    customerRepository.deleteAllInBatch();
    brandRepository.deleteAllInBatch();
    categoryRepository.deleteAllInBatch();
    warehouseRepository.deleteAllInBatch();
  }

  protected Brand brand(String name) {
    return brandRepository.save(Brand.builder().name(name).build());
  }

  protected Category category(String name) {
    return categoryRepository.save(Category.builder().name(name).build());
  }

  protected Product product(String name, String sku, Brand brand, Category category, Instant createdAt) {
    return productRepository.save(Product.builder()
        .name(name)
        .sku(sku)
        .price(new BigDecimal("100.00"))
        .brand(brand)
        .category(category)
        .createdAt(createdAt)
        .build());
  }

  protected Warehouse warehouse(String name, String city) {
    return warehouseRepository.save(Warehouse.builder().name(name).city(city).build());
  }

  protected Stock stock(Product product, Warehouse warehouse, int qty) {
    return stockRepository.save(Stock.builder().product(product).warehouse(warehouse).qty(qty).reserved(0).build());
  }

  protected Customer customer(String fullName, String email) {
    return customerRepository.save(Customer.builder().fullName(fullName).email(email).build());
  }

  /**
   * Saves a pending order with one line per product, each for {@code qty} units.
   */
  protected Order order(Customer customer, Instant createdAt, int qty, Product... products) {
    Order order = Order.builder().customer(customer).createdAt(createdAt).build();
    for (Product product : products) {
      order.addItem(OrderItem.builder().product(product).qty(qty).unitPrice(product.getPrice()).build());
    }
    return orderRepository.save(order);
  }
}
