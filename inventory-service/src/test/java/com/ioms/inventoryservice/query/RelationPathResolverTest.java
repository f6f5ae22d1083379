package com.ioms.inventoryservice.query;

import com.ioms.inventoryservice.query.schema.EntityKind;
import com.ioms.inventoryservice.query.schema.EntitySchema;
import com.ioms.inventoryservice.query.schema.RelationPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RelationPathResolver Unit Tests")
class RelationPathResolverTest {

  private RelationPathResolver resolver;

  @BeforeEach
  void setUp() {
    resolver = new RelationPathResolver(new EntitySchema());
  }

  @Nested
  @DisplayName("Entity name resolution")
  class EntityNameTests {

    @ParameterizedTest
    @EnumSource(EntityKind.class)
    @DisplayName("every target kind is reachable from every source kind")
    void shouldReachEveryKind(EntityKind source) {
      for (EntityKind target : EntityKind.values()) {
        RelationPath path = resolver.resolve(source, target.entityName());

        assertThat(path.getRoot()).isEqualTo(source);
        assertThat(path.target()).isEqualTo(target);
        assertThat(path.isEmpty()).isEqualTo(source == target);
      }
    }

    @Test
    @DisplayName("should resolve brand to customer through products, order items and orders")
    void shouldResolveBrandToCustomer() {
      RelationPath path = resolver.resolve(EntityKind.BRAND, "customer");

      assertThat(path.dotted()).isEqualTo("products.orderItems.order.customer");
      assertThat(path.isSingleValued()).isFalse();
      assertThat(path.isEagerJoinable()).isFalse();
    }

    @Test
    @DisplayName("should resolve to-one chain from stock to brand as eager joinable")
    void shouldResolveStockToBrandAsEager() {
      RelationPath path = resolver.resolve(EntityKind.STOCK, "brand");

      assertThat(path.dotted()).isEqualTo("product.brand");
      assertThat(path.isEagerJoinable()).isTrue();
      assertThat(path.isSingleValued()).isTrue();
    }

    @Test
    @DisplayName("should treat order to payment as single valued but not eager")
    void shouldTreatPaymentAsReverseOneToOne() {
      RelationPath path = resolver.resolve(EntityKind.ORDER, "payment");

      assertThat(path.dotted()).isEqualTo("payment");
      assertThat(path.isSingleValued()).isTrue();
      assertThat(path.isEagerJoinable()).isFalse();
    }

    @Test
    @DisplayName("should accept entity names in any case and with underscores")
    void shouldNormalizeEntityNames() {
      assertThat(resolver.resolve(EntityKind.ORDER, "order_item").dotted()).isEqualTo("items");
      assertThat(resolver.resolve(EntityKind.ORDER, "OrderItem").dotted()).isEqualTo("items");
      assertThat(resolver.resolve(EntityKind.ORDER, "orderitem").dotted()).isEqualTo("items");
    }
  }

  @Nested
  @DisplayName("Raw path fallback")
  class RawPathTests {

    @Test
    @DisplayName("should parse relation names that are not entity names")
    void shouldParseRawRelationPath() {
      RelationPath path = resolver.resolve(EntityKind.PRODUCT, "stocks__warehouse");

      assertThat(path.dotted()).isEqualTo("stocks.warehouse");
      assertThat(path.target()).isEqualTo(EntityKind.WAREHOUSE);
    }

    @Test
    @DisplayName("should accept snake_case relation names")
    void shouldAcceptSnakeCase() {
      RelationPath path = resolver.resolve(EntityKind.PRODUCT, "order_items.order");

      assertThat(path.dotted()).isEqualTo("orderItems.order");
    }

    @Test
    @DisplayName("should reject unknown names with InvalidPathException")
    void shouldRejectUnknownName() {
      assertThatThrownBy(() -> resolver.resolve(EntityKind.BRAND, "supplier"))
          .isInstanceOf(InvalidPathException.class)
          .hasMessageContaining("supplier");
    }

    @Test
    @DisplayName("find should return empty instead of throwing")
    void findShouldReturnEmptyForUnknownName() {
      assertThat(resolver.find(EntityKind.BRAND, "supplier")).isEmpty();
    }
  }
}
