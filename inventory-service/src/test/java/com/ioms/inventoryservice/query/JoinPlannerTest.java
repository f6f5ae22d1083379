package com.ioms.inventoryservice.query;

import com.ioms.inventoryservice.query.schema.EntityKind;
import com.ioms.inventoryservice.query.schema.EntitySchema;
import com.ioms.inventoryservice.query.schema.RelationPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JoinPlanner Unit Tests")
class JoinPlannerTest {

  private EntitySchema schema;
  private JoinPlanner planner;

  @BeforeEach
  void setUp() {
    schema = new EntitySchema();
    planner = new JoinPlanner(schema);
  }

  @Test
  @DisplayName("should classify to-one chains as eager and to-many paths as batched")
  void shouldClassifyPaths() {
    JoinPlan plan = planner.plan(EntityKind.PRODUCT, List.of("brand", "category", "stocks__warehouse"));

    assertThat(plan.getEagerJoins()).extracting(RelationPath::dotted).containsExactly("brand", "category");
    assertThat(plan.getBatchedLoads()).extracting(RelationPath::dotted).containsExactly("stocks.warehouse");
  }

  @Test
  @DisplayName("first to-many hop downgrades the whole path to a batched load")
  void shouldDowngradeOnFirstToManyHop() {
    JoinPlan plan = planner.plan(EntityKind.STOCK, List.of("product.orderItems.order"));

    assertThat(plan.getEagerJoins()).isEmpty();
    assertThat(plan.getBatchedLoads()).extracting(RelationPath::dotted).containsExactly("product.orderItems.order");
    // the to-one prefix is still fetched with the root rows
    assertThat(plan.fetchPaths()).extracting(RelationPath::dotted).containsExactly("product");
  }

  @Test
  @DisplayName("should drop duplicates and paths covered by a longer requested path")
  void shouldDropDuplicatesAndPrefixes() {
    JoinPlan plan = planner.plan(EntityKind.CUSTOMER, List.of("orders", "orders", "orders.items", " "));

    assertThat(plan.getBatchedLoads()).extracting(RelationPath::dotted).containsExactly("orders.items");
    assertThat(plan.covers(schema.parsePath(EntityKind.CUSTOMER, "orders"))).isTrue();
    assertThat(plan.covers(schema.parsePath(EntityKind.CUSTOMER, "orders.payment"))).isFalse();
  }

  @Test
  @DisplayName("reverse one-to-one is a batched load")
  void shouldBatchReverseOneToOne() {
    JoinPlan plan = planner.plan(EntityKind.ORDER, List.of("payment", "customer"));

    assertThat(plan.getEagerJoins()).extracting(RelationPath::dotted).containsExactly("customer");
    assertThat(plan.getBatchedLoads()).extracting(RelationPath::dotted).containsExactly("payment");
  }

  @Test
  @DisplayName("should reject unknown relation segments")
  void shouldRejectUnknownSegment() {
    assertThatThrownBy(() -> planner.plan(EntityKind.PRODUCT, List.of("brand.owner")))
        .isInstanceOf(InvalidPathException.class)
        .hasMessageContaining("brand.owner");
  }

  @Test
  @DisplayName("empty join list produces an empty plan")
  void shouldProduceEmptyPlan() {
    JoinPlan plan = planner.plan(EntityKind.BRAND, List.of());

    assertThat(plan.isEmpty()).isTrue();
    assertThat(plan.fetchPaths()).isEmpty();
  }
}
