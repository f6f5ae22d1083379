package com.ioms.inventoryservice.query.filter;

import com.ioms.inventoryservice.query.InvalidFilterValueException;
import com.ioms.inventoryservice.query.InvalidPathException;
import com.ioms.inventoryservice.query.RelationPathResolver;
import com.ioms.inventoryservice.query.schema.EntityKind;
import com.ioms.inventoryservice.query.schema.EntitySchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FilterCompiler Unit Tests")
class FilterCompilerTest {

  private FilterCompiler compiler;

  @BeforeEach
  void setUp() {
    EntitySchema schema = new EntitySchema();
    compiler = new FilterCompiler(schema, new RelationPathResolver(schema));
  }

  @Test
  @DisplayName("filters on the root entity apply to root attributes")
  void shouldCompileRootFilter() {
    List<FilterClause> clauses = compiler.compile(EntityKind.PRODUCT,
        Map.of("product", "name__icontains=phone,is_active=true"));

    assertThat(clauses).hasSize(2);
    assertThat(clauses.get(0).getPath().isEmpty()).isTrue();
    assertThat(clauses.get(0).getAttribute().getName()).isEqualTo("name");
    assertThat(clauses.get(0).getLookup()).isEqualTo(Lookup.ICONTAINS);
    assertThat(clauses.get(0).getValue()).isEqualTo("phone");
    assertThat(clauses.get(1).getAttribute().getName()).isEqualTo("isActive");
    assertThat(clauses.get(1).getValue()).isEqualTo(Boolean.TRUE);
  }

  @Test
  @DisplayName("filters on another entity are prefixed with the resolved path")
  void shouldPrefixRelatedEntityPath() {
    List<FilterClause> clauses = compiler.compile(EntityKind.PRODUCT,
        Map.of("customer", "email=ana@example.com"));

    assertThat(clauses).singleElement().satisfies(clause -> {
      assertThat(clause.getPath().dotted()).isEqualTo("orderItems.order.customer");
      assertThat(clause.getAttribute().getName()).isEqualTo("email");
      assertThat(clause.getLookup()).isEqualTo(Lookup.EXACT);
    });
  }

  @Test
  @DisplayName("field part may walk further relations")
  void shouldFollowRelationsInsideField() {
    List<FilterClause> clauses = compiler.compile(EntityKind.STOCK,
        Map.of("product", "brand__name__istartswith=acm"));

    assertThat(clauses).singleElement().satisfies(clause -> {
      assertThat(clause.getPath().dotted()).isEqualTo("product.brand");
      assertThat(clause.getLookup()).isEqualTo(Lookup.ISTARTSWITH);
    });
  }

  @Test
  @DisplayName("a bare relation name compares the related id")
  void shouldCompareRelationById() {
    UUID brandId = UUID.randomUUID();

    List<FilterClause> clauses = compiler.compile(EntityKind.PRODUCT, Map.of("product", "brand=" + brandId));

    assertThat(clauses).singleElement().satisfies(clause -> {
      assertThat(clause.getPath().dotted()).isEqualTo("brand");
      assertThat(clause.getAttribute().getName()).isEqualTo("id");
      assertThat(clause.getValue()).isEqualTo(brandId);
    });
  }

  @Test
  @DisplayName("clauses without '=' are skipped")
  void shouldSkipMalformedClauses() {
    Map<String, String> filters = new LinkedHashMap<>();
    filters.put("stock", "qty__gte=5,garbage,,reserved=0");

    List<FilterClause> clauses = compiler.compile(EntityKind.STOCK, filters);

    assertThat(clauses).extracting(clause -> clause.getAttribute().getName()).containsExactly("qty", "reserved");
    assertThat(clauses.get(0).getValue()).isEqualTo(5);
  }

  @Test
  @DisplayName("unknown fields are rejected")
  void shouldRejectUnknownField() {
    assertThatThrownBy(() -> compiler.compile(EntityKind.BRAND, Map.of("brand", "colour=red")))
        .isInstanceOf(InvalidPathException.class)
        .hasMessageContaining("colour");
  }

  @Test
  @DisplayName("unknown entity names are rejected before any query runs")
  void shouldRejectUnknownEntity() {
    assertThatThrownBy(() -> compiler.compile(EntityKind.BRAND, Map.of("supplier", "name=x")))
        .isInstanceOf(InvalidPathException.class);
  }

  @Test
  @DisplayName("computed attributes cannot be filtered")
  void shouldRejectComputedAttribute() {
    assertThatThrownBy(() -> compiler.compile(EntityKind.STOCK, Map.of("stock", "available_qty__gt=0")))
        .isInstanceOf(InvalidPathException.class)
        .hasMessageContaining("cannot be filtered");
  }

  @Test
  @DisplayName("values that cannot be converted are rejected")
  void shouldRejectBadValue() {
    assertThatThrownBy(() -> compiler.compile(EntityKind.ORDER, Map.of("order", "status=SHIPPED")))
        .isInstanceOf(InvalidFilterValueException.class);
  }
}
