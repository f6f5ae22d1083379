package com.ioms.inventoryservice.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RelatedQueryRequest Unit Tests")
class RelatedQueryRequestTest {

  @Test
  @DisplayName("should group bracketed parameters by entity")
  void shouldGroupParameters() {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("join", "brand, stocks.warehouse,");
    params.put("filter[brand]", "name=Acme");
    params.put("filter[Warehouse]", "city__iexact=izmir");
    params.put("fields[Product]", "name, sku");
    params.put("fields[brand]", "name");
    params.put("ordering", "-price");
    params.put("unrelated", "ignored");

    RelatedQueryRequest request = RelatedQueryRequest.fromParameters(params);

    assertThat(request.getJoins()).containsExactly("brand", "stocks.warehouse");
    assertThat(request.getFilters()).containsOnlyKeys("brand", "Warehouse");
    assertThat(request.getFields()).containsEntry("product", List.of("name", "sku"))
        .containsEntry("brand", List.of("name"));
    assertThat(request.getOrdering()).isEqualTo("-price");
    assertThat(request.isDistinct()).isFalse();
    assertThat(request.getLimit()).isNull();
  }

  @Test
  @DisplayName("distinct is enabled only by the value true")
  void shouldParseDistinct() {
    assertThat(RelatedQueryRequest.fromParameters(Map.of("distinct", "TRUE")).isDistinct()).isTrue();
    assertThat(RelatedQueryRequest.fromParameters(Map.of("distinct", "1")).isDistinct()).isFalse();
  }

  @Test
  @DisplayName("limit is ignored unless it is a non-negative integer")
  void shouldParseLimit() {
    assertThat(RelatedQueryRequest.fromParameters(Map.of("limit", "25")).getLimit()).isEqualTo(25);
    assertThat(RelatedQueryRequest.fromParameters(Map.of("limit", "0")).getLimit()).isZero();
    assertThat(RelatedQueryRequest.fromParameters(Map.of("limit", "-1")).getLimit()).isNull();
    assertThat(RelatedQueryRequest.fromParameters(Map.of("limit", "ten")).getLimit()).isNull();
    assertThat(RelatedQueryRequest.fromParameters(Map.of("limit", "99999999999")).getLimit()).isNull();
  }

  @Test
  @DisplayName("repeated parameters are combined instead of dropped")
  void shouldCombineRepeatedParameters() {
    MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
    params.add("filter[brand]", "name__istartswith=ac");
    params.add("filter[brand]", "is_active=true");
    params.add("join", "brand");
    params.add("join", "stocks.warehouse");
    params.add("fields[product]", "name");
    params.add("fields[Product]", "sku");
    params.add("ordering", "-price");
    params.add("ordering", "name");
    params.add("limit", "5");
    params.add("limit", "50");

    RelatedQueryRequest request = RelatedQueryRequest.fromParameters(params);

    assertThat(request.getFilters()).containsExactly(Map.entry("brand", "name__istartswith=ac,is_active=true"));
    assertThat(request.getJoins()).containsExactly("brand", "stocks.warehouse");
    assertThat(request.getFields()).containsExactly(Map.entry("product", List.of("name", "sku")));
    assertThat(request.getOrdering()).isEqualTo("-price,name");
    assertThat(request.getLimit()).isEqualTo(5);
  }
}
