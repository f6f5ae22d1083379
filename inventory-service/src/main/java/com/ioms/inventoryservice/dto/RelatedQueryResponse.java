package com.ioms.inventoryservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RelatedQueryResponse {

    private int count;

    private List<Map<String, Object>> results;

    // advisory description of the executed plan, omitted when the diagnostic is switched off
    private String query;
}
