package com.ioms.inventoryservice.services;

import com.ioms.inventoryservice.dto.RelatedQueryResponse;
import com.ioms.inventoryservice.query.schema.EntityKind;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.util.Map;

public interface RelatedQueryService {

    /**
     * Runs a related-entity query rooted at {@code root}.
     *
     * @param params raw request parameters: {@code join}, {@code filter[<entity>]}, {@code fields[<entity>]},
     *               {@code ordering}, {@code distinct}, {@code limit}; anything else is ignored.
     *               Repeated list parameters are combined as if their values were comma-separated.
     * @throws com.ioms.inventoryservice.query.RelatedQueryException if the query cannot be planned or executed
     */
    RelatedQueryResponse query(EntityKind root, MultiValueMap<String, String> params);

    default RelatedQueryResponse query(EntityKind root, Map<String, String> params) {
        MultiValueMap<String, String> multi = new LinkedMultiValueMap<>();
        multi.setAll(params);
        return query(root, multi);
    }
}
