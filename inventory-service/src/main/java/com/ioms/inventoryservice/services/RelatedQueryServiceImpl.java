package com.ioms.inventoryservice.services;

import com.ioms.inventoryservice.config.InventoryProperties;
import com.ioms.inventoryservice.dto.RelatedQueryResponse;
import com.ioms.inventoryservice.query.CompiledQuery;
import com.ioms.inventoryservice.query.JoinPlanner;
import com.ioms.inventoryservice.query.LoadedRow;
import com.ioms.inventoryservice.query.OrderingParser;
import com.ioms.inventoryservice.query.RelatedProjector;
import com.ioms.inventoryservice.query.RelatedQueryException;
import com.ioms.inventoryservice.query.RelatedQueryExecutor;
import com.ioms.inventoryservice.query.RelatedQueryRequest;
import com.ioms.inventoryservice.query.filter.FilterCompiler;
import com.ioms.inventoryservice.query.schema.EntityKind;
import jakarta.persistence.PersistenceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.MultiValueMap;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class RelatedQueryServiceImpl implements RelatedQueryService {

    private final JoinPlanner joinPlanner;
    private final FilterCompiler filterCompiler;
    private final OrderingParser orderingParser;
    private final RelatedQueryExecutor executor;
    private final RelatedProjector projector;
    private final InventoryProperties properties;

    @Override
    @Transactional(readOnly = true)
    public RelatedQueryResponse query(EntityKind root, MultiValueMap<String, String> params) {
        RelatedQueryRequest request = RelatedQueryRequest.fromParameters(params);

        // Planning validates every path and value before anything touches the database
        CompiledQuery query = CompiledQuery.builder()
                .root(root)
                .joinPlan(joinPlanner.plan(root, request.getJoins()))
                .filters(filterCompiler.compile(root, request.getFilters()))
                .ordering(orderingParser.parse(root, request.getOrdering()))
                .distinct(request.isDistinct())
                .limit(request.getLimit())
                .build();
        String description = query.describe();
        log.debug("Related query: {}", description);

        List<LoadedRow> rows;
        try {
            rows = executor.execute(query);
        } catch (PersistenceException e) {
            log.warn("Related query failed: {} ({})", description, e.getMessage());
            throw new RelatedQueryException("Query execution failed: " + e.getMessage(), e);
        }

        List<Map<String, Object>> results = projector.project(root, rows, request.getFields());
        return RelatedQueryResponse.builder()
                .count(results.size())
                .results(results)
                .query(properties.getRelatedQuery().isIncludeQueryDiagnostic() ? description : null)
                .build();
    }
}
