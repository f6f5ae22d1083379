package com.ioms.inventoryservice.query;

import com.ioms.inventoryservice.query.filter.FilterClause;
import com.ioms.inventoryservice.query.schema.EntityKind;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Everything the executor needs: root kind, join plan, filters, ordering and row limits.
 */
@Getter
@Builder
public class CompiledQuery {

    private final EntityKind root;
    private final JoinPlan joinPlan;
    private final List<FilterClause> filters;
    private final List<SortField> ordering;
    private final boolean distinct;
    private final Integer limit;

    /**
     * Human-readable summary of the plan, returned as the {@code query} diagnostic.
     */
    public String describe() {
        StringBuilder description = new StringBuilder("FROM ").append(root.entityName());
        if (!joinPlan.isEmpty()) {
            description.append(" JOIN ").append(joinPlan.describe());
        }
        if (!filters.isEmpty()) {
            description.append(" WHERE ").append(filters.stream()
                    .map(FilterClause::describe)
                    .collect(Collectors.joining(" AND ")));
        }
        description.append(" ORDER BY ").append(ordering.stream()
                .map(SortField::toString)
                .collect(Collectors.joining(", ")));
        if (distinct) {
            description.append(" DISTINCT");
        }
        if (limit != null) {
            description.append(" LIMIT ").append(limit);
        }
        return description.toString();
    }
}
