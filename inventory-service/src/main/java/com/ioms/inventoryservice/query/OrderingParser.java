package com.ioms.inventoryservice.query;

import com.ioms.inventoryservice.query.schema.AttributeDescriptor;
import com.ioms.inventoryservice.query.schema.EntityDescriptor;
import com.ioms.inventoryservice.query.schema.EntityKind;
import com.ioms.inventoryservice.query.schema.EntitySchema;
import com.ioms.inventoryservice.query.schema.RelationDescriptor;
import com.ioms.inventoryservice.query.schema.RelationPath;
import com.ioms.inventoryservice.query.schema.SchemaNames;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the {@code ordering} parameter: comma-separated fields, {@code -} prefix for descending.
 * Fields may follow to-one relations ({@code brand__name}). Without an explicit ordering the entity's
 * default ordering applies. Ascending {@code id} is always appended as a tie-breaker.
 */
@Component
@RequiredArgsConstructor
public class OrderingParser {

    private final EntitySchema schema;

    public List<SortField> parse(EntityKind root, String ordering) {
        String effective = ordering == null || ordering.isBlank()
                ? schema.describe(root).getDefaultOrdering()
                : ordering;

        List<SortField> fields = new ArrayList<>();
        for (String token : effective.split(",")) {
            String trimmed = token.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            boolean descending = trimmed.startsWith("-");
            fields.add(parseField(root, descending ? trimmed.substring(1) : trimmed, descending));
        }

        boolean hasRootId = fields.stream()
                .anyMatch(field -> field.getPath().isEmpty() && field.getAttribute().getName().equals("id"));
        if (!hasRootId) {
            fields.add(parseField(root, "id", false));
        }
        return fields;
    }

    private SortField parseField(EntityKind root, String field, boolean descending) {
        List<String> tokens = SchemaNames.splitPath(field);
        if (tokens.isEmpty() || tokens.stream().anyMatch(String::isEmpty)) {
            throw new InvalidPathException("Invalid ordering field '" + field + "'");
        }

        RelationPath path = RelationPath.empty(root);
        for (String hop : tokens.subList(0, tokens.size() - 1)) {
            EntityDescriptor current = schema.describe(path.target());
            RelationDescriptor relation = current.findRelation(hop).orElseThrow(() -> new InvalidPathException(
                    String.format("Unknown relation '%s' on %s", hop, current.getKind().entityName())));
            if (!relation.isEagerJoinable()) {
                throw new InvalidPathException(String.format(
                        "Cannot order by '%s': '%s' is not a to-one relation", field, relation.getName()));
            }
            path = path.append(relation);
        }

        String attributeName = tokens.get(tokens.size() - 1);
        EntityDescriptor target = schema.describe(path.target());
        AttributeDescriptor attribute = target.findAttribute(attributeName).orElseThrow(() -> new InvalidPathException(
                String.format("Unknown ordering field '%s' on %s", attributeName, target.getKind().entityName())));
        if (!attribute.isQueryable()) {
            throw new InvalidPathException(String.format(
                    "Field '%s' on %s cannot be used for ordering", attribute.getName(), target.getKind().entityName()));
        }
        return new SortField(path, attribute, descending);
    }
}
