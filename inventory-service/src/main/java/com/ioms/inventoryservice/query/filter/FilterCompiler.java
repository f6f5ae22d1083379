package com.ioms.inventoryservice.query.filter;

import com.ioms.inventoryservice.query.InvalidPathException;
import com.ioms.inventoryservice.query.RelationPathResolver;
import com.ioms.inventoryservice.query.schema.AttributeDescriptor;
import com.ioms.inventoryservice.query.schema.EntityDescriptor;
import com.ioms.inventoryservice.query.schema.EntityKind;
import com.ioms.inventoryservice.query.schema.EntitySchema;
import com.ioms.inventoryservice.query.schema.RelationDescriptor;
import com.ioms.inventoryservice.query.schema.RelationPath;
import com.ioms.inventoryservice.query.schema.SchemaNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns {@code filter[<entity>]} parameters into {@link FilterClause}s anchored at the root entity.
 * <p>
 * Each parameter value is a comma-separated list of {@code field[__lookup]=value} clauses. Clauses without
 * {@code =} are ignored. The field part may walk further relations from the named entity
 * ({@code filter[product]=brand__name=Acme}).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FilterCompiler {

    private final EntitySchema schema;
    private final RelationPathResolver resolver;

    /**
     * @param filters entity name to raw clause list, as taken from {@code filter[<entity>]} parameters
     */
    public List<FilterClause> compile(EntityKind root, Map<String, String> filters) {
        List<FilterClause> clauses = new ArrayList<>();
        for (Map.Entry<String, String> entry : filters.entrySet()) {
            RelationPath entityPath = resolver.resolve(root, entry.getKey());
            for (String clause : entry.getValue().split(",")) {
                int separator = clause.indexOf('=');
                if (separator < 0) {
                    if (!clause.isBlank()) {
                        log.debug("Ignoring malformed filter clause '{}' for {}", clause, entry.getKey());
                    }
                    continue;
                }
                clauses.add(compileClause(entityPath, clause.substring(0, separator).trim(),
                        clause.substring(separator + 1).trim()));
            }
        }
        return clauses;
    }

    private FilterClause compileClause(RelationPath entityPath, String field, String rawValue) {
        List<String> tokens = SchemaNames.splitPath(field);
        if (tokens.isEmpty() || tokens.stream().anyMatch(String::isEmpty)) {
            throw new InvalidPathException("Invalid filter field '" + field + "'");
        }

        Lookup lookup = Lookup.EXACT;
        if (tokens.size() > 1) {
            Optional<Lookup> explicit = Lookup.fromToken(tokens.get(tokens.size() - 1));
            if (explicit.isPresent()) {
                lookup = explicit.get();
                tokens = tokens.subList(0, tokens.size() - 1);
            }
        }

        RelationPath path = entityPath;
        for (String hop : tokens.subList(0, tokens.size() - 1)) {
            EntityDescriptor current = schema.describe(path.target());
            RelationDescriptor relation = current.findRelation(hop).orElseThrow(() -> new InvalidPathException(
                    String.format("Unknown relation '%s' on %s", hop, current.getKind().entityName())));
            path = path.append(relation);
        }

        String attributeName = tokens.get(tokens.size() - 1);
        EntityDescriptor target = schema.describe(path.target());
        Optional<AttributeDescriptor> direct = target.findAttribute(attributeName);
        Optional<RelationDescriptor> byRelation = target.findRelation(attributeName);
        if (direct.isEmpty() && byRelation.isEmpty()) {
            throw new InvalidPathException(
                    String.format("Unknown field '%s' on %s", attributeName, target.getKind().entityName()));
        }
        AttributeDescriptor attribute;
        if (direct.isPresent()) {
            attribute = direct.get();
        } else {
            // A bare relation name compares the related entity's id, e.g. brand=<uuid>
            path = path.append(byRelation.get());
            attribute = schema.describe(path.target()).findAttribute("id").orElseThrow();
        }
        if (!attribute.isQueryable()) {
            throw new InvalidPathException(String.format(
                    "Field '%s' on %s cannot be filtered", attribute.getName(), target.getKind().entityName()));
        }

        Object value = FilterValues.convert(attribute, lookup, FilterValues.coerce(rawValue), rawValue);
        return new FilterClause(path, attribute, lookup, value);
    }
}
