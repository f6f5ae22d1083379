package com.ioms.inventoryservice.query;

import com.ioms.inventoryservice.model.BaseEntity;
import com.ioms.inventoryservice.query.schema.AttributeDescriptor;
import com.ioms.inventoryservice.query.schema.EntityDescriptor;
import com.ioms.inventoryservice.query.schema.EntityKind;
import com.ioms.inventoryservice.query.schema.EntitySchema;
import com.ioms.inventoryservice.query.schema.RelationPath;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns loaded rows into plain maps for the JSON response.
 * <p>
 * The root entity is rendered with its whitelisted fields, or with every schema attribute when it has no
 * whitelist. Each other entity named in {@code fields[...]} is nested under that name if its relation path
 * was loaded: a single object (or null) for to-one paths, a list for to-many paths. Unknown field names and
 * entities that were not joined are left out.
 */
@Component
@RequiredArgsConstructor
public class RelatedProjector {

    private final EntitySchema schema;
    private final RelationPathResolver resolver;

    public List<Map<String, Object>> project(EntityKind root, List<LoadedRow> rows, Map<String, List<String>> fields) {
        Optional<List<String>> rootFields = fields.entrySet().stream()
                .filter(entry -> EntityKind.fromName(entry.getKey()).filter(kind -> kind == root).isPresent())
                .map(Map.Entry::getValue)
                .findFirst();

        Map<String, RelationPath> nested = new LinkedHashMap<>();
        for (String entity : fields.keySet()) {
            if (EntityKind.fromName(entity).filter(kind -> kind == root).isPresent()) {
                continue;
            }
            resolver.find(root, entity)
                    .filter(path -> !path.isEmpty())
                    .ifPresent(path -> nested.put(entity, path));
        }

        List<Map<String, Object>> results = new ArrayList<>(rows.size());
        for (LoadedRow row : rows) {
            Map<String, Object> output = rootFields
                    .map(whitelist -> render(row.getEntity(), root, whitelist))
                    .orElseGet(() -> renderAll(row.getEntity(), root));

            nested.forEach((entity, path) -> {
                if (!row.isLoaded(path)) {
                    return;
                }
                List<String> whitelist = fields.get(entity);
                List<Map<String, Object>> related = new ArrayList<>();
                for (BaseEntity target : row.getRelated(path)) {
                    related.add(render(target, path.target(), whitelist));
                }
                if (path.isSingleValued()) {
                    output.put(entity, related.isEmpty() ? null : related.get(0));
                } else {
                    output.put(entity, related);
                }
            });
            results.add(output);
        }
        return results;
    }

    private Map<String, Object> render(BaseEntity entity, EntityKind kind, List<String> whitelist) {
        EntityDescriptor descriptor = schema.describe(kind);
        Map<String, Object> output = new LinkedHashMap<>();
        for (String field : whitelist) {
            descriptor.findAttribute(field)
                    .ifPresent(attribute -> output.put(field, attribute.read(entity)));
        }
        return output;
    }

    /**
     * Default representation: every schema attribute, keyed by its camelCase name.
     */
    Map<String, Object> renderAll(BaseEntity entity, EntityKind kind) {
        Map<String, Object> output = new LinkedHashMap<>();
        for (AttributeDescriptor attribute : schema.describe(kind).getAttributes()) {
            output.put(attribute.getName(), attribute.read(entity));
        }
        return output;
    }
}
