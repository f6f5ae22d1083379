package com.ioms.inventoryservice.query;

import com.ioms.inventoryservice.query.schema.EntityKind;
import com.ioms.inventoryservice.query.schema.EntitySchema;
import com.ioms.inventoryservice.query.schema.RelationPath;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Splits the requested {@code join} paths into eager joins and batched loads.
 * Duplicates are dropped, as is any path that is a prefix of another requested path, since
 * loading the longer path materialises all of its prefixes.
 */
@Component
@RequiredArgsConstructor
public class JoinPlanner {

    private final EntitySchema schema;

    public JoinPlan plan(EntityKind root, List<String> rawPaths) {
        Set<RelationPath> requested = new LinkedHashSet<>();
        for (String raw : rawPaths) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            requested.add(schema.parsePath(root, raw.trim()));
        }

        List<RelationPath> eager = new ArrayList<>();
        List<RelationPath> batched = new ArrayList<>();
        for (RelationPath path : requested) {
            if (isShadowed(path, requested)) {
                continue;
            }
            if (path.isEagerJoinable()) {
                eager.add(path);
            } else {
                batched.add(path);
            }
        }
        return new JoinPlan(root, eager, batched);
    }

    private static boolean isShadowed(RelationPath path, Set<RelationPath> requested) {
        return requested.stream()
                .anyMatch(other -> other.length() > path.length() && other.startsWith(path));
    }
}
