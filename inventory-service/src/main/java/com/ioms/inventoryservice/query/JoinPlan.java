package com.ioms.inventoryservice.query;

import com.ioms.inventoryservice.query.schema.EntityKind;
import com.ioms.inventoryservice.query.schema.RelationPath;
import lombok.Getter;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Relation paths to load alongside the root rows.
 * <p>
 * {@code eagerJoins} are fetch-joined into the root query. {@code batchedLoads} contain at least one
 * to-many or reverse hop and are loaded afterwards with one query per such hop.
 */
@Getter
public class JoinPlan {

    private final EntityKind root;
    private final List<RelationPath> eagerJoins;
    private final List<RelationPath> batchedLoads;

    public JoinPlan(EntityKind root, List<RelationPath> eagerJoins, List<RelationPath> batchedLoads) {
        this.root = root;
        this.eagerJoins = List.copyOf(eagerJoins);
        this.batchedLoads = List.copyOf(batchedLoads);
    }

    /**
     * Paths the root query must fetch-join: every eager join plus the eager prefix of every batched load.
     */
    public Set<RelationPath> fetchPaths() {
        Set<RelationPath> paths = new LinkedHashSet<>(eagerJoins);
        for (RelationPath batched : batchedLoads) {
            RelationPath prefix = batched.eagerPrefix();
            if (!prefix.isEmpty()) {
                paths.add(prefix);
            }
        }
        return paths;
    }

    /**
     * True if {@code path} is non-empty and is covered by one of the planned joins.
     */
    public boolean covers(RelationPath path) {
        if (path.isEmpty()) {
            return false;
        }
        return eagerJoins.stream().anyMatch(joined -> joined.startsWith(path))
                || batchedLoads.stream().anyMatch(joined -> joined.startsWith(path));
    }

    public boolean isEmpty() {
        return eagerJoins.isEmpty() && batchedLoads.isEmpty();
    }

    public String describe() {
        return String.format("eager=[%s] batched=[%s]", join(eagerJoins), join(batchedLoads));
    }

    private static String join(List<RelationPath> paths) {
        return paths.stream().map(RelationPath::dotted).collect(Collectors.joining(", "));
    }
}
