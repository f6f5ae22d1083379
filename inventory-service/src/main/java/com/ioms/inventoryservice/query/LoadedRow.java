package com.ioms.inventoryservice.query;

import com.ioms.inventoryservice.model.BaseEntity;
import com.ioms.inventoryservice.query.schema.RelationPath;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A root entity together with the related entities loaded for each joined path and its prefixes.
 */
public class LoadedRow {

    private final BaseEntity entity;
    private final Map<RelationPath, List<BaseEntity>> related = new HashMap<>();

    public LoadedRow(BaseEntity entity) {
        this.entity = entity;
    }

    public BaseEntity getEntity() {
        return entity;
    }

    void attach(RelationPath path, List<BaseEntity> entities) {
        related.put(path, List.copyOf(entities));
    }

    public boolean isLoaded(RelationPath path) {
        return related.containsKey(path);
    }

    /**
     * Entities reached through {@code path}, or an empty list if the path was not loaded.
     */
    public List<BaseEntity> getRelated(RelationPath path) {
        return related.getOrDefault(path, List.of());
    }
}
