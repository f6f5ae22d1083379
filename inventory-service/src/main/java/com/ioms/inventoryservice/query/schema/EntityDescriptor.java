package com.ioms.inventoryservice.query.schema;

import com.ioms.inventoryservice.model.BaseEntity;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Attributes, relations and default ordering of one {@link EntityKind}.
 */
public final class EntityDescriptor {

    @Getter
    private final EntityKind kind;
    @Getter
    private final String defaultOrdering;
    private final Map<String, AttributeDescriptor> attributes;
    private final Map<String, RelationDescriptor> relations;

    private EntityDescriptor(Builder builder) {
        this.kind = builder.kind;
        this.defaultOrdering = builder.defaultOrdering;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
        this.relations = Collections.unmodifiableMap(new LinkedHashMap<>(builder.relations));
    }

    static Builder builder(EntityKind kind) {
        return new Builder(kind);
    }

    /**
     * Attributes in declaration order; this is the order of the default representation.
     */
    public Collection<AttributeDescriptor> getAttributes() {
        return attributes.values();
    }

    public Collection<RelationDescriptor> getRelations() {
        return relations.values();
    }

    public Optional<AttributeDescriptor> findAttribute(String token) {
        return Optional.ofNullable(attributes.get(SchemaNames.key(token)));
    }

    public Optional<RelationDescriptor> findRelation(String token) {
        return Optional.ofNullable(relations.get(SchemaNames.key(token)));
    }

    static final class Builder {

        private final EntityKind kind;
        private final Map<String, AttributeDescriptor> attributes = new LinkedHashMap<>();
        private final Map<String, RelationDescriptor> relations = new LinkedHashMap<>();
        private String defaultOrdering = "id";

        private Builder(EntityKind kind) {
            this.kind = kind;
            attribute("id", UUID.class, BaseEntity::getId);
        }

        <T extends BaseEntity> Builder attribute(String name, Class<?> type, Function<T, ?> getter) {
            return add(name, type, List.of(name), getter);
        }

        /**
         * Exposes the id of a to-one association as {@code <relation>Id}.
         */
        <T extends BaseEntity> Builder foreignKey(String relation, Function<T, ? extends BaseEntity> getter) {
            Function<T, Object> idReader = entity -> {
                BaseEntity related = getter.apply(entity);
                return related == null ? null : related.getId();
            };
            return add(relation + "Id", UUID.class, List.of(relation, "id"), idReader);
        }

        <T extends BaseEntity> Builder computed(String name, Class<?> type, Function<T, ?> getter) {
            return add(name, type, List.of(), getter);
        }

        <T extends BaseEntity> Builder forward(String name, EntityKind target, Function<T, ? extends BaseEntity> getter) {
            return relation(name, target, Cardinality.ONE, Direction.FORWARD, name, getter);
        }

        /**
         * A relation whose foreign key lives on {@code target} in the association named {@code inverse}.
         */
        <C extends BaseEntity> Builder reverse(String name, EntityKind target, Cardinality cardinality,
                                               String inverse, Function<C, ? extends BaseEntity> backReference) {
            return relation(name, target, cardinality, Direction.REVERSE, inverse, backReference);
        }

        Builder defaultOrdering(String ordering) {
            this.defaultOrdering = ordering;
            return this;
        }

        EntityDescriptor build() {
            return new EntityDescriptor(this);
        }

        @SuppressWarnings("unchecked")
        private <T extends BaseEntity> Builder add(String name, Class<?> type, List<String> jpaPath, Function<T, ?> getter) {
            Function<BaseEntity, Object> reader = entity -> getter.apply((T) entity);
            attributes.put(SchemaNames.key(name), new AttributeDescriptor(name, type, new ArrayList<>(jpaPath), reader));
            return this;
        }

        @SuppressWarnings("unchecked")
        private <T extends BaseEntity> Builder relation(String name, EntityKind target, Cardinality cardinality,
                                                        Direction direction, String attribute,
                                                        Function<T, ? extends BaseEntity> getter) {
            Function<BaseEntity, BaseEntity> accessor = entity -> getter.apply((T) entity);
            relations.put(SchemaNames.key(name),
                    new RelationDescriptor(kind, name, target, cardinality, direction, attribute, accessor));
            return this;
        }
    }
}
