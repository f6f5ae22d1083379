package com.ioms.inventoryservice.query.schema;

import com.ioms.inventoryservice.model.BaseEntity;
import lombok.Getter;

import java.util.function.Function;

/**
 * One named hop between two entity kinds.
 * <p>
 * For a {@link Direction#FORWARD} hop {@code attribute} is the association on the source entity and
 * {@code accessor} reads it. For a {@link Direction#REVERSE} hop {@code attribute} is the association on
 * the target that points back at the source, and {@code accessor} reads that back-reference from a target
 * instance.
 */
@Getter
public final class RelationDescriptor {

    private final EntityKind source;
    private final String name;
    private final EntityKind target;
    private final Cardinality cardinality;
    private final Direction direction;
    private final String attribute;
    private final Function<BaseEntity, BaseEntity> accessor;

    RelationDescriptor(EntityKind source, String name, EntityKind target, Cardinality cardinality,
                       Direction direction, String attribute, Function<BaseEntity, BaseEntity> accessor) {
        this.source = source;
        this.name = name;
        this.target = target;
        this.cardinality = cardinality;
        this.direction = direction;
        this.attribute = attribute;
        this.accessor = accessor;
    }

    /**
     * Forward to-one hops can be loaded by a join in the root query without multiplying root rows.
     */
    public boolean isEagerJoinable() {
        return direction == Direction.FORWARD && cardinality == Cardinality.ONE;
    }

    @Override
    public String toString() {
        return source.entityName() + "." + name;
    }
}
