package com.ioms.inventoryservice.query.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An ordered chain of relation hops starting at {@link #getRoot()}.
 * The empty path stands for the root entity itself.
 */
public final class RelationPath {

    private final EntityKind root;
    private final List<RelationDescriptor> hops;

    private RelationPath(EntityKind root, List<RelationDescriptor> hops) {
        this.root = root;
        this.hops = List.copyOf(hops);
    }

    public static RelationPath empty(EntityKind root) {
        return new RelationPath(root, List.of());
    }

    public RelationPath append(RelationDescriptor hop) {
        if (hop.getSource() != target()) {
            throw new IllegalArgumentException("Relation " + hop + " does not start at " + target().entityName());
        }
        List<RelationDescriptor> extended = new ArrayList<>(hops);
        extended.add(hop);
        return new RelationPath(root, extended);
    }

    public EntityKind getRoot() {
        return root;
    }

    public List<RelationDescriptor> getHops() {
        return hops;
    }

    public RelationDescriptor hop(int index) {
        return hops.get(index);
    }

    public RelationDescriptor last() {
        return hops.get(hops.size() - 1);
    }

    public int length() {
        return hops.size();
    }

    public boolean isEmpty() {
        return hops.isEmpty();
    }

    /**
     * Kind reached after the last hop.
     */
    public EntityKind target() {
        return hops.isEmpty() ? root : last().getTarget();
    }

    public boolean isEagerJoinable() {
        return hops.stream().allMatch(RelationDescriptor::isEagerJoinable);
    }

    /**
     * True when every hop is to-one, so the path reaches at most one instance per root.
     */
    public boolean isSingleValued() {
        return hops.stream().allMatch(hop -> hop.getCardinality() == Cardinality.ONE);
    }

    public RelationPath prefix(int length) {
        return new RelationPath(root, hops.subList(0, length));
    }

    /**
     * The longest prefix made only of eager-joinable hops.
     */
    public RelationPath eagerPrefix() {
        int length = 0;
        while (length < hops.size() && hops.get(length).isEagerJoinable()) {
            length++;
        }
        return prefix(length);
    }

    public boolean startsWith(RelationPath other) {
        return root == other.root
                && other.hops.size() <= hops.size()
                && hops.subList(0, other.hops.size()).equals(other.hops);
    }

    /**
     * Relation names joined with dots, e.g. {@code orderItems.order.customer}.
     */
    public String dotted() {
        return hops.stream().map(RelationDescriptor::getName).collect(Collectors.joining("."));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RelationPath other)) {
            return false;
        }
        return root == other.root && hops.equals(other.hops);
    }

    @Override
    public int hashCode() {
        return Objects.hash(root, hops);
    }

    @Override
    public String toString() {
        return hops.isEmpty() ? root.entityName() : root.entityName() + "." + dotted();
    }
}
