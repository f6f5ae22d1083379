package com.ioms.inventoryservice.query;

import com.ioms.inventoryservice.model.BaseEntity;
import com.ioms.inventoryservice.query.filter.FilterClause;
import com.ioms.inventoryservice.query.filter.FilterPredicateBuilder;
import com.ioms.inventoryservice.query.schema.RelationDescriptor;
import com.ioms.inventoryservice.query.schema.RelationPath;
import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Fetch;
import jakarta.persistence.criteria.FetchParent;
import jakarta.persistence.criteria.JoinType;
import jakarta.persistence.criteria.Order;
import jakarta.persistence.criteria.ParameterExpression;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Runs a {@link CompiledQuery} with a bounded number of statements.
 * <p>
 * The root query applies filters, ordering and limit and fetch-joins every to-one chain in the plan.
 * Each reverse hop of a batched path then costs exactly one more query of the form
 * {@code select child where child.<owner>.id = any(:ownerIds)}, whatever the number of root rows.
 * The owner ids are bound as a single array parameter, so large root sets stay within the driver's
 * bind-parameter limit.
 * Forward hops that follow a reverse hop are fetch-joined into that same query.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RelatedQueryExecutor {

    private final EntityManager entityManager;
    private final FilterPredicateBuilder predicateBuilder;

    public List<LoadedRow> execute(CompiledQuery query) {
        List<LoadedRow> rows = fetchRoots(query.getRoot().getEntityClass(), query);
        if (rows.isEmpty()) {
            return rows;
        }
        for (RelationPath path : query.getJoinPlan().fetchPaths()) {
            attachEager(rows, path);
        }
        for (RelationPath path : query.getJoinPlan().getBatchedLoads()) {
            loadBatched(rows, path);
        }
        return rows;
    }

    private <T extends BaseEntity> List<LoadedRow> fetchRoots(Class<T> type, CompiledQuery query) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<T> criteria = cb.createQuery(type);
        Root<T> root = criteria.from(type);

        Map<RelationPath, Fetch<?, ?>> fetches = new HashMap<>();
        for (RelationPath path : query.getJoinPlan().fetchPaths()) {
            fetch(root, path, fetches);
        }

        List<Predicate> predicates = new ArrayList<>();
        for (FilterClause clause : query.getFilters()) {
            predicates.add(predicateBuilder.toPredicate(clause, cb, criteria, root));
        }

        List<Order> orders = new ArrayList<>();
        for (SortField field : query.getOrdering()) {
            Path<?> path = root;
            for (RelationDescriptor hop : field.getPath().getHops()) {
                path = path.get(hop.getAttribute());
            }
            for (String segment : field.getAttribute().getJpaPath()) {
                path = path.get(segment);
            }
            orders.add(field.isDescending() ? cb.desc(path) : cb.asc(path));
        }

        criteria.select(root)
                .where(predicates.toArray(new Predicate[0]))
                .orderBy(orders);

        TypedQuery<T> typed = entityManager.createQuery(criteria);
        // Filters use EXISTS and fetches are to-one only, so each root appears once and the limit can run in SQL.
        if (query.getLimit() != null) {
            typed.setMaxResults(query.getLimit());
        }
        List<T> entities = typed.getResultList();

        Collection<T> unique = entities;
        if (query.isDistinct()) {
            Map<UUID, T> byId = new LinkedHashMap<>();
            entities.forEach(entity -> byId.putIfAbsent(entity.getId(), entity));
            unique = byId.values();
        }

        List<LoadedRow> rows = new ArrayList<>(unique.size());
        unique.forEach(entity -> rows.add(new LoadedRow(entity)));
        log.debug("Loaded {} {} rows", rows.size(), query.getRoot().entityName());
        return rows;
    }

    private void fetch(FetchParent<?, ?> root, RelationPath path, Map<RelationPath, Fetch<?, ?>> fetches) {
        FetchParent<?, ?> parent = root;
        for (int i = 1; i <= path.length(); i++) {
            RelationPath prefix = path.prefix(i);
            Fetch<?, ?> existing = fetches.get(prefix);
            if (existing == null) {
                existing = parent.fetch(prefix.last().getAttribute(), JoinType.LEFT);
                fetches.put(prefix, existing);
            }
            parent = existing;
        }
    }

    private void attachEager(List<LoadedRow> rows, RelationPath path) {
        for (LoadedRow row : rows) {
            BaseEntity current = row.getEntity();
            for (int i = 0; i < path.length(); i++) {
                current = path.hop(i).getAccessor().apply(current);
                row.attach(path.prefix(i + 1), current == null ? List.of() : List.of(current));
                if (current == null) {
                    break;
                }
            }
        }
    }

    /**
     * Walks the path hop by hop, keeping for each root row the entities reached so far.
     */
    private void loadBatched(List<LoadedRow> rows, RelationPath path) {
        Map<LoadedRow, List<BaseEntity>> frontier = new IdentityHashMap<>();
        rows.forEach(row -> frontier.put(row, List.of(row.getEntity())));

        int hopIndex = 0;
        while (hopIndex < path.length()) {
            RelationDescriptor hop = path.hop(hopIndex);
            if (hop.isEagerJoinable()) {
                frontier.replaceAll((row, owners) -> follow(hop, owners));
            } else {
                int end = hopIndex + 1;
                while (end < path.length() && path.hop(end).isEagerJoinable()) {
                    end++;
                }
                List<RelationDescriptor> trailing = path.getHops().subList(hopIndex + 1, end);
                Map<UUID, List<BaseEntity>> children = fetchChildren(hop, trailing, ownerIds(frontier));
                frontier.replaceAll((row, owners) -> {
                    List<BaseEntity> reached = new ArrayList<>();
                    owners.forEach(owner -> reached.addAll(children.getOrDefault(owner.getId(), List.of())));
                    return distinctById(reached);
                });
            }
            hopIndex++;
            RelationPath prefix = path.prefix(hopIndex);
            frontier.forEach((row, reached) -> row.attach(prefix, reached));
        }
    }

    private Map<UUID, List<BaseEntity>> fetchChildren(RelationDescriptor hop, List<RelationDescriptor> trailing,
                                                      Set<UUID> ownerIds) {
        if (ownerIds.isEmpty()) {
            return Map.of();
        }
        List<? extends BaseEntity> children = queryChildren(hop.getTarget().getEntityClass(), hop, trailing, ownerIds);

        Map<UUID, List<BaseEntity>> byOwner = new HashMap<>();
        for (BaseEntity child : children) {
            BaseEntity owner = hop.getAccessor().apply(child);
            byOwner.computeIfAbsent(owner.getId(), id -> new ArrayList<>()).add(child);
        }
        log.debug("Batched load of {}: {} rows for {} owners", hop, children.size(), ownerIds.size());
        return byOwner;
    }

    private <C extends BaseEntity> List<C> queryChildren(Class<C> type, RelationDescriptor hop,
                                                         List<RelationDescriptor> trailing, Set<UUID> ownerIds) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<C> criteria = cb.createQuery(type);
        Root<C> child = criteria.from(type);

        FetchParent<?, ?> parent = child;
        for (RelationDescriptor next : trailing) {
            parent = parent.fetch(next.getAttribute(), JoinType.LEFT);
        }

        ParameterExpression<UUID[]> ids = cb.parameter(UUID[].class, "ownerIds");
        Expression<Boolean> ownedBy = cb.function(QueryFunctionContributor.ID_IN_ARRAY, Boolean.class,
                child.get(hop.getAttribute()).get("id"), ids);

        criteria.select(child)
                .where(cb.isTrue(ownedBy))
                .orderBy(cb.asc(child.get("createdAt")), cb.asc(child.get("id")));
        return entityManager.createQuery(criteria)
                .setParameter(ids, ownerIds.toArray(new UUID[0]))
                .getResultList();
    }

    private static List<BaseEntity> follow(RelationDescriptor hop, List<BaseEntity> owners) {
        List<BaseEntity> reached = new ArrayList<>();
        for (BaseEntity owner : owners) {
            BaseEntity next = hop.getAccessor().apply(owner);
            if (next != null) {
                reached.add(next);
            }
        }
        return distinctById(reached);
    }

    private static Set<UUID> ownerIds(Map<LoadedRow, List<BaseEntity>> frontier) {
        Set<UUID> ids = new LinkedHashSet<>();
        frontier.values().forEach(owners -> owners.forEach(owner -> ids.add(owner.getId())));
        return ids;
    }

    private static List<BaseEntity> distinctById(List<BaseEntity> entities) {
        Map<UUID, BaseEntity> byId = new LinkedHashMap<>();
        entities.forEach(entity -> byId.putIfAbsent(entity.getId(), entity));
        return new ArrayList<>(byId.values());
    }
}
