package com.ioms.inventoryservice.query.filter;

import com.ioms.inventoryservice.model.BaseEntity;
import com.ioms.inventoryservice.query.schema.Direction;
import com.ioms.inventoryservice.query.schema.RelationDescriptor;
import jakarta.persistence.criteria.AbstractQuery;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Builds JPA Criteria predicates for compiled filter clauses.
 * <p>
 * Forward hops are plain path navigation. Reverse hops become correlated {@code EXISTS} subqueries,
 * so filtering through a to-many relation never multiplies root rows.
 */
@Component
public class FilterPredicateBuilder {

    private static final char LIKE_ESCAPE = '\\';

    public Predicate toPredicate(FilterClause clause, CriteriaBuilder cb, AbstractQuery<?> query, Path<?> root) {
        return build(clause, 0, cb, query, root);
    }

    private Predicate build(FilterClause clause, int fromHop, CriteriaBuilder cb, AbstractQuery<?> query, Path<?> start) {
        List<RelationDescriptor> hops = clause.getPath().getHops();
        Path<?> current = start;
        for (int i = fromHop; i < hops.size(); i++) {
            RelationDescriptor hop = hops.get(i);
            if (hop.getDirection() == Direction.FORWARD) {
                current = current.get(hop.getAttribute());
                continue;
            }
            Subquery<UUID> subquery = query.subquery(UUID.class);
            Root<? extends BaseEntity> child = subquery.from(hop.getTarget().getEntityClass());
            subquery.select(child.<UUID>get("id"));
            subquery.where(
                    cb.equal(child.get(hop.getAttribute()), current),
                    build(clause, i + 1, cb, subquery, child));
            return cb.exists(subquery);
        }

        Path<?> attribute = current;
        for (String segment : clause.getAttribute().getJpaPath()) {
            attribute = attribute.get(segment);
        }
        return leaf(clause.getLookup(), clause.getValue(), cb, attribute);
    }

    private Predicate leaf(Lookup lookup, Object value, CriteriaBuilder cb, Path<?> attribute) {
        if (lookup == Lookup.ISNULL) {
            return Boolean.TRUE.equals(value) ? cb.isNull(attribute) : cb.isNotNull(attribute);
        }
        if (lookup == Lookup.EXACT) {
            return cb.equal(attribute, value);
        }
        if (lookup.isRange()) {
            return range(lookup, value, cb, attribute);
        }
        return text(lookup, (String) value, cb, asText(attribute));
    }

    // Text lookups are only compiled for String attributes
    @SuppressWarnings("unchecked")
    private static Expression<String> asText(Path<?> attribute) {
        return (Expression<String>) attribute;
    }

    private Predicate text(Lookup lookup, String value, CriteriaBuilder cb, Expression<String> attribute) {
        Expression<String> subject = lookup.isCaseInsensitive() ? cb.lower(attribute) : attribute;
        String operand = lookup.isCaseInsensitive() ? value.toLowerCase(Locale.ROOT) : value;
        return switch (lookup) {
            case IEXACT -> cb.equal(subject, operand);
            case CONTAINS, ICONTAINS -> cb.like(subject, "%" + escapeLike(operand) + "%", LIKE_ESCAPE);
            case STARTSWITH, ISTARTSWITH -> cb.like(subject, escapeLike(operand) + "%", LIKE_ESCAPE);
            case ENDSWITH, IENDSWITH -> cb.like(subject, "%" + escapeLike(operand), LIKE_ESCAPE);
            default -> throw new IllegalArgumentException("Not a text lookup: " + lookup);
        };
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private Predicate range(Lookup lookup, Object value, CriteriaBuilder cb, Path<?> attribute) {
        Expression<Comparable> subject = (Expression<Comparable>) attribute;
        Comparable bound = (Comparable) value;
        return switch (lookup) {
            case GT -> cb.greaterThan(subject, bound);
            case GTE -> cb.greaterThanOrEqualTo(subject, bound);
            case LT -> cb.lessThan(subject, bound);
            case LTE -> cb.lessThanOrEqualTo(subject, bound);
            default -> throw new IllegalArgumentException("Not a range lookup: " + lookup);
        };
    }

    static String escapeLike(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                escaped.append(LIKE_ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
