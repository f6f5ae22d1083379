package com.ioms.inventoryservice.query.filter;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Comparison operators accepted as the last {@code __} segment of a filter field.
 */
public enum Lookup {
    EXACT,
    IEXACT,
    CONTAINS,
    ICONTAINS,
    STARTSWITH,
    ISTARTSWITH,
    ENDSWITH,
    IENDSWITH,
    GT,
    GTE,
    LT,
    LTE,
    ISNULL;

    public static Optional<Lookup> fromToken(String token) {
        String normalized = token.toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(lookup -> lookup.name().equals(normalized))
                .findFirst();
    }

    /** Lookups that only make sense on text attributes. */
    public boolean isTextual() {
        return this != EXACT && this != GT && this != GTE && this != LT && this != LTE && this != ISNULL;
    }

    public boolean isCaseInsensitive() {
        return this == IEXACT || this == ICONTAINS || this == ISTARTSWITH || this == IENDSWITH;
    }

    public boolean isRange() {
        return this == GT || this == GTE || this == LT || this == LTE;
    }

    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }
}
