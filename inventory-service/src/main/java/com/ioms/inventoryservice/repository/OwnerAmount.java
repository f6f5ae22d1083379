package com.ioms.inventoryservice.repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Grouped money sum per owning entity.
 */
public interface OwnerAmount {

    UUID getOwnerId();

    BigDecimal getAmount();

    static Map<UUID, BigDecimal> toMap(List<OwnerAmount> rows) {
        return rows.stream().collect(Collectors.toMap(OwnerAmount::getOwnerId, OwnerAmount::getAmount));
    }
}
