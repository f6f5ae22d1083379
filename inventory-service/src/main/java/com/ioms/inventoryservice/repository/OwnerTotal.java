package com.ioms.inventoryservice.repository;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * One row of a grouped count or sum: the id of the owning entity and its aggregate.
 * Owners without rows in the group are absent and read as zero.
 */
public interface OwnerTotal {

    UUID getOwnerId();

    Long getTotal();

    static Map<UUID, Long> toMap(List<OwnerTotal> rows) {
        return rows.stream().collect(Collectors.toMap(OwnerTotal::getOwnerId, OwnerTotal::getTotal));
    }
}
