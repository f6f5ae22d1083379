package com.ioms.inventoryservice.service;

import com.ioms.inventoryservice.repository.OwnerAmount;
import com.ioms.inventoryservice.repository.OwnerTotal;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Grouped aggregate rows as the repositories return them.
 */
final class Aggregates {

  private Aggregates() {
  }

  static OwnerTotal total(UUID ownerId, long total) {
    return new OwnerTotal() {
      @Override
      public UUID getOwnerId() {
        return ownerId;
      }

      @Override
      public Long getTotal() {
        return total;
      }
    };
  }

  static OwnerAmount amount(UUID ownerId, String amount) {
    return new OwnerAmount() {
      @Override
      public UUID getOwnerId() {
        return ownerId;
      }

      @Override
      public BigDecimal getAmount() {
        return new BigDecimal(amount);
      }
    };
  }
}
