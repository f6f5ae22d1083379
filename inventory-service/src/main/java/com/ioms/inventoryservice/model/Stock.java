package com.ioms.inventoryservice.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import org.hibernate.annotations.Check;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * Quantity of one product held in one warehouse.
 * {@code reserved <= qty} holds at all times; the table carries the same rule as a CHECK constraint.
 */
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
@SuperBuilder
@NoArgsConstructor
@Entity
@Table(name = "stocks", uniqueConstraints = {
        @UniqueConstraint(name = "uk_stocks_product_warehouse", columnNames = {"product_id", "warehouse_id"})
})
@Check(name = "ck_stocks_reserved_lte_qty", constraints = "qty >= 0 AND reserved >= 0 AND reserved <= qty")
public class Stock extends BaseEntity {

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "product_id", nullable = false)
    private Product product;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "warehouse_id", nullable = false)
    private Warehouse warehouse;

    @ToString.Include
    @Builder.Default
    @Column(nullable = false)
    private Integer qty = 0;

    @ToString.Include
    @Builder.Default
    @Column(nullable = false)
    private Integer reserved = 0;

    // Concurrent writers that read a stale row fail at flush instead of overwriting each other
    @Version
    private Long version;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public int getAvailableQty() {
        return qty - reserved;
    }

    /**
     * Moves {@code amount} units from available to reserved.
     *
     * @throws IllegalStateException if fewer than {@code amount} units are available
     */
    public void reserve(int amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Reservation amount must be positive: " + amount);
        }
        if (amount > getAvailableQty()) {
            throw new IllegalStateException(String.format(
                    "Cannot reserve %d units on stock %s: only %d available", amount, getId(), getAvailableQty()));
        }
        reserved += amount;
    }
}
