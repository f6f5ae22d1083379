package com.ioms.inventoryservice.repository;

import com.ioms.inventoryservice.model.Order;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OrderRepository extends JpaRepository<Order, UUID> {

    // restrict-delete check for customers
    boolean existsByCustomerId(UUID customerId);

    long countByCustomerId(UUID customerId);

    @Query("SELECT o.customer.id AS ownerId, COUNT(o) AS total FROM Order o GROUP BY o.customer.id")
    List<OwnerTotal> countPerCustomer();

    @Query("SELECT DISTINCT o FROM Order o JOIN FETCH o.customer "
            + "LEFT JOIN FETCH o.items i LEFT JOIN FETCH i.product WHERE o.id = :id")
    Optional<Order> findWithItemsById(@Param("id") UUID id);

    @Query("SELECT DISTINCT o FROM Order o JOIN FETCH o.customer "
            + "LEFT JOIN FETCH o.items i LEFT JOIN FETCH i.product ORDER BY o.createdAt DESC")
    List<Order> findAllWithItems();

    @Query("SELECT DISTINCT o FROM Order o JOIN FETCH o.customer "
            + "LEFT JOIN FETCH o.items i LEFT JOIN FETCH i.product "
            + "WHERE o.customer.id = :customerId ORDER BY o.createdAt DESC")
    List<Order> findByCustomerIdWithItems(@Param("customerId") UUID customerId);

    /**
     * Finds an order by ID with pessimistic write lock (SELECT ... FOR UPDATE).
     * Two confirmations of the same order are serialized on this row.
     *
     * CRITICAL: This method MUST be called within a transaction.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM Order o WHERE o.id = :id")
    Optional<Order> findByIdForUpdate(@Param("id") UUID id);
}
