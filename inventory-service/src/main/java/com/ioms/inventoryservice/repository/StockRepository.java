package com.ioms.inventoryservice.repository;

import com.ioms.inventoryservice.model.Stock;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface StockRepository extends JpaRepository<Stock, UUID> {

    boolean existsByProductIdAndWarehouseId(UUID productId, UUID warehouseId);

    @Query("SELECT s FROM Stock s JOIN FETCH s.product JOIN FETCH s.warehouse WHERE s.id = :id")
    Optional<Stock> findWithProductAndWarehouseById(@Param("id") UUID id);

    @Query("SELECT s FROM Stock s JOIN FETCH s.product JOIN FETCH s.warehouse")
    List<Stock> findAllWithProductAndWarehouse();

    @Query("SELECT s FROM Stock s JOIN FETCH s.product JOIN FETCH s.warehouse WHERE s.product.id = :productId")
    List<Stock> findByProductIdWithWarehouse(@Param("productId") UUID productId);

    @Query("SELECT s FROM Stock s JOIN FETCH s.product JOIN FETCH s.warehouse WHERE s.warehouse.id = :warehouseId")
    List<Stock> findByWarehouseIdWithProduct(@Param("warehouseId") UUID warehouseId);

    @Query("SELECT s FROM Stock s JOIN FETCH s.product JOIN FETCH s.warehouse WHERE s.qty > s.reserved")
    List<Stock> findAvailable();

    // NULL when the product has no stock rows
    @Query("SELECT SUM(s.qty - s.reserved) FROM Stock s WHERE s.product.id = :productId")
    Long sumAvailableByProductId(@Param("productId") UUID productId);

    // NULL when the product has no stock rows
    @Query("SELECT SUM(s.qty) FROM Stock s WHERE s.product.id = :productId")
    Long sumQtyByProductId(@Param("productId") UUID productId);

    @Query("SELECT s.product.id AS ownerId, SUM(s.qty) AS total FROM Stock s GROUP BY s.product.id")
    List<OwnerTotal> sumQtyPerProduct();

    @Query("SELECT s.product.id AS ownerId, SUM(s.qty) AS total FROM Stock s "
            + "WHERE s.product.id IN :productIds GROUP BY s.product.id")
    List<OwnerTotal> sumQtyPerProduct(@Param("productIds") Collection<UUID> productIds);

    // total_products of a warehouse: stock rows that still hold units
    long countByWarehouseIdAndQtyGreaterThan(UUID warehouseId, int qty);

    @Query("SELECT s.warehouse.id AS ownerId, COUNT(s) AS total FROM Stock s "
            + "WHERE s.qty > 0 GROUP BY s.warehouse.id")
    List<OwnerTotal> countStockedPerWarehouse();

    /**
     * Candidate rows for a reservation, largest quantity first, locked with
     * SELECT ... FOR UPDATE until the surrounding transaction ends.
     *
     * CRITICAL: This method MUST be called within a transaction.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Stock s WHERE s.product.id = :productId AND s.qty > s.reserved ORDER BY s.qty DESC, s.id")
    List<Stock> findAvailableByProductIdForUpdate(@Param("productId") UUID productId);

    @Modifying
    @Query("DELETE FROM Stock s WHERE s.product.id = :productId")
    int deleteByProductId(@Param("productId") UUID productId);

    @Modifying
    @Query("DELETE FROM Stock s WHERE s.warehouse.id = :warehouseId")
    int deleteByWarehouseId(@Param("warehouseId") UUID warehouseId);
}
