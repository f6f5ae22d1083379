package com.ioms.inventoryservice.repository;

import com.ioms.inventoryservice.model.OrderItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OrderItemRepository extends JpaRepository<OrderItem, UUID> {

    // restrict-delete check for products
    boolean existsByProductId(UUID productId);

    @Query("SELECT i FROM OrderItem i JOIN FETCH i.product WHERE i.id = :id")
    Optional<OrderItem> findWithProductById(@Param("id") UUID id);

    @Query("SELECT i FROM OrderItem i JOIN FETCH i.product")
    List<OrderItem> findAllWithProduct();

    // product id order gives every confirmation the same stock locking order
    @Query("SELECT i FROM OrderItem i JOIN FETCH i.product p WHERE i.order.id = :orderId ORDER BY p.id")
    List<OrderItem> findByOrderIdOrderByProductId(@Param("orderId") UUID orderId);
}
