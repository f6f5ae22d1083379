package com.ioms.inventoryservice.repository;

import com.ioms.inventoryservice.model.Payment;
import com.ioms.inventoryservice.model.PaymentStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentRepository extends JpaRepository<Payment, UUID> {

    boolean existsByOrderId(UUID orderId);

    // NULL when the customer has no payment in that status
    @Query("SELECT SUM(p.amount) FROM Payment p WHERE p.order.customer.id = :customerId AND p.status = :status")
    BigDecimal sumAmountByCustomerIdAndStatus(@Param("customerId") UUID customerId,
                                              @Param("status") PaymentStatus status);

    @Query("SELECT p.order.customer.id AS ownerId, SUM(p.amount) AS amount FROM Payment p "
            + "WHERE p.status = :status GROUP BY p.order.customer.id")
    List<OwnerAmount> sumAmountPerCustomer(@Param("status") PaymentStatus status);

    @Query("SELECT p FROM Payment p JOIN FETCH p.order o JOIN FETCH o.customer WHERE p.id = :id")
    Optional<Payment> findWithOrderById(@Param("id") UUID id);

    @Query("SELECT p FROM Payment p JOIN FETCH p.order o JOIN FETCH o.customer ORDER BY p.createdAt DESC")
    List<Payment> findAllWithOrder();

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Payment p WHERE p.id = :id")
    Optional<Payment> findByIdForUpdate(@Param("id") UUID id);

    @Modifying
    @Query("DELETE FROM Payment p WHERE p.order.id = :orderId")
    int deleteByOrderId(@Param("orderId") UUID orderId);
}
