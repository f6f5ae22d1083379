package com.ioms.inventoryservice.dto;

import com.ioms.inventoryservice.model.PaymentMethod;
import com.ioms.inventoryservice.model.PaymentStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentResponse {
    private UUID id;
    private UUID orderId;
    private String orderCustomerName;
    private PaymentMethod method;
    private BigDecimal amount;
    private PaymentStatus status;
    private Instant createdAt;
}
