package com.ioms.inventoryservice.services;

import com.ioms.inventoryservice.dto.PaymentRequest;
import com.ioms.inventoryservice.dto.PaymentResponse;

import java.util.List;
import java.util.UUID;

public interface PaymentService {
    // One payment per order; the amount must match the order total
    PaymentResponse createPayment(PaymentRequest request);

    List<PaymentResponse> getAllPayments();

    PaymentResponse getPaymentById(UUID paymentId);

    void deletePayment(UUID paymentId);

    // PENDING -> CONFIRMED
    PaymentResponse confirmPayment(UUID paymentId);
}
