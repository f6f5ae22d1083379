package com.ioms.inventoryservice.services;

import com.ioms.common.exception.DuplicateResourceException;
import com.ioms.common.exception.InvalidStateTransitionException;
import com.ioms.common.exception.ResourceNotFoundException;
import com.ioms.inventoryservice.dto.PaymentRequest;
import com.ioms.inventoryservice.dto.PaymentResponse;
import com.ioms.inventoryservice.mapper.PaymentMapper;
import com.ioms.inventoryservice.model.Order;
import com.ioms.inventoryservice.model.Payment;
import com.ioms.inventoryservice.model.PaymentStatus;
import com.ioms.inventoryservice.repository.OrderRepository;
import com.ioms.inventoryservice.repository.PaymentRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class PaymentServiceImpl implements PaymentService {

    private static final Logger log = LoggerFactory.getLogger(PaymentServiceImpl.class);

    private final PaymentRepository paymentRepository;
    private final OrderRepository orderRepository;
    private final PaymentMapper paymentMapper;

    @Override
    @Transactional
    public PaymentResponse createPayment(PaymentRequest request) {
        Order order = orderRepository.findWithItemsById(request.getOrderId())
                .orElseThrow(() -> new ResourceNotFoundException("Order not found"));

        if (paymentRepository.existsByOrderId(order.getId())) {
            throw new DuplicateResourceException("Order " + order.getId() + " already has a payment");
        }

        // The payment must cover the order exactly
        if (request.getAmount().compareTo(order.getTotalAmount()) != 0) {
            throw new IllegalArgumentException(String.format(
                    "Payment amount %s does not match order total %s", request.getAmount(), order.getTotalAmount()));
        }

        Payment payment = Payment.builder()
                .order(order)
                .method(request.getMethod())
                .amount(request.getAmount())
                .build();

        Payment savedPayment = paymentRepository.save(payment);
        log.info("Payment created: id={}, orderId={}, method={}, amount={}",
                savedPayment.getId(), order.getId(), savedPayment.getMethod(), savedPayment.getAmount());
        return paymentMapper.toPaymentResponse(savedPayment);
    }

    @Override
    @Transactional(readOnly = true)
    public List<PaymentResponse> getAllPayments() {
        return paymentRepository.findAllWithOrder().stream()
                .map(paymentMapper::toPaymentResponse)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public PaymentResponse getPaymentById(UUID paymentId) {
        Payment payment = paymentRepository.findWithOrderById(paymentId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment not found"));
        return paymentMapper.toPaymentResponse(payment);
    }

    @Override
    @Transactional
    public void deletePayment(UUID paymentId) {
        Payment payment = paymentRepository.findById(paymentId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment not found"));

        paymentRepository.delete(payment);
        log.info("Payment deleted: id={}, status={}", paymentId, payment.getStatus());
    }

    @Override
    @Transactional
    public PaymentResponse confirmPayment(UUID paymentId) {
        // Row lock serializes concurrent confirmations of the same payment
        Payment payment = paymentRepository.findByIdForUpdate(paymentId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment not found"));

        if (payment.getStatus() != PaymentStatus.PENDING) {
            log.warn("Payment confirmation rejected: payment {} is {}", paymentId, payment.getStatus());
            throw new InvalidStateTransitionException(String.format(
                    "Payment %s cannot be confirmed: status is %s, expected PENDING", paymentId, payment.getStatus()));
        }

        payment.setStatus(PaymentStatus.CONFIRMED);
        log.info("Payment confirmed: id={}, orderId={}, amount={}",
                paymentId, payment.getOrder().getId(), payment.getAmount());
        return paymentMapper.toPaymentResponse(payment);
    }
}
