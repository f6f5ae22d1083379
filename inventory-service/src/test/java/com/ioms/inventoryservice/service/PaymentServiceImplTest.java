package com.ioms.inventoryservice.service;

import com.ioms.common.exception.DuplicateResourceException;
import com.ioms.common.exception.InvalidStateTransitionException;
import com.ioms.common.exception.ResourceNotFoundException;
import com.ioms.inventoryservice.dto.PaymentRequest;
import com.ioms.inventoryservice.dto.PaymentResponse;
import com.ioms.inventoryservice.mapper.PaymentMapper;
import com.ioms.inventoryservice.model.Order;
import com.ioms.inventoryservice.model.OrderItem;
import com.ioms.inventoryservice.model.Payment;
import com.ioms.inventoryservice.model.PaymentMethod;
import com.ioms.inventoryservice.model.PaymentStatus;
import com.ioms.inventoryservice.model.Product;
import com.ioms.inventoryservice.repository.OrderRepository;
import com.ioms.inventoryservice.repository.PaymentRepository;
import com.ioms.inventoryservice.services.PaymentServiceImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("PaymentService Unit Tests")
class PaymentServiceImplTest {

  @Mock
  private PaymentRepository paymentRepository;
  @Mock
  private OrderRepository orderRepository;
  @Mock
  private PaymentMapper paymentMapper;

  @InjectMocks
  private PaymentServiceImpl paymentService;

  private UUID orderId;
  private Order order;

  @BeforeEach
  void setUp() {
    orderId = UUID.randomUUID();
    order = Order.builder().build();
    order.setId(orderId);

    Product product = Product.builder().name("Phone X").price(new BigDecimal("120.00")).build();
    order.addItem(OrderItem.builder().product(product).qty(2).unitPrice(new BigDecimal("120.00")).build());
  }

  @Nested
  @DisplayName("Create Payment Tests")
  class CreatePaymentTests {

    @Test
    @DisplayName("should create a pending payment for the order total")
    void createPayment_Success() {
      // Arrange
      PaymentRequest request = PaymentRequest.builder()
          .orderId(orderId)
          .method(PaymentMethod.CARD)
          .amount(new BigDecimal("240.0"))
          .build();
      PaymentResponse response = PaymentResponse.builder().orderId(orderId).build();
      when(orderRepository.findWithItemsById(orderId)).thenReturn(Optional.of(order));
      when(paymentRepository.existsByOrderId(orderId)).thenReturn(false);
      when(paymentRepository.save(any(Payment.class))).thenAnswer(invocation -> invocation.getArgument(0));
      when(paymentMapper.toPaymentResponse(any(Payment.class))).thenReturn(response);

      // Act
      PaymentResponse result = paymentService.createPayment(request);

      // Assert
      assertThat(result).isSameAs(response);
      ArgumentCaptor<Payment> captor = ArgumentCaptor.forClass(Payment.class);
      verify(paymentRepository).save(captor.capture());
      assertThat(captor.getValue().getStatus()).isEqualTo(PaymentStatus.PENDING);
      assertThat(captor.getValue().getOrder()).isSameAs(order);
    }

    @Test
    @DisplayName("should reject an amount that differs from the order total")
    void createPayment_AmountMismatch() {
      // Arrange
      PaymentRequest request = PaymentRequest.builder()
          .orderId(orderId)
          .method(PaymentMethod.COD)
          .amount(new BigDecimal("200.00"))
          .build();
      when(orderRepository.findWithItemsById(orderId)).thenReturn(Optional.of(order));
      when(paymentRepository.existsByOrderId(orderId)).thenReturn(false);

      // Act & Assert
      assertThatThrownBy(() -> paymentService.createPayment(request))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("does not match order total");

      verify(paymentRepository, never()).save(any());
    }

    @Test
    @DisplayName("should reject a second payment for the same order")
    void createPayment_Duplicate() {
      // Arrange
      PaymentRequest request = PaymentRequest.builder()
          .orderId(orderId)
          .method(PaymentMethod.CARD)
          .amount(new BigDecimal("240.00"))
          .build();
      when(orderRepository.findWithItemsById(orderId)).thenReturn(Optional.of(order));
      when(paymentRepository.existsByOrderId(orderId)).thenReturn(true);

      // Act & Assert
      assertThatThrownBy(() -> paymentService.createPayment(request))
          .isInstanceOf(DuplicateResourceException.class);
    }
  }

  @Nested
  @DisplayName("Confirm Payment Tests")
  class ConfirmPaymentTests {

    @Test
    @DisplayName("should move a pending payment to confirmed")
    void confirmPayment_Success() {
      // Arrange
      UUID paymentId = UUID.randomUUID();
      Payment payment = Payment.builder().order(order).method(PaymentMethod.CARD)
          .amount(new BigDecimal("240.00")).build();
      payment.setId(paymentId);
      when(paymentRepository.findByIdForUpdate(paymentId)).thenReturn(Optional.of(payment));
      when(paymentMapper.toPaymentResponse(payment)).thenReturn(PaymentResponse.builder().build());

      // Act
      paymentService.confirmPayment(paymentId);

      // Assert
      assertThat(payment.getStatus()).isEqualTo(PaymentStatus.CONFIRMED);
    }

    @Test
    @DisplayName("should reject payments that are not pending")
    void confirmPayment_NotPending() {
      // Arrange
      UUID paymentId = UUID.randomUUID();
      Payment payment = Payment.builder().order(order).method(PaymentMethod.CARD)
          .amount(new BigDecimal("240.00")).status(PaymentStatus.FAILED).build();
      when(paymentRepository.findByIdForUpdate(paymentId)).thenReturn(Optional.of(payment));

      // Act & Assert
      assertThatThrownBy(() -> paymentService.confirmPayment(paymentId))
          .isInstanceOf(InvalidStateTransitionException.class)
          .hasMessageContaining("FAILED");

      verifyNoInteractions(paymentMapper);
    }

    @Test
    @DisplayName("should throw when the payment does not exist")
    void confirmPayment_NotFound() {
      // Arrange
      UUID paymentId = UUID.randomUUID();
      when(paymentRepository.findByIdForUpdate(paymentId)).thenReturn(Optional.empty());

      // Act & Assert
      assertThatThrownBy(() -> paymentService.confirmPayment(paymentId))
          .isInstanceOf(ResourceNotFoundException.class)
          .hasMessage("Payment not found");
    }
  }
}
