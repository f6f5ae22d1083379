package com.ioms.inventoryservice.services;

import com.ioms.common.exception.InsufficientStockException;
import com.ioms.common.exception.ResourceNotFoundException;
import com.ioms.inventoryservice.dto.OrderItemRequest;
import com.ioms.inventoryservice.dto.OrderItemResponse;
import com.ioms.inventoryservice.dto.OrderRequest;
import com.ioms.inventoryservice.dto.OrderResponse;
import com.ioms.inventoryservice.mapper.OrderMapper;
import com.ioms.inventoryservice.model.Customer;
import com.ioms.inventoryservice.model.Order;
import com.ioms.inventoryservice.model.OrderItem;
import com.ioms.inventoryservice.model.Product;
import com.ioms.inventoryservice.repository.CustomerRepository;
import com.ioms.inventoryservice.repository.OrderItemRepository;
import com.ioms.inventoryservice.repository.OrderRepository;
import com.ioms.inventoryservice.repository.PaymentRepository;
import com.ioms.inventoryservice.repository.ProductRepository;
import com.ioms.inventoryservice.repository.StockRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class OrderServiceImpl implements OrderService {

    private static final Logger log = LoggerFactory.getLogger(OrderServiceImpl.class);

    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final CustomerRepository customerRepository;
    private final ProductRepository productRepository;
    private final StockRepository stockRepository;
    private final PaymentRepository paymentRepository;
    private final StockReservationService stockReservationService;
    private final OrderMapper orderMapper;

    @Override
    @Transactional
    public OrderResponse createOrder(OrderRequest request) {
        Customer customer = customerRepository.findById(request.getCustomerId())
                .orElseThrow(() -> new ResourceNotFoundException("Customer not found"));

        Order order = Order.builder()
                .customer(customer)
                .build();

        Set<UUID> seenProducts = new HashSet<>();
        for (OrderItemRequest itemRequest : request.getItems()) {
            // A product may appear only once per order
            if (!seenProducts.add(itemRequest.getProductId())) {
                throw new IllegalArgumentException("Product " + itemRequest.getProductId() + " appears more than once in the order");
            }
            order.addItem(buildItem(itemRequest));
        }

        Order savedOrder = orderRepository.save(order);
        log.info("Order created: id={}, customerId={}, items={}, totalAmount={}",
                savedOrder.getId(), customer.getId(), savedOrder.getItems().size(), savedOrder.getTotalAmount());
        return orderMapper.toOrderResponse(savedOrder);
    }

    private OrderItem buildItem(OrderItemRequest itemRequest) {
        Product product = productRepository.findById(itemRequest.getProductId())
                .orElseThrow(() -> new ResourceNotFoundException("Product not found: " + itemRequest.getProductId()));

        // Stock check against everything still unreserved across warehouses
        Long available = stockRepository.sumAvailableByProductId(product.getId());
        long availableQty = available != null ? available : 0L;
        if (itemRequest.getQty() > availableQty) {
            log.warn("Order item rejected: product='{}', requested={}, available={}",
                    product.getName(), itemRequest.getQty(), availableQty);
            throw new InsufficientStockException(product.getName(), (int) (itemRequest.getQty() - availableQty));
        }

        return OrderItem.builder()
                .product(product)
                .qty(itemRequest.getQty())
                .unitPrice(itemRequest.getUnitPrice() != null ? itemRequest.getUnitPrice() : product.getPrice())
                .build();
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderResponse> getAllOrders() {
        return orderRepository.findAllWithItems().stream()
                .map(orderMapper::toOrderResponse)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public OrderResponse getOrderById(UUID orderId) {
        Order order = orderRepository.findWithItemsById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found"));
        return orderMapper.toOrderResponse(order);
    }

    @Override
    @Transactional
    public void deleteOrder(UUID orderId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found"));

        // Payment references the order without a cascade from the order side
        int removedPayments = paymentRepository.deleteByOrderId(orderId);
        orderRepository.delete(order);
        log.info("Order deleted: id={}, status={}, paymentsRemoved={}", orderId, order.getStatus(), removedPayments);
    }

    @Override
    @Transactional
    public OrderResponse confirmOrder(UUID orderId) {
        Order confirmed = stockReservationService.confirmOrder(orderId);
        return orderMapper.toOrderResponse(confirmed);
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderItemResponse> getAllOrderItems() {
        return orderItemRepository.findAllWithProduct().stream()
                .map(orderMapper::toOrderItemResponse)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public OrderItemResponse getOrderItemById(UUID orderItemId) {
        OrderItem item = orderItemRepository.findWithProductById(orderItemId)
                .orElseThrow(() -> new ResourceNotFoundException("Order item not found"));
        return orderMapper.toOrderItemResponse(item);
    }
}
