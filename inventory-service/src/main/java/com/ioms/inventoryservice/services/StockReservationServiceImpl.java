package com.ioms.inventoryservice.services;

import com.ioms.common.exception.InsufficientStockException;
import com.ioms.common.exception.InvalidStateTransitionException;
import com.ioms.common.exception.ResourceNotFoundException;
import com.ioms.inventoryservice.model.Order;
import com.ioms.inventoryservice.model.OrderItem;
import com.ioms.inventoryservice.model.OrderStatus;
import com.ioms.inventoryservice.model.Stock;
import com.ioms.inventoryservice.repository.OrderItemRepository;
import com.ioms.inventoryservice.repository.OrderRepository;
import com.ioms.inventoryservice.repository.StockRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class StockReservationServiceImpl implements StockReservationService {

    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final StockRepository stockRepository;

    @Override
    @Transactional
    public Order confirmOrder(UUID orderId) {
        // CRITICAL: every reservation below happens in this one transaction.
        // Any exception rolls back all of them and the order stays PENDING.
        Order order = orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found"));

        if (order.getStatus() != OrderStatus.PENDING) {
            log.warn("Confirmation rejected: order {} is {}", orderId, order.getStatus());
            throw new InvalidStateTransitionException(String.format(
                    "Order %s cannot be confirmed: status is %s, expected PENDING", orderId, order.getStatus()));
        }

        // Items come back sorted by product id so concurrent confirmations lock stock rows in the same order
        List<OrderItem> items = orderItemRepository.findByOrderIdOrderByProductId(orderId);
        for (OrderItem item : items) {
            reserve(item);
        }

        order.setStatus(OrderStatus.CONFIRMED);
        log.info("Order confirmed: id={}, items={}", orderId, items.size());
        return order;
    }

    /**
     * Greedy allocation over the product's stock rows, largest quantity first.
     */
    private void reserve(OrderItem item) {
        List<Stock> candidates = stockRepository.findAvailableByProductIdForUpdate(item.getProduct().getId());

        int remaining = item.getQty();
        for (Stock stock : candidates) {
            if (remaining == 0) {
                break;
            }
            int allocated = Math.min(remaining, stock.getAvailableQty());
            if (allocated <= 0) {
                continue;
            }
            stock.reserve(allocated);
            remaining -= allocated;
            log.info("Stock reserved: stockId={}, productId={}, allocated={}, reserved={}, qty={}",
                    stock.getId(), item.getProduct().getId(), allocated, stock.getReserved(), stock.getQty());
        }

        if (remaining > 0) {
            log.warn("Insufficient stock: orderItemId={}, product='{}', requested={}, missing={}",
                    item.getId(), item.getProduct().getName(), item.getQty(), remaining);
            throw new InsufficientStockException(item.getProduct().getName(), remaining);
        }
    }
}
