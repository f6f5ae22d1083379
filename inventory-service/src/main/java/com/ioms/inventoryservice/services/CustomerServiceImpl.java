package com.ioms.inventoryservice.services;

import com.ioms.common.exception.DuplicateResourceException;
import com.ioms.common.exception.ReferentialIntegrityException;
import com.ioms.common.exception.ResourceNotFoundException;
import com.ioms.inventoryservice.dto.CustomerRequest;
import com.ioms.inventoryservice.dto.CustomerResponse;
import com.ioms.inventoryservice.dto.OrderResponse;
import com.ioms.inventoryservice.mapper.CustomerMapper;
import com.ioms.inventoryservice.mapper.OrderMapper;
import com.ioms.inventoryservice.model.Customer;
import com.ioms.inventoryservice.model.PaymentStatus;
import com.ioms.inventoryservice.repository.CustomerRepository;
import com.ioms.inventoryservice.repository.OrderRepository;
import com.ioms.inventoryservice.repository.OwnerAmount;
import com.ioms.inventoryservice.repository.OwnerTotal;
import com.ioms.inventoryservice.repository.PaymentRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class CustomerServiceImpl implements CustomerService {

    private static final Logger log = LoggerFactory.getLogger(CustomerServiceImpl.class);

    private final CustomerRepository customerRepository;
    private final OrderRepository orderRepository;
    private final PaymentRepository paymentRepository;
    private final CustomerMapper customerMapper;
    private final OrderMapper orderMapper;

    @Override
    @Transactional
    public CustomerResponse createCustomer(CustomerRequest request) {
        if (customerRepository.existsByEmailIgnoreCase(request.getEmail())) {
            throw new DuplicateResourceException("Customer with email already exists: " + request.getEmail());
        }

        Customer savedCustomer = customerRepository.save(customerMapper.toCustomer(request));
        log.info("Customer created: id={}, email={}", savedCustomer.getId(), savedCustomer.getEmail());
        return customerMapper.toCustomerResponse(savedCustomer, 0L, BigDecimal.ZERO);
    }

    @Override
    @Transactional(readOnly = true)
    public List<CustomerResponse> getAllCustomers() {
        Map<UUID, Long> orderCounts = OwnerTotal.toMap(orderRepository.countPerCustomer());
        Map<UUID, BigDecimal> spent =
                OwnerAmount.toMap(paymentRepository.sumAmountPerCustomer(PaymentStatus.CONFIRMED));
        return customerRepository.findAllByOrderByFullNameAsc().stream()
                .map(customer -> customerMapper.toCustomerResponse(customer,
                        orderCounts.getOrDefault(customer.getId(), 0L),
                        spent.getOrDefault(customer.getId(), BigDecimal.ZERO)))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public CustomerResponse getCustomerById(UUID customerId) {
        Customer customer = customerRepository.findById(customerId)
                .orElseThrow(() -> new ResourceNotFoundException("Customer not found"));
        BigDecimal totalSpent = paymentRepository.sumAmountByCustomerIdAndStatus(customerId, PaymentStatus.CONFIRMED);
        return customerMapper.toCustomerResponse(customer,
                orderRepository.countByCustomerId(customerId),
                totalSpent != null ? totalSpent : BigDecimal.ZERO);
    }

    @Override
    @Transactional
    public void deleteCustomer(UUID customerId) {
        Customer customer = customerRepository.findById(customerId)
                .orElseThrow(() -> new ResourceNotFoundException("Customer not found"));

        if (orderRepository.existsByCustomerId(customerId)) {
            log.warn("Delete rejected: customer {} has orders", customerId);
            throw new ReferentialIntegrityException(
                    "Cannot delete customer '" + customer.getEmail() + "': it has orders");
        }

        customerRepository.delete(customer);
        log.info("Customer deleted: id={}, email={}", customerId, customer.getEmail());
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderResponse> getCustomerOrders(UUID customerId) {
        // Verify customer exists
        if (!customerRepository.existsById(customerId)) {
            throw new ResourceNotFoundException("Customer not found");
        }

        return orderRepository.findByCustomerIdWithItems(customerId).stream()
                .map(orderMapper::toOrderResponse)
                .toList();
    }
}
