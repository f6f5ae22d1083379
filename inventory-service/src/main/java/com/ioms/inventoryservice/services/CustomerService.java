package com.ioms.inventoryservice.services;

import com.ioms.inventoryservice.dto.CustomerRequest;
import com.ioms.inventoryservice.dto.CustomerResponse;
import com.ioms.inventoryservice.dto.OrderResponse;

import java.util.List;
import java.util.UUID;

public interface CustomerService {
    CustomerResponse createCustomer(CustomerRequest request);

    List<CustomerResponse> getAllCustomers();

    CustomerResponse getCustomerById(UUID customerId);

    // Rejected while the customer has orders
    void deleteCustomer(UUID customerId);

    List<OrderResponse> getCustomerOrders(UUID customerId);
}
