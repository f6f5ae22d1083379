package com.ioms.inventoryservice.mapper;

import com.ioms.inventoryservice.dto.OrderItemResponse;
import com.ioms.inventoryservice.dto.OrderResponse;
import com.ioms.inventoryservice.model.Order;
import com.ioms.inventoryservice.model.OrderItem;
import org.mapstruct.Builder;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

@Mapper(
        componentModel = "spring",
        unmappedTargetPolicy = ReportingPolicy.IGNORE,
        builder = @Builder(disableBuilder = true)
)
public interface OrderMapper {

    // Order -> OrderResponse; customer, items and their products must be fetched
    @Mapping(source = "customer.id", target = "customerId")
    @Mapping(source = "customer.fullName", target = "customerName")
    @Mapping(source = "customer.email", target = "customerEmail")
    @Mapping(source = "items", target = "items")
    @Mapping(source = "totalAmount", target = "totalAmount")
    @Mapping(source = "totalItems", target = "totalItems")
    OrderResponse toOrderResponse(Order order);

    @Mapping(source = "order.id", target = "orderId")
    @Mapping(source = "product.id", target = "productId")
    @Mapping(source = "product.name", target = "productName")
    @Mapping(source = "product.sku", target = "productSku")
    @Mapping(source = "totalPrice", target = "totalPrice")
    OrderItemResponse toOrderItemResponse(OrderItem orderItem);

    // Note: no request -> entity mapping here.
    // Items need the resolved Product entity; the service layer builds them.
}
