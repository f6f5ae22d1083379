package com.ioms.inventoryservice.mapper;

import com.ioms.inventoryservice.dto.PaymentResponse;
import com.ioms.inventoryservice.model.Payment;
import org.mapstruct.Builder;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

@Mapper(
        componentModel = "spring",
        unmappedTargetPolicy = ReportingPolicy.IGNORE,
        builder = @Builder(disableBuilder = true)
)
public interface PaymentMapper {

    @Mapping(source = "order.id", target = "orderId")
    @Mapping(source = "order.customer.fullName", target = "orderCustomerName")
    PaymentResponse toPaymentResponse(Payment payment);
}
