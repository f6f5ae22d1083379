package com.ioms.inventoryservice.mapper;

import com.ioms.inventoryservice.dto.CustomerRequest;
import com.ioms.inventoryservice.dto.CustomerResponse;
import com.ioms.inventoryservice.model.Customer;
import org.mapstruct.Builder;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.math.BigDecimal;

@Mapper(
        componentModel = "spring",
        unmappedTargetPolicy = ReportingPolicy.IGNORE,
        builder = @Builder(disableBuilder = true)
)
public interface CustomerMapper {

    @Mapping(target = "ordersCount", source = "ordersCount")
    @Mapping(target = "totalSpent", source = "totalSpent")
    CustomerResponse toCustomerResponse(Customer customer, Long ordersCount, BigDecimal totalSpent);

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    Customer toCustomer(CustomerRequest request);
}
