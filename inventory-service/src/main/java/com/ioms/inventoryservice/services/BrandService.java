package com.ioms.inventoryservice.services;

import com.ioms.inventoryservice.dto.BrandRequest;
import com.ioms.inventoryservice.dto.BrandResponse;
import com.ioms.inventoryservice.dto.ProductResponse;

import java.util.List;
import java.util.UUID;

public interface BrandService {
    BrandResponse createBrand(BrandRequest request);

    // Ordered by name
    List<BrandResponse> getAllBrands();

    BrandResponse getBrandById(UUID brandId);

    // Rejected while the brand still has products
    void deleteBrand(UUID brandId);

    // Active products of the brand
    List<ProductResponse> getBrandProducts(UUID brandId);
}
