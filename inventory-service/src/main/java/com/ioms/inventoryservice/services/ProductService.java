package com.ioms.inventoryservice.services;

import com.ioms.inventoryservice.dto.ProductRequest;
import com.ioms.inventoryservice.dto.ProductResponse;
import com.ioms.inventoryservice.dto.StockResponse;

import java.util.List;
import java.util.UUID;

public interface ProductService {
    ProductResponse createProduct(ProductRequest request);

    List<ProductResponse> getAllProducts();

    ProductResponse getProductById(UUID productId);

    // Removes the product's stock rows; rejected if any order references the product
    void deleteProduct(UUID productId);

    // Stock rows of the product in every warehouse
    List<StockResponse> getProductStock(UUID productId);

    // Active products whose total quantity across warehouses is below the threshold
    List<ProductResponse> getLowStockProducts(Integer threshold);
}
