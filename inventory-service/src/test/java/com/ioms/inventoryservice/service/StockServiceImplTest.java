package com.ioms.inventoryservice.service;

import com.ioms.common.exception.DuplicateResourceException;
import com.ioms.common.exception.ResourceNotFoundException;
import com.ioms.inventoryservice.dto.StockRequest;
import com.ioms.inventoryservice.dto.StockResponse;
import com.ioms.inventoryservice.mapper.StockMapper;
import com.ioms.inventoryservice.model.Product;
import com.ioms.inventoryservice.model.Stock;
import com.ioms.inventoryservice.model.Warehouse;
import com.ioms.inventoryservice.repository.ProductRepository;
import com.ioms.inventoryservice.repository.StockRepository;
import com.ioms.inventoryservice.repository.WarehouseRepository;
import com.ioms.inventoryservice.services.StockServiceImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("StockService Unit Tests")
class StockServiceImplTest {

  @Mock
  private StockRepository stockRepository;
  @Mock
  private ProductRepository productRepository;
  @Mock
  private WarehouseRepository warehouseRepository;
  @Mock
  private StockMapper stockMapper;

  @InjectMocks
  private StockServiceImpl stockService;

  private Product product;
  private Warehouse warehouse;

  @BeforeEach
  void setUp() {
    product = Product.builder().name("Phone X").sku("PX-1").build();
    product.setId(UUID.randomUUID());

    warehouse = Warehouse.builder().name("Main").city("Almaty").build();
    warehouse.setId(UUID.randomUUID());
  }

  private StockRequest request(int qty, int reserved) {
    return StockRequest.builder()
        .productId(product.getId())
        .warehouseId(warehouse.getId())
        .qty(qty)
        .reserved(reserved)
        .build();
  }

  @Test
  @DisplayName("should attach product and warehouse to the new stock row")
  void createStock_Success() {
    // Arrange
    StockRequest request = request(10, 4);
    Stock stock = Stock.builder().qty(10).reserved(4).build();
    StockResponse response = StockResponse.builder().qty(10).reserved(4).availableQty(6).build();
    when(productRepository.findById(product.getId())).thenReturn(Optional.of(product));
    when(warehouseRepository.findById(warehouse.getId())).thenReturn(Optional.of(warehouse));
    when(stockRepository.existsByProductIdAndWarehouseId(product.getId(), warehouse.getId())).thenReturn(false);
    when(stockMapper.toStock(request)).thenReturn(stock);
    when(stockRepository.save(stock)).thenReturn(stock);
    when(stockMapper.toStockResponse(stock)).thenReturn(response);

    // Act
    StockResponse result = stockService.createStock(request);

    // Assert
    assertThat(result.getAvailableQty()).isEqualTo(6);
    assertThat(stock.getProduct()).isSameAs(product);
    assertThat(stock.getWarehouse()).isSameAs(warehouse);
  }

  @Test
  @DisplayName("should reject a reserved quantity above the quantity")
  void createStock_ReservedAboveQty() {
    // Arrange
    StockRequest request = request(3, 5);
    when(productRepository.findById(product.getId())).thenReturn(Optional.of(product));
    when(warehouseRepository.findById(warehouse.getId())).thenReturn(Optional.of(warehouse));
    when(stockRepository.existsByProductIdAndWarehouseId(product.getId(), warehouse.getId())).thenReturn(false);
    when(stockMapper.toStock(request)).thenReturn(Stock.builder().qty(3).reserved(5).build());

    // Act & Assert
    assertThatThrownBy(() -> stockService.createStock(request))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Reserved quantity (5) cannot exceed quantity (3)");

    verify(stockRepository, never()).save(any());
  }

  @Test
  @DisplayName("should reject a second stock row for the same product and warehouse")
  void createStock_Duplicate() {
    // Arrange
    StockRequest request = request(10, 0);
    when(productRepository.findById(product.getId())).thenReturn(Optional.of(product));
    when(warehouseRepository.findById(warehouse.getId())).thenReturn(Optional.of(warehouse));
    when(stockRepository.existsByProductIdAndWarehouseId(product.getId(), warehouse.getId())).thenReturn(true);

    // Act & Assert
    assertThatThrownBy(() -> stockService.createStock(request))
        .isInstanceOf(DuplicateResourceException.class)
        .hasMessageContaining("Phone X")
        .hasMessageContaining("Main");

    verify(stockRepository, never()).save(any());
    verifyNoInteractions(stockMapper);
  }

  @Test
  @DisplayName("should throw when the product does not exist")
  void createStock_ProductNotFound() {
    // Arrange
    StockRequest request = request(10, 0);
    when(productRepository.findById(product.getId())).thenReturn(Optional.empty());

    // Act & Assert
    assertThatThrownBy(() -> stockService.createStock(request))
        .isInstanceOf(ResourceNotFoundException.class)
        .hasMessage("Product not found");

    verifyNoInteractions(warehouseRepository, stockRepository);
  }
}
