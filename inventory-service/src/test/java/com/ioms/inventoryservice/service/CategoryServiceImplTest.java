package com.ioms.inventoryservice.service;

import com.ioms.common.exception.DuplicateResourceException;
import com.ioms.common.exception.ReferentialIntegrityException;
import com.ioms.common.exception.ResourceNotFoundException;
import com.ioms.inventoryservice.dto.CategoryRequest;
import com.ioms.inventoryservice.dto.CategoryResponse;
import com.ioms.inventoryservice.dto.ProductResponse;
import com.ioms.inventoryservice.mapper.CategoryMapper;
import com.ioms.inventoryservice.model.Category;
import com.ioms.inventoryservice.model.Product;
import com.ioms.inventoryservice.repository.CategoryRepository;
import com.ioms.inventoryservice.repository.ProductRepository;
import com.ioms.inventoryservice.services.CategoryServiceImpl;
import com.ioms.inventoryservice.services.ProductResponseAssembler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.ioms.inventoryservice.service.Aggregates.total;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CategoryService Unit Tests")
class CategoryServiceImplTest {

  @Mock
  private CategoryRepository categoryRepository;
  @Mock
  private ProductRepository productRepository;
  @Mock
  private CategoryMapper categoryMapper;
  @Mock
  private ProductResponseAssembler productResponseAssembler;

  @InjectMocks
  private CategoryServiceImpl categoryService;

  private UUID categoryId;
  private Category category;
  private CategoryRequest categoryRequest;

  @BeforeEach
  void setUp() {
    categoryId = UUID.randomUUID();

    category = Category.builder().name("Phones").build();
    category.setId(categoryId);

    categoryRequest = CategoryRequest.builder()
        .name("Phones")
        .build();
  }

  @Nested
  @DisplayName("Create Category Tests")
  class CreateCategoryTests {

    @Test
    @DisplayName("should create a category with no products counted")
    void createCategory_Success() {
      // Arrange
      CategoryResponse response = CategoryResponse.builder().id(categoryId).name("Phones").productsCount(0L).build();
      when(categoryRepository.existsByNameIgnoreCase("Phones")).thenReturn(false);
      when(categoryMapper.toCategory(categoryRequest)).thenReturn(category);
      when(categoryRepository.save(category)).thenReturn(category);
      when(categoryMapper.toCategoryResponse(category, 0L)).thenReturn(response);

      // Act
      CategoryResponse result = categoryService.createCategory(categoryRequest);

      // Assert
      assertThat(result.getProductsCount()).isZero();
      verifyNoInteractions(productRepository);
    }

    @Test
    @DisplayName("should reject a name that differs only by case")
    void createCategory_Duplicate() {
      // Arrange
      when(categoryRepository.existsByNameIgnoreCase("Phones")).thenReturn(true);

      // Act & Assert
      assertThatThrownBy(() -> categoryService.createCategory(categoryRequest))
          .isInstanceOf(DuplicateResourceException.class);

      verify(categoryRepository, never()).save(any());
    }
  }

  @Nested
  @DisplayName("Read Category Tests")
  class ReadCategoryTests {

    @Test
    @DisplayName("should count active products of a single category")
    void getCategoryById_Success() {
      // Arrange
      CategoryResponse response = CategoryResponse.builder().id(categoryId).productsCount(4L).build();
      when(categoryRepository.findById(categoryId)).thenReturn(Optional.of(category));
      when(productRepository.countByCategoryIdAndIsActiveTrue(categoryId)).thenReturn(4L);
      when(categoryMapper.toCategoryResponse(category, 4L)).thenReturn(response);

      // Act
      CategoryResponse result = categoryService.getCategoryById(categoryId);

      // Assert
      assertThat(result.getProductsCount()).isEqualTo(4L);
    }

    @Test
    @DisplayName("should default to zero for categories missing from the grouped counts")
    void getAllCategories_GroupedCounts() {
      // Arrange
      Category empty = Category.builder().name("Tablets").build();
      empty.setId(UUID.randomUUID());
      when(categoryRepository.findAllByOrderByNameAsc()).thenReturn(List.of(category, empty));
      when(productRepository.countActivePerCategory()).thenReturn(List.of(total(categoryId, 5L)));
      when(categoryMapper.toCategoryResponse(any(Category.class), anyLong()))
          .thenAnswer(invocation -> CategoryResponse.builder()
              .name(invocation.<Category>getArgument(0).getName())
              .productsCount(invocation.getArgument(1))
              .build());

      // Act
      List<CategoryResponse> result = categoryService.getAllCategories();

      // Assert
      assertThat(result).extracting(CategoryResponse::getName, CategoryResponse::getProductsCount)
          .containsExactly(tuple("Phones", 5L), tuple("Tablets", 0L));
    }

    @Test
    @DisplayName("should list active products with their stock totals")
    void getCategoryProducts_Success() {
      // Arrange
      Product product = Product.builder().name("Phone X").build();
      ProductResponse productResponse = ProductResponse.builder().name("Phone X").totalStock(12L).build();
      when(categoryRepository.existsById(categoryId)).thenReturn(true);
      when(productRepository.findActiveByCategoryId(categoryId)).thenReturn(List.of(product));
      when(productResponseAssembler.toResponses(List.of(product))).thenReturn(List.of(productResponse));

      // Act
      List<ProductResponse> result = categoryService.getCategoryProducts(categoryId);

      // Assert
      assertThat(result).singleElement().extracting(ProductResponse::getTotalStock).isEqualTo(12L);
    }
  }

  @Nested
  @DisplayName("Delete Category Tests")
  class DeleteCategoryTests {

    @Test
    @DisplayName("should refuse to delete a category that still has products")
    void deleteCategory_HasProducts() {
      // Arrange
      when(categoryRepository.findById(categoryId)).thenReturn(Optional.of(category));
      when(productRepository.existsByCategoryId(categoryId)).thenReturn(true);

      // Act & Assert
      assertThatThrownBy(() -> categoryService.deleteCategory(categoryId))
          .isInstanceOf(ReferentialIntegrityException.class)
          .hasMessageContaining("Phones");

      verify(categoryRepository, never()).delete(any());
    }

    @Test
    @DisplayName("should throw when the category does not exist")
    void deleteCategory_NotFound() {
      // Arrange
      when(categoryRepository.findById(categoryId)).thenReturn(Optional.empty());

      // Act & Assert
      assertThatThrownBy(() -> categoryService.deleteCategory(categoryId))
          .isInstanceOf(ResourceNotFoundException.class)
          .hasMessage("Category not found");
    }
  }
}
