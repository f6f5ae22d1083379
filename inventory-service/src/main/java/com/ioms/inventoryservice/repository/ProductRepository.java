package com.ioms.inventoryservice.repository;

import com.ioms.inventoryservice.model.Product;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ProductRepository extends JpaRepository<Product, UUID> {

    boolean existsBySku(String sku);

    // restrict-delete checks for brands and categories
    boolean existsByBrandId(UUID brandId);

    boolean existsByCategoryId(UUID categoryId);

    // products_count of a brand or category counts active products only
    long countByBrandIdAndIsActiveTrue(UUID brandId);

    long countByCategoryIdAndIsActiveTrue(UUID categoryId);

    @Query("SELECT p.brand.id AS ownerId, COUNT(p) AS total FROM Product p "
            + "WHERE p.isActive = true GROUP BY p.brand.id")
    List<OwnerTotal> countActivePerBrand();

    @Query("SELECT p.category.id AS ownerId, COUNT(p) AS total FROM Product p "
            + "WHERE p.isActive = true GROUP BY p.category.id")
    List<OwnerTotal> countActivePerCategory();

    @Query("SELECT p FROM Product p JOIN FETCH p.brand JOIN FETCH p.category WHERE p.id = :id")
    Optional<Product> findWithBrandAndCategoryById(@Param("id") UUID id);

    @Query("SELECT p FROM Product p JOIN FETCH p.brand JOIN FETCH p.category ORDER BY p.name")
    List<Product> findAllWithBrandAndCategory();

    @Query("SELECT p FROM Product p JOIN FETCH p.brand JOIN FETCH p.category "
            + "WHERE p.brand.id = :brandId AND p.isActive = true ORDER BY p.name")
    List<Product> findActiveByBrandId(@Param("brandId") UUID brandId);

    @Query("SELECT p FROM Product p JOIN FETCH p.brand JOIN FETCH p.category "
            + "WHERE p.category.id = :categoryId AND p.isActive = true ORDER BY p.name")
    List<Product> findActiveByCategoryId(@Param("categoryId") UUID categoryId);

    // products without any stock row have a NULL sum and are not reported
    @Query("SELECT p FROM Product p JOIN FETCH p.brand JOIN FETCH p.category "
            + "WHERE p.isActive = true "
            + "AND (SELECT SUM(s.qty) FROM Stock s WHERE s.product = p) < :threshold "
            + "ORDER BY p.name")
    List<Product> findActiveWithTotalStockBelow(@Param("threshold") long threshold);
}
