package com.ioms.inventoryservice.controller;

import com.ioms.inventoryservice.dto.BrandRequest;
import com.ioms.inventoryservice.dto.BrandResponse;
import com.ioms.inventoryservice.dto.ProductResponse;
import com.ioms.inventoryservice.dto.RelatedQueryResponse;
import com.ioms.inventoryservice.query.schema.EntityKind;
import com.ioms.inventoryservice.services.BrandService;
import com.ioms.inventoryservice.services.RelatedQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/brands")
@RequiredArgsConstructor
public class BrandController {

    private final BrandService brandService;
    private final RelatedQueryService relatedQueryService;

    @PostMapping
    public ResponseEntity<BrandResponse> createBrand(@Valid @RequestBody BrandRequest request) {
        BrandResponse createdBrand = brandService.createBrand(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(createdBrand);
    }

    @GetMapping
    public ResponseEntity<List<BrandResponse>> getAllBrands() {
        return ResponseEntity.ok(brandService.getAllBrands());
    }

    // join, filter[<entity>], fields[<entity>], ordering, distinct, limit
    @GetMapping("/related")
    public ResponseEntity<RelatedQueryResponse> getRelated(@RequestParam MultiValueMap<String, String> params) {
        return ResponseEntity.ok(relatedQueryService.query(EntityKind.BRAND, params));
    }

    @GetMapping("/{brandId}")
    public ResponseEntity<BrandResponse> getBrandById(@PathVariable UUID brandId) {
        return ResponseEntity.ok(brandService.getBrandById(brandId));
    }

    @DeleteMapping("/{brandId}")
    public ResponseEntity<Void> deleteBrand(@PathVariable UUID brandId) {
        brandService.deleteBrand(brandId);
        return ResponseEntity.noContent().build();
    }

    // Active products of the brand
    @GetMapping("/{brandId}/products")
    public ResponseEntity<List<ProductResponse>> getBrandProducts(@PathVariable UUID brandId) {
        return ResponseEntity.ok(brandService.getBrandProducts(brandId));
    }
}
