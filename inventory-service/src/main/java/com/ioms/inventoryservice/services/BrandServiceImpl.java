package com.ioms.inventoryservice.services;

import com.ioms.common.exception.DuplicateResourceException;
import com.ioms.common.exception.ReferentialIntegrityException;
import com.ioms.common.exception.ResourceNotFoundException;
import com.ioms.inventoryservice.dto.BrandRequest;
import com.ioms.inventoryservice.dto.BrandResponse;
import com.ioms.inventoryservice.dto.ProductResponse;
import com.ioms.inventoryservice.mapper.BrandMapper;
import com.ioms.inventoryservice.model.Brand;
import com.ioms.inventoryservice.repository.BrandRepository;
import com.ioms.inventoryservice.repository.OwnerTotal;
import com.ioms.inventoryservice.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class BrandServiceImpl implements BrandService {

    private static final Logger log = LoggerFactory.getLogger(BrandServiceImpl.class);

    private final BrandRepository brandRepository;
    private final ProductRepository productRepository;
    private final BrandMapper brandMapper;
    private final ProductResponseAssembler productResponseAssembler;

    @Override
    @Transactional
    public BrandResponse createBrand(BrandRequest request) {
        // Brand names are unique regardless of case
        if (brandRepository.existsByNameIgnoreCase(request.getName())) {
            throw new DuplicateResourceException("Brand already exists: " + request.getName());
        }

        Brand savedBrand = brandRepository.save(brandMapper.toBrand(request));
        log.info("Brand created: id={}, name='{}'", savedBrand.getId(), savedBrand.getName());
        return brandMapper.toBrandResponse(savedBrand, 0L);
    }

    @Override
    @Transactional(readOnly = true)
    public List<BrandResponse> getAllBrands() {
        Map<UUID, Long> productCounts = OwnerTotal.toMap(productRepository.countActivePerBrand());
        return brandRepository.findAllByOrderByNameAsc().stream()
                .map(brand -> brandMapper.toBrandResponse(brand, productCounts.getOrDefault(brand.getId(), 0L)))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public BrandResponse getBrandById(UUID brandId) {
        Brand brand = brandRepository.findById(brandId)
                .orElseThrow(() -> new ResourceNotFoundException("Brand not found"));
        return brandMapper.toBrandResponse(brand, productRepository.countByBrandIdAndIsActiveTrue(brandId));
    }

    @Override
    @Transactional
    public void deleteBrand(UUID brandId) {
        Brand brand = brandRepository.findById(brandId)
                .orElseThrow(() -> new ResourceNotFoundException("Brand not found"));

        // Products keep a restrict reference to their brand
        if (productRepository.existsByBrandId(brandId)) {
            log.warn("Delete rejected: brand {} still has products", brandId);
            throw new ReferentialIntegrityException("Cannot delete brand '" + brand.getName() + "': it still has products");
        }

        brandRepository.delete(brand);
        log.info("Brand deleted: id={}, name='{}'", brandId, brand.getName());
    }

    @Override
    @Transactional(readOnly = true)
    public List<ProductResponse> getBrandProducts(UUID brandId) {
        // Verify brand exists
        if (!brandRepository.existsById(brandId)) {
            throw new ResourceNotFoundException("Brand not found");
        }

        return productResponseAssembler.toResponses(productRepository.findActiveByBrandId(brandId));
    }
}
