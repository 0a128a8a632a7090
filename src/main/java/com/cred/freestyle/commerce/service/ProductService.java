package com.cred.freestyle.commerce.service;

import com.cred.freestyle.commerce.domain.model.Product;
import com.cred.freestyle.commerce.exception.InsufficientStockException;
import com.cred.freestyle.commerce.exception.ResourceNotFoundException;
import com.cred.freestyle.commerce.infrastructure.cache.ProductCacheService;
import com.cred.freestyle.commerce.repository.ProductRepository;
import com.cred.freestyle.commerce.security.SecurityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Catalog collaborator for products.
 *
 * Reads use a cache-first strategy:
 * 1. Check Redis cache
 * 2. If miss, query database
 * 3. Cache the active product for subsequent requests
 *
 * Every admin mutation evicts the cached row and is written to the audit log.
 *
 * @author Commerce Platform Team
 */
@Service
public class ProductService {

    private static final Logger logger = LoggerFactory.getLogger(ProductService.class);

    private static final String TABLE = "products";

    private final ProductRepository productRepository;
    private final CategoryService categoryService;
    private final ProductCacheService cacheService;
    private final AuditService auditService;

    public ProductService(
            ProductRepository productRepository,
            CategoryService categoryService,
            ProductCacheService cacheService,
            AuditService auditService
    ) {
        this.productRepository = productRepository;
        this.categoryService = categoryService;
        this.cacheService = cacheService;
        this.auditService = auditService;
    }

    /**
     * Get an active product (customer view).
     *
     * @param productId Product ID
     * @return Product
     * @throws ResourceNotFoundException if missing or inactive
     */
    @Transactional(readOnly = true)
    public Product getActiveProduct(String productId) {
        Optional<Product> cached = cacheService.getProduct(productId);
        if (cached.isPresent() && Boolean.TRUE.equals(cached.get().getIsActive())) {
            return cached.get();
        }

        Product product = productRepository.findByProductIdAndIsActiveTrue(productId)
                .orElseThrow(() -> new ResourceNotFoundException("Product", productId));
        cacheService.cacheProduct(product);
        return product;
    }

    /**
     * Get a product regardless of its active flag (admin view and internal lookups).
     */
    @Transactional(readOnly = true)
    public Product getProduct(String productId) {
        return productRepository.findById(productId)
                .orElseThrow(() -> new ResourceNotFoundException("Product", productId));
    }

    /**
     * List active products, optionally restricted to one category.
     */
    @Transactional(readOnly = true)
    public Page<Product> listProducts(String categoryId, Pageable pageable) {
        if (categoryId != null && !categoryId.isBlank()) {
            return productRepository.findByCategoryIdAndIsActiveTrue(categoryId, pageable);
        }
        return productRepository.findByIsActiveTrue(pageable);
    }

    @Transactional(readOnly = true)
    public Page<Product> searchProducts(String query, Pageable pageable) {
        if (query == null || query.isBlank()) {
            return productRepository.findByIsActiveTrue(pageable);
        }
        return productRepository.searchActive(query.trim(), pageable);
    }

    @Transactional
    public Product createProduct(String name, String description, BigDecimal price, Integer stockQty,
                                 String categoryId, String brand) {
        validatePrice(price);
        if (stockQty == null || stockQty < 0) {
            throw new IllegalArgumentException("Stock quantity must be zero or more");
        }
        requireCategory(categoryId);

        Product product = productRepository.save(Product.builder()
                .name(name)
                .description(description)
                .price(price)
                .stockQty(stockQty)
                .categoryId(categoryId)
                .brand(brand)
                .isActive(true)
                .build());

        auditService.record(SecurityUtils.getCurrentUserId(), AuditAction.CREATE, TABLE,
                product.getProductId(), null, product);
        logger.info("Created product {} ({}) with stock {}", product.getProductId(), name, stockQty);
        return product;
    }

    /**
     * Update catalog fields. Null arguments leave the field unchanged.
     * Stock is changed through {@link #adjustStock(String, int)} only.
     */
    @Transactional
    public Product updateProduct(String productId, String name, String description, BigDecimal price,
                                 String categoryId, String brand) {
        Product product = getProduct(productId);
        String before = auditService.snapshot(product);

        if (name != null) {
            product.setName(name);
        }
        if (description != null) {
            product.setDescription(description);
        }
        if (price != null) {
            validatePrice(price);
            product.setPrice(price);
        }
        if (categoryId != null) {
            requireCategory(categoryId);
            product.setCategoryId(categoryId);
        }
        if (brand != null) {
            product.setBrand(brand);
        }

        Product saved = productRepository.save(product);
        auditService.record(SecurityUtils.getCurrentUserId(), AuditAction.UPDATE, TABLE, productId, before, saved);
        cacheService.evictProduct(productId);
        logger.info("Updated product {}", productId);
        return saved;
    }

    /**
     * Soft delete a product. It disappears from listings and can no longer be ordered.
     */
    @Transactional
    public void deactivateProduct(String productId) {
        Product product = getProduct(productId);
        String before = auditService.snapshot(product);

        product.deactivate();
        productRepository.save(product);

        auditService.record(SecurityUtils.getCurrentUserId(), AuditAction.DELETE, TABLE, productId, before, product);
        cacheService.evictProduct(productId);
        logger.info("Deactivated product {}", productId);
    }

    /**
     * Add or remove stock under a row lock.
     *
     * @param productId Product ID
     * @param delta Units to add (positive) or remove (negative)
     * @return Updated product
     * @throws InsufficientStockException if removal would make stock negative
     */
    @Transactional
    public Product adjustStock(String productId, int delta) {
        if (delta == 0) {
            throw new IllegalArgumentException("Stock adjustment must not be zero");
        }

        Product product = productRepository.findByIdWithLock(productId)
                .orElseThrow(() -> new ResourceNotFoundException("Product", productId));
        String before = auditService.snapshot(product);

        if (delta > 0) {
            product.restoreStock(delta);
        } else {
            product.decrementStock(-delta);
        }

        Product saved = productRepository.save(product);
        auditService.record(SecurityUtils.getCurrentUserId(), AuditAction.STOCK_ADJUST, TABLE, productId, before, saved);
        cacheService.evictProduct(productId);
        logger.info("Adjusted stock of product {} by {}: now {}", productId, delta, saved.getStockQty());
        return saved;
    }

    private void validatePrice(BigDecimal price) {
        if (price == null || price.signum() < 0) {
            throw new IllegalArgumentException("Price must be zero or more");
        }
    }

    private void requireCategory(String categoryId) {
        if (categoryId != null && !categoryService.exists(categoryId)) {
            throw new ResourceNotFoundException("Category", categoryId);
        }
    }
}
