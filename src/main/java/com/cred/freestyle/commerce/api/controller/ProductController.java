package com.cred.freestyle.commerce.api.controller;

import com.cred.freestyle.commerce.api.dto.PageResponse;
import com.cred.freestyle.commerce.api.dto.ProductRequest;
import com.cred.freestyle.commerce.api.dto.ProductResponse;
import com.cred.freestyle.commerce.api.dto.StockAdjustmentRequest;
import com.cred.freestyle.commerce.domain.model.Product;
import com.cred.freestyle.commerce.service.ProductService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for the product catalog.
 *
 * Public reads only ever return active products. Mutations are admin only
 * and audited by the service layer.
 *
 * @author Commerce Platform Team
 */
@RestController
@RequestMapping("/api/v1/products")
public class ProductController {

    private static final Logger logger = LoggerFactory.getLogger(ProductController.class);

    private final ProductService productService;

    public ProductController(ProductService productService) {
        this.productService = productService;
    }

    /**
     * List active products.
     *
     * @param categoryId Optional category filter
     */
    @GetMapping
    public ResponseEntity<PageResponse<ProductResponse>> listProducts(
            @RequestParam(required = false) String categoryId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(PageResponse.from(
                productService.listProducts(categoryId, Pagination.of(page, size)), ProductResponse::fromEntity));
    }

    /**
     * Case-insensitive search over name and description.
     */
    @GetMapping("/search")
    public ResponseEntity<PageResponse<ProductResponse>> searchProducts(
            @RequestParam("q") String query,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(PageResponse.from(
                productService.searchProducts(query, Pagination.of(page, size)), ProductResponse::fromEntity));
    }

    @GetMapping("/{productId}")
    public ResponseEntity<ProductResponse> getProduct(@PathVariable String productId) {
        logger.debug("Fetching product: {}", productId);
        return ResponseEntity.ok(ProductResponse.fromEntity(productService.getActiveProduct(productId)));
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ProductResponse> createProduct(@Valid @RequestBody ProductRequest request) {
        Product product = productService.createProduct(
                request.getName(),
                request.getDescription(),
                request.getPrice(),
                request.getStockQty(),
                request.getCategoryId(),
                request.getBrand()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(ProductResponse.fromEntity(product));
    }

    @PutMapping("/{productId}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ProductResponse> updateProduct(
            @PathVariable String productId,
            @Valid @RequestBody ProductRequest request
    ) {
        Product product = productService.updateProduct(
                productId,
                request.getName(),
                request.getDescription(),
                request.getPrice(),
                request.getCategoryId(),
                request.getBrand()
        );
        return ResponseEntity.ok(ProductResponse.fromEntity(product));
    }

    @DeleteMapping("/{productId}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Void> deactivateProduct(@PathVariable String productId) {
        productService.deactivateProduct(productId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Apply a relative stock change. 409 if the result would go below zero.
     */
    @PostMapping("/{productId}/stock")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ProductResponse> adjustStock(
            @PathVariable String productId,
            @Valid @RequestBody StockAdjustmentRequest request
    ) {
        Product product = productService.adjustStock(productId, request.getDelta());
        return ResponseEntity.ok(ProductResponse.fromEntity(product));
    }
}
