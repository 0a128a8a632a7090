package com.cred.freestyle.commerce.service;

import com.cred.freestyle.commerce.domain.model.WishlistItem;
import com.cred.freestyle.commerce.exception.ResourceNotFoundException;
import com.cred.freestyle.commerce.repository.ProductRepository;
import com.cred.freestyle.commerce.repository.WishlistItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class WishlistService {

    private static final Logger logger = LoggerFactory.getLogger(WishlistService.class);

    private final WishlistItemRepository wishlistItemRepository;
    private final ProductRepository productRepository;

    public WishlistService(WishlistItemRepository wishlistItemRepository, ProductRepository productRepository) {
        this.wishlistItemRepository = wishlistItemRepository;
        this.productRepository = productRepository;
    }

    /**
     * Save a product to the wishlist. Saving the same product twice returns the existing entry.
     */
    @Transactional
    public WishlistItem addItem(String userId, String productId) {
        productRepository.findByProductIdAndIsActiveTrue(productId)
                .orElseThrow(() -> new ResourceNotFoundException("Product", productId));

        return wishlistItemRepository.findByUserIdAndProductId(userId, productId)
                .orElseGet(() -> {
                    logger.info("User {} wishlisted product {}", userId, productId);
                    return wishlistItemRepository.save(WishlistItem.builder()
                            .userId(userId)
                            .productId(productId)
                            .build());
                });
    }

    @Transactional(readOnly = true)
    public List<WishlistItem> getWishlist(String userId) {
        return wishlistItemRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    @Transactional
    public void removeItem(String userId, String productId) {
        WishlistItem item = wishlistItemRepository.findByUserIdAndProductId(userId, productId)
                .orElseThrow(() -> new ResourceNotFoundException("WishlistItem", productId));
        wishlistItemRepository.delete(item);
    }
}
