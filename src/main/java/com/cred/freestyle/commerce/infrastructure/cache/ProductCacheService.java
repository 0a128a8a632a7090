package com.cred.freestyle.commerce.infrastructure.cache;

import com.cred.freestyle.commerce.domain.model.Product;
import com.cred.freestyle.commerce.infrastructure.metrics.CommerceMetricsService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Redis cache for product reads.
 *
 * Cache Keys:
 * - product:{product_id} -> Product row (JSON)
 *
 * The database stays the source of truth: every write path evicts the
 * affected keys, and a Redis failure degrades to a cache miss instead of
 * failing the request.
 *
 * @author Commerce Platform Team
 */
@Service
public class ProductCacheService {

    private static final Logger logger = LoggerFactory.getLogger(ProductCacheService.class);

    private static final String PRODUCT_PREFIX = "product:";
    private static final Duration PRODUCT_TTL = Duration.ofMinutes(10);
    private static final String CACHE_TYPE = "product";

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final CommerceMetricsService metricsService;

    public ProductCacheService(
            RedisTemplate<String, String> redisTemplate,
            ObjectMapper objectMapper,
            CommerceMetricsService metricsService
    ) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
    }

    /**
     * Get cached product.
     *
     * @param productId Product ID
     * @return Optional containing the product if cached
     */
    public Optional<Product> getProduct(String productId) {
        try {
            String json = redisTemplate.opsForValue().get(PRODUCT_PREFIX + productId);
            if (json != null) {
                logger.debug("Cache hit for product: {}", productId);
                metricsService.recordCacheHit(CACHE_TYPE);
                return Optional.of(objectMapper.readValue(json, Product.class));
            }
            logger.debug("Cache miss for product: {}", productId);
            metricsService.recordCacheMiss(CACHE_TYPE);
            return Optional.empty();
        } catch (Exception e) {
            logger.error("Error getting product from cache: {}", productId, e);
            return Optional.empty();
        }
    }

    /**
     * Cache product as JSON.
     *
     * @param product Product to cache
     */
    public void cacheProduct(Product product) {
        try {
            String json = objectMapper.writeValueAsString(product);
            redisTemplate.opsForValue().set(PRODUCT_PREFIX + product.getProductId(), json, PRODUCT_TTL);
            logger.debug("Cached product: {}", product.getProductId());
        } catch (JsonProcessingException e) {
            logger.error("Error serializing product: {}", product.getProductId(), e);
        } catch (Exception e) {
            logger.error("Error caching product: {}", product.getProductId(), e);
        }
    }

    /**
     * Evict a single product.
     *
     * @param productId Product ID
     */
    public void evictProduct(String productId) {
        try {
            redisTemplate.delete(PRODUCT_PREFIX + productId);
            logger.debug("Evicted product from cache: {}", productId);
        } catch (Exception e) {
            logger.error("Error evicting product from cache: {}", productId, e);
        }
    }

    /**
     * Evict several products in one round trip.
     *
     * @param productIds Product IDs
     */
    public void evictProducts(Collection<String> productIds) {
        if (productIds == null || productIds.isEmpty()) {
            return;
        }
        List<String> keys = productIds.stream()
                .map(id -> PRODUCT_PREFIX + id)
                .collect(Collectors.toList());
        try {
            redisTemplate.delete(keys);
            logger.debug("Evicted {} products from cache", keys.size());
        } catch (Exception e) {
            logger.error("Error evicting products from cache: {}", productIds, e);
        }
    }
}
