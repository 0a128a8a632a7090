package com.cred.freestyle.commerce.domain.model;

import com.cred.freestyle.commerce.exception.InsufficientStockException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.cred.freestyle.commerce.testutil.TestDataBuilder.aProduct;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Product stock rules.
 */
@DisplayName("Product Domain Model Tests")
class ProductTest {

    @Test
    @DisplayName("canFulfil - true when active and stock covers the quantity")
    void canFulfil_EnoughStock() {
        // Given
        Product product = aProduct().stockQty(2).build();

        // Then
        assertThat(product.canFulfil(2)).isTrue();
        assertThat(product.canFulfil(3)).isFalse();
    }

    @Test
    @DisplayName("canFulfil - false for zero or negative quantities")
    void canFulfil_NonPositiveQuantity() {
        Product product = aProduct().stockQty(5).build();

        assertThat(product.canFulfil(0)).isFalse();
        assertThat(product.canFulfil(-2147483647)).isFalse();
    }

    @Test
    @DisplayName("canFulfil - false for inactive products regardless of stock")
    void canFulfil_Inactive() {
        // Given
        Product product = aProduct().stockQty(50).isActive(false).build();

        // Then
        assertThat(product.canFulfil(1)).isFalse();
    }

    @Test
    @DisplayName("decrementStock - removes exactly the requested units")
    void decrementStock_Success() {
        // Given
        Product product = aProduct().stockQty(5).build();

        // When
        product.decrementStock(2);

        // Then
        assertThat(product.getStockQty()).isEqualTo(3);
    }

    @Test
    @DisplayName("decrementStock - rejects going below zero and leaves stock untouched")
    void decrementStock_Insufficient() {
        // Given
        Product product = aProduct().stockQty(1).build();

        // When / Then
        assertThatThrownBy(() -> product.decrementStock(2))
                .isInstanceOf(InsufficientStockException.class)
                .satisfies(ex -> {
                    InsufficientStockException e = (InsufficientStockException) ex;
                    assertThat(e.getProductId()).isEqualTo(product.getProductId());
                    assertThat(e.getRequestedQuantity()).isEqualTo(2);
                    assertThat(e.getAvailableQuantity()).isEqualTo(1);
                });
        assertThat(product.getStockQty()).isEqualTo(1);
    }

    @Test
    @DisplayName("decrementStock / restoreStock - non-positive quantities are rejected")
    void nonPositiveQuantities() {
        Product product = aProduct().stockQty(5).build();

        assertThatThrownBy(() -> product.decrementStock(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> product.restoreStock(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("restoreStock - adds units back")
    void restoreStock() {
        // Given
        Product product = aProduct().stockQty(0).build();

        // When
        product.restoreStock(3);

        // Then
        assertThat(product.getStockQty()).isEqualTo(3);
    }
}
