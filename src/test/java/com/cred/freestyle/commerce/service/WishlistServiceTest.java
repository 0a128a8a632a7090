package com.cred.freestyle.commerce.service;

import com.cred.freestyle.commerce.domain.model.WishlistItem;
import com.cred.freestyle.commerce.exception.ResourceNotFoundException;
import com.cred.freestyle.commerce.repository.ProductRepository;
import com.cred.freestyle.commerce.repository.WishlistItemRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static com.cred.freestyle.commerce.testutil.TestDataBuilder.aProduct;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("WishlistService Unit Tests")
class WishlistServiceTest {

    @Mock
    private WishlistItemRepository wishlistItemRepository;

    @Mock
    private ProductRepository productRepository;

    @InjectMocks
    private WishlistService wishlistService;

    @Test
    @DisplayName("addItem - adding the same product twice returns the existing entry")
    void addItem_Idempotent() {
        WishlistItem existing = WishlistItem.builder().wishlistItemId("w-1").userId("user-1").productId("p-1").build();
        when(productRepository.findByProductIdAndIsActiveTrue("p-1")).thenReturn(Optional.of(aProduct().build()));
        when(wishlistItemRepository.findByUserIdAndProductId("user-1", "p-1")).thenReturn(Optional.of(existing));

        WishlistItem result = wishlistService.addItem("user-1", "p-1");

        assertThat(result).isSameAs(existing);
        verify(wishlistItemRepository, never()).save(any());
    }

    @Test
    @DisplayName("addItem - new product is saved")
    void addItem_New() {
        when(productRepository.findByProductIdAndIsActiveTrue("p-1")).thenReturn(Optional.of(aProduct().build()));
        when(wishlistItemRepository.findByUserIdAndProductId("user-1", "p-1")).thenReturn(Optional.empty());
        when(wishlistItemRepository.save(any(WishlistItem.class))).thenAnswer(invocation -> invocation.getArgument(0));

        WishlistItem result = wishlistService.addItem("user-1", "p-1");

        assertThat(result.getUserId()).isEqualTo("user-1");
        assertThat(result.getProductId()).isEqualTo("p-1");
    }

    @Test
    @DisplayName("addItem - inactive or unknown product")
    void addItem_InactiveProduct() {
        when(productRepository.findByProductIdAndIsActiveTrue("p-1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> wishlistService.addItem("user-1", "p-1"))
                .isInstanceOf(ResourceNotFoundException.class);
        verifyNoInteractions(wishlistItemRepository);
    }

    @Test
    @DisplayName("removeItem - product not on the wishlist")
    void removeItem_Missing() {
        when(wishlistItemRepository.findByUserIdAndProductId("user-1", "p-1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> wishlistService.removeItem("user-1", "p-1"))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
