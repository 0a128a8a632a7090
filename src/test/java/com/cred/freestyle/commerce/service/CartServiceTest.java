package com.cred.freestyle.commerce.service;

import com.cred.freestyle.commerce.domain.model.Cart;
import com.cred.freestyle.commerce.domain.model.CartItem;
import com.cred.freestyle.commerce.domain.model.Product;
import com.cred.freestyle.commerce.exception.ResourceNotFoundException;
import com.cred.freestyle.commerce.repository.CartItemRepository;
import com.cred.freestyle.commerce.repository.CartRepository;
import com.cred.freestyle.commerce.repository.ProductRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static com.cred.freestyle.commerce.testutil.TestDataBuilder.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CartService Unit Tests")
class CartServiceTest {

    private static final String USER_ID = "user-1";

    @Mock
    private CartRepository cartRepository;

    @Mock
    private CartItemRepository cartItemRepository;

    @Mock
    private ProductRepository productRepository;

    @InjectMocks
    private CartService cartService;

    private final Cart cart = Cart.builder().cartId("cart-1").userId(USER_ID).build();

    @Test
    @DisplayName("getCartItems - user without a cart has no lines")
    void getCartItems_NoCart() {
        when(cartRepository.findByUserId(USER_ID)).thenReturn(Optional.empty());

        assertThat(cartService.getCartItems(USER_ID)).isEmpty();
        verifyNoInteractions(cartItemRepository);
    }

    @Test
    @DisplayName("addItem - adding a product already in the cart merges quantities")
    void addItem_MergesQuantity() {
        // Given
        CartItem existing = aCartItem("p-1", 2).build();
        when(productRepository.findByProductIdAndIsActiveTrue("p-1")).thenReturn(Optional.of(aProduct().build()));
        when(cartRepository.findByUserId(USER_ID)).thenReturn(Optional.of(cart));
        when(cartItemRepository.findByCartIdAndProductId("cart-1", "p-1")).thenReturn(Optional.of(existing));
        when(cartItemRepository.save(any(CartItem.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        CartItem saved = cartService.addItem(USER_ID, "p-1", 3);

        // Then
        assertThat(saved.getQuantity()).isEqualTo(5);
        assertThat(saved.getCartItemId()).isEqualTo(existing.getCartItemId());
    }

    @Test
    @DisplayName("addItem - merge that would overflow the line quantity is rejected")
    void addItem_MergeOverflow() {
        // Given
        CartItem existing = aCartItem("p-1", Integer.MAX_VALUE).build();
        when(productRepository.findByProductIdAndIsActiveTrue("p-1")).thenReturn(Optional.of(aProduct().build()));
        when(cartRepository.findByUserId(USER_ID)).thenReturn(Optional.of(cart));
        when(cartItemRepository.findByCartIdAndProductId("cart-1", "p-1")).thenReturn(Optional.of(existing));

        // When / Then
        assertThatThrownBy(() -> cartService.addItem(USER_ID, "p-1", 2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("too large");
        assertThat(existing.getQuantity()).isEqualTo(Integer.MAX_VALUE);
        verify(cartItemRepository, never()).save(any());
    }

    @Test
    @DisplayName("addItem - first write creates the cart lazily")
    void addItem_CreatesCart() {
        // Given
        when(productRepository.findByProductIdAndIsActiveTrue("p-1")).thenReturn(Optional.of(aProduct().build()));
        when(cartRepository.findByUserId(USER_ID)).thenReturn(Optional.empty());
        when(cartRepository.save(any(Cart.class))).thenReturn(cart);
        when(cartItemRepository.findByCartIdAndProductId("cart-1", "p-1")).thenReturn(Optional.empty());
        when(cartItemRepository.save(any(CartItem.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        cartService.addItem(USER_ID, "p-1", 1);

        // Then
        ArgumentCaptor<Cart> captor = ArgumentCaptor.forClass(Cart.class);
        verify(cartRepository).save(captor.capture());
        assertThat(captor.getValue().getUserId()).isEqualTo(USER_ID);
    }

    @Test
    @DisplayName("addItem - inactive or missing product is rejected")
    void addItem_UnknownProduct() {
        when(productRepository.findByProductIdAndIsActiveTrue("gone")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> cartService.addItem(USER_ID, "gone", 1))
                .isInstanceOf(ResourceNotFoundException.class);
        verify(cartItemRepository, never()).save(any());
    }

    @Test
    @DisplayName("addItem - zero quantity is rejected")
    void addItem_ZeroQuantity() {
        assertThatThrownBy(() -> cartService.addItem(USER_ID, "p-1", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("getCartSummary - prices lines at current product prices")
    void getCartSummary_Prices() {
        // Given
        Product product = aProduct().productId("p-1").price(new BigDecimal("10.00")).build();
        when(cartRepository.findByUserId(USER_ID)).thenReturn(Optional.of(cart));
        when(cartItemRepository.findByCartIdOrderByCreatedAtAscCartItemIdAsc("cart-1"))
                .thenReturn(List.of(aCartItem("p-1", 2).build()));
        when(productRepository.findAllById(List.of("p-1"))).thenReturn(List.of(product));

        // When
        CartSummary summary = cartService.getCartSummary(USER_ID);

        // Then
        assertThat(summary.getTotal()).isEqualByComparingTo("20.00");
        assertThat(summary.getItemCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("clearCart - deletes every line of the cart")
    void clearCart() {
        when(cartRepository.findByUserId(USER_ID)).thenReturn(Optional.of(cart));
        when(cartItemRepository.deleteAllByCartId("cart-1")).thenReturn(2);

        cartService.clearCart(USER_ID);

        verify(cartItemRepository).deleteAllByCartId("cart-1");
    }
}
