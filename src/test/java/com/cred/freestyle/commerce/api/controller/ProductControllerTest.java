package com.cred.freestyle.commerce.api.controller;

import com.cred.freestyle.commerce.api.exception.GlobalExceptionHandler;
import com.cred.freestyle.commerce.domain.model.Product;
import com.cred.freestyle.commerce.exception.InsufficientStockException;
import com.cred.freestyle.commerce.exception.ResourceNotFoundException;
import com.cred.freestyle.commerce.service.ProductService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;

import static com.cred.freestyle.commerce.testutil.TestDataBuilder.aProduct;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for ProductController using MockMvc.
 */
@WebMvcTest(ProductController.class)
@ContextConfiguration(classes = {ProductController.class, GlobalExceptionHandler.class})
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("ProductController Tests")
class ProductControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ProductService productService;

    // ========================================
    // Catalog reads
    // ========================================

    @Test
    @DisplayName("GET /products/{id} - returns the active product")
    void getProduct_Found() throws Exception {
        // Given
        Product product = aProduct().productId("p-1").name("Desk Lamp").build();
        when(productService.getActiveProduct("p-1")).thenReturn(product);

        // When / Then
        mockMvc.perform(get("/api/v1/products/p-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.productId").value("p-1"))
                .andExpect(jsonPath("$.name").value("Desk Lamp"))
                .andExpect(jsonPath("$.stockQty").value(100));
    }

    @Test
    @DisplayName("GET /products/{id} - unknown product returns 404")
    void getProduct_NotFound() throws Exception {
        when(productService.getActiveProduct("nope")).thenThrow(new ResourceNotFoundException("Product", "nope"));

        mockMvc.perform(get("/api/v1/products/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.details.resourceType").value("Product"))
                .andExpect(jsonPath("$.details.resourceId").value("nope"));
    }

    @Test
    @DisplayName("GET /products - page size is capped at 100")
    void listProducts_CapsPageSize() throws Exception {
        // Given
        when(productService.listProducts(isNull(), any(Pageable.class)))
                .thenAnswer(invocation -> new PageImpl<>(List.of(aProduct().build()), invocation.getArgument(1), 1));

        // When / Then
        mockMvc.perform(get("/api/v1/products").param("size", "500"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content", hasSize(1)))
                .andExpect(jsonPath("$.size").value(100));

        verify(productService).listProducts(null, PageRequest.of(0, 100));
    }

    // ========================================
    // Admin mutations
    // ========================================

    @Test
    @WithMockUser(username = "admin-1", roles = "ADMIN")
    @DisplayName("POST /products - valid request returns 201")
    void createProduct_Returns201() throws Exception {
        // Given
        String requestBody = """
                {
                    "name": "Desk Lamp",
                    "price": 24.50,
                    "stockQty": 10,
                    "brand": "Acme"
                }
                """;
        when(productService.createProduct(eq("Desk Lamp"), isNull(), any(BigDecimal.class), eq(10), isNull(), eq("Acme")))
                .thenReturn(aProduct().productId("p-9").name("Desk Lamp").build());

        // When / Then
        mockMvc.perform(post("/api/v1/products")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.productId").value("p-9"));
    }

    @Test
    @WithMockUser(username = "admin-1", roles = "ADMIN")
    @DisplayName("POST /products - missing name returns 400 with field errors")
    void createProduct_Invalid() throws Exception {
        mockMvc.perform(post("/api/v1/products")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"price\": -1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"))
                .andExpect(jsonPath("$.details.fieldErrors.name").exists())
                .andExpect(jsonPath("$.details.fieldErrors.price").exists());

        verifyNoInteractions(productService);
    }

    @Test
    @WithMockUser(username = "admin-1", roles = "ADMIN")
    @DisplayName("POST /products/{id}/stock - removal below zero returns 409")
    void adjustStock_BelowZero() throws Exception {
        when(productService.adjustStock("p-1", -5)).thenThrow(new InsufficientStockException("p-1", 5, 2));

        mockMvc.perform(post("/api/v1/products/p-1/stock")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"delta\": -5}"))
                .andExpect(status().isConflict());
    }

    @Test
    @WithMockUser(username = "admin-1", roles = "ADMIN")
    @DisplayName("DELETE /products/{id} - soft delete returns 204")
    void deactivateProduct() throws Exception {
        mockMvc.perform(delete("/api/v1/products/p-1"))
                .andExpect(status().isNoContent());

        verify(productService).deactivateProduct("p-1");
    }
}
