package com.cred.freestyle.commerce.api.dto;

import com.cred.freestyle.commerce.service.CartSummary;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Cart contents priced at current product prices.
 * Prices here are informational; checkout re-reads them under lock.
 *
 * @author Commerce Platform Team
 */
public class CartResponse {

    private String userId;
    private List<Line> items;
    private Integer itemCount;
    private BigDecimal total;

    public CartResponse() {
    }

    public static CartResponse from(CartSummary summary) {
        CartResponse response = new CartResponse();
        response.setUserId(summary.getUserId());
        response.setItems(summary.getLines().stream().map(Line::from).collect(Collectors.toList()));
        response.setItemCount(summary.getItemCount());
        response.setTotal(summary.getTotal());
        return response;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public List<Line> getItems() {
        return items;
    }

    public void setItems(List<Line> items) {
        this.items = items;
    }

    public Integer getItemCount() {
        return itemCount;
    }

    public void setItemCount(Integer itemCount) {
        this.itemCount = itemCount;
    }

    public BigDecimal getTotal() {
        return total;
    }

    public void setTotal(BigDecimal total) {
        this.total = total;
    }

    /**
     * One cart line.
     */
    public static class Line {

        private String cartItemId;
        private String productId;
        private String productName;
        private BigDecimal unitPrice;
        private Integer quantity;
        private BigDecimal lineTotal;

        public Line() {
        }

        static Line from(CartSummary.Line source) {
            Line line = new Line();
            line.setCartItemId(source.getItem().getCartItemId());
            line.setProductId(source.getItem().getProductId());
            line.setProductName(source.getProduct().getName());
            line.setUnitPrice(source.getProduct().getPrice());
            line.setQuantity(source.getItem().getQuantity());
            line.setLineTotal(source.getLineTotal());
            return line;
        }

        public String getCartItemId() {
            return cartItemId;
        }

        public void setCartItemId(String cartItemId) {
            this.cartItemId = cartItemId;
        }

        public String getProductId() {
            return productId;
        }

        public void setProductId(String productId) {
            this.productId = productId;
        }

        public String getProductName() {
            return productName;
        }

        public void setProductName(String productName) {
            this.productName = productName;
        }

        public BigDecimal getUnitPrice() {
            return unitPrice;
        }

        public void setUnitPrice(BigDecimal unitPrice) {
            this.unitPrice = unitPrice;
        }

        public Integer getQuantity() {
            return quantity;
        }

        public void setQuantity(Integer quantity) {
            this.quantity = quantity;
        }

        public BigDecimal getLineTotal() {
            return lineTotal;
        }

        public void setLineTotal(BigDecimal lineTotal) {
            this.lineTotal = lineTotal;
        }
    }
}
