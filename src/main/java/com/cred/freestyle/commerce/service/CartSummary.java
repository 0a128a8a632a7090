package com.cred.freestyle.commerce.service;

import com.cred.freestyle.commerce.domain.model.CartItem;
import com.cred.freestyle.commerce.domain.model.Product;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Cart contents priced at current product prices.
 *
 * @author Commerce Platform Team
 */
public class CartSummary {

    private final String userId;
    private final List<Line> lines;
    private final BigDecimal total;

    public CartSummary(String userId, List<Line> lines) {
        this.userId = userId;
        this.lines = lines;
        this.total = lines.stream()
                .map(Line::getLineTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);
    }

    public String getUserId() {
        return userId;
    }

    public List<Line> getLines() {
        return lines;
    }

    public BigDecimal getTotal() {
        return total;
    }

    public int getItemCount() {
        return lines.stream().mapToInt(line -> line.getItem().getQuantity()).sum();
    }

    /**
     * Cart line joined with its product.
     */
    public static class Line {
        private final CartItem item;
        private final Product product;

        public Line(CartItem item, Product product) {
            this.item = item;
            this.product = product;
        }

        public CartItem getItem() {
            return item;
        }

        public Product getProduct() {
            return product;
        }

        public BigDecimal getLineTotal() {
            return product.getPrice()
                    .multiply(BigDecimal.valueOf(item.getQuantity()))
                    .setScale(2, RoundingMode.HALF_UP);
        }
    }
}
