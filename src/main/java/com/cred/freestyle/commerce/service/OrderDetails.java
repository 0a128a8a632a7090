package com.cred.freestyle.commerce.service;

import com.cred.freestyle.commerce.domain.model.Order;
import com.cred.freestyle.commerce.domain.model.OrderItem;
import com.cred.freestyle.commerce.domain.model.Payment;
import com.cred.freestyle.commerce.domain.model.Shipping;

import java.util.List;

/**
 * An order together with its items, payment and shipment.
 *
 * @author Commerce Platform Team
 */
public class OrderDetails {

    private final Order order;
    private final List<OrderItem> items;
    private final Payment payment;
    private final Shipping shipping;

    public OrderDetails(Order order, List<OrderItem> items, Payment payment, Shipping shipping) {
        this.order = order;
        this.items = items;
        this.payment = payment;
        this.shipping = shipping;
    }

    public Order getOrder() {
        return order;
    }

    public List<OrderItem> getItems() {
        return items;
    }

    public Payment getPayment() {
        return payment;
    }

    public Shipping getShipping() {
        return shipping;
    }
}
