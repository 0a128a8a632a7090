package com.cred.freestyle.commerce.api.dto;

import jakarta.validation.constraints.Size;

/**
 * Request DTO for placing an order from the caller's cart.
 *
 * All fields are optional:
 * - shippingAddress: falls back to the profile address
 * - couponCode: no discount when absent
 * - paymentMethod: defaults to the configured method
 *
 * @author Commerce Platform Team
 */
public class PlaceOrderRequest {

    private String shippingAddress;

    @Size(max = 50, message = "Coupon code must be at most 50 characters")
    private String couponCode;

    @Size(max = 30, message = "Payment method must be at most 30 characters")
    private String paymentMethod;

    public PlaceOrderRequest() {
    }

    public PlaceOrderRequest(String shippingAddress, String couponCode, String paymentMethod) {
        this.shippingAddress = shippingAddress;
        this.couponCode = couponCode;
        this.paymentMethod = paymentMethod;
    }

    public String getShippingAddress() {
        return shippingAddress;
    }

    public void setShippingAddress(String shippingAddress) {
        this.shippingAddress = shippingAddress;
    }

    public String getCouponCode() {
        return couponCode;
    }

    public void setCouponCode(String couponCode) {
        this.couponCode = couponCode;
    }

    public String getPaymentMethod() {
        return paymentMethod;
    }

    public void setPaymentMethod(String paymentMethod) {
        this.paymentMethod = paymentMethod;
    }
}
