package com.cred.freestyle.commerce.exception;

/**
 * Exception thrown when a coupon code cannot be applied to an order.
 *
 * @author Commerce Platform Team
 */
public class InvalidCouponException extends RuntimeException {

    private final String couponCode;
    private final Reason reason;

    public InvalidCouponException(String couponCode, Reason reason) {
        super(String.format("Coupon %s cannot be applied: %s", couponCode, reason.getDescription()));
        this.couponCode = couponCode;
        this.reason = reason;
    }

    public String getCouponCode() {
        return couponCode;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * Which applicability rule failed.
     */
    public enum Reason {
        NOT_FOUND("no such coupon"),
        INACTIVE("coupon is no longer active"),
        NOT_YET_VALID("coupon is not valid yet"),
        EXPIRED("coupon has expired"),
        USAGE_LIMIT_REACHED("coupon usage limit reached"),
        BELOW_MINIMUM("order subtotal is below the coupon minimum");

        private final String description;

        Reason(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }
}
