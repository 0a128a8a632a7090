package com.cred.freestyle.commerce.infrastructure.messaging.events;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Event raised when an order moves to a new lifecycle status.
 * For cancellations, {@code restockedProductIds} names the products whose
 * stock was returned.
 *
 * @author Commerce Platform Team
 */
public class OrderStatusChangedEvent {

    private String orderId;
    private String userId;
    private String previousStatus;
    private String newStatus;
    private List<String> restockedProductIds;
    private Instant timestamp;

    public OrderStatusChangedEvent() {
        this.restockedProductIds = new ArrayList<>();
    }

    public OrderStatusChangedEvent(String orderId, String userId, String previousStatus, String newStatus,
                                   List<String> restockedProductIds) {
        this.orderId = orderId;
        this.userId = userId;
        this.previousStatus = previousStatus;
        this.newStatus = newStatus;
        this.restockedProductIds = restockedProductIds;
        this.timestamp = Instant.now();
    }

    public String getOrderId() {
        return orderId;
    }

    public void setOrderId(String orderId) {
        this.orderId = orderId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getPreviousStatus() {
        return previousStatus;
    }

    public void setPreviousStatus(String previousStatus) {
        this.previousStatus = previousStatus;
    }

    public String getNewStatus() {
        return newStatus;
    }

    public void setNewStatus(String newStatus) {
        this.newStatus = newStatus;
    }

    public List<String> getRestockedProductIds() {
        return restockedProductIds;
    }

    public void setRestockedProductIds(List<String> restockedProductIds) {
        this.restockedProductIds = restockedProductIds;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }
}
