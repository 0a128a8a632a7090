package com.cred.freestyle.commerce.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Shipment record, one per order. Starts PENDING without a tracking number.
 *
 * @author Commerce Platform Team
 */
@Entity
@Table(name = "shipping")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Shipping {

    @Id
    @Column(name = "shipment_id", nullable = false, length = 36)
    private String shipmentId;

    @Column(name = "order_id", nullable = false, unique = true, length = 36)
    private String orderId;

    @Column(name = "courier_name", length = 100)
    private String courierName;

    @Column(name = "tracking_number", length = 100)
    private String trackingNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "shipping_status", nullable = false, length = 20)
    private ShippingStatus shippingStatus;

    @Column(name = "estimated_delivery")
    private LocalDate estimatedDelivery;

    @Column(name = "actual_delivery")
    private Instant actualDelivery;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (shipmentId == null) {
            shipmentId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public void ship(String courierName, String trackingNumber, LocalDate estimatedDelivery) {
        if (shippingStatus != ShippingStatus.PENDING) {
            throw new IllegalStateException("Shipment " + shipmentId + " is already " + shippingStatus);
        }
        if (trackingNumber == null || trackingNumber.isBlank()) {
            throw new IllegalArgumentException("Tracking number is required to ship");
        }
        if (courierName != null && !courierName.isBlank()) {
            this.courierName = courierName;
        }
        this.trackingNumber = trackingNumber;
        this.estimatedDelivery = estimatedDelivery;
        this.shippingStatus = ShippingStatus.SHIPPED;
    }

    public void deliver() {
        if (shippingStatus != ShippingStatus.SHIPPED) {
            throw new IllegalStateException("Shipment " + shipmentId + " has not shipped (status " + shippingStatus + ")");
        }
        this.shippingStatus = ShippingStatus.DELIVERED;
        this.actualDelivery = Instant.now();
    }

    public enum ShippingStatus {
        PENDING,
        SHIPPED,
        DELIVERED
    }
}
