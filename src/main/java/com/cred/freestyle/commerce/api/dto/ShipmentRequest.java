package com.cred.freestyle.commerce.api.dto;

import jakarta.validation.constraints.NotBlank;

import java.time.LocalDate;

/**
 * Hand-over of an order to a courier (admin).
 *
 * @author Commerce Platform Team
 */
public class ShipmentRequest {

    private String courierName;

    @NotBlank(message = "Tracking number is required")
    private String trackingNumber;

    private LocalDate estimatedDelivery;

    public ShipmentRequest() {
    }

    public ShipmentRequest(String courierName, String trackingNumber, LocalDate estimatedDelivery) {
        this.courierName = courierName;
        this.trackingNumber = trackingNumber;
        this.estimatedDelivery = estimatedDelivery;
    }

    public String getCourierName() {
        return courierName;
    }

    public void setCourierName(String courierName) {
        this.courierName = courierName;
    }

    public String getTrackingNumber() {
        return trackingNumber;
    }

    public void setTrackingNumber(String trackingNumber) {
        this.trackingNumber = trackingNumber;
    }

    public LocalDate getEstimatedDelivery() {
        return estimatedDelivery;
    }

    public void setEstimatedDelivery(LocalDate estimatedDelivery) {
        this.estimatedDelivery = estimatedDelivery;
    }
}
