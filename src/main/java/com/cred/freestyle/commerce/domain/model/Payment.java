package com.cred.freestyle.commerce.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Payment record, one per order. Created PENDING by checkout with the
 * order total as amount; completed or failed by the payment callback.
 *
 * @author Commerce Platform Team
 */
@Entity
@Table(name = "payments")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Payment {

    @Id
    @Column(name = "payment_id", nullable = false, length = 36)
    private String paymentId;

    @Column(name = "order_id", nullable = false, unique = true, length = 36)
    private String orderId;

    @Column(name = "payment_method", nullable = false, length = 50)
    private String paymentMethod;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    /**
     * Gateway transaction reference, set on completion.
     */
    @Column(name = "transaction_id", length = 255)
    private String transactionId;

    @Column(name = "payment_date")
    private Instant paymentDate;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (paymentId == null) {
            paymentId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public void complete(String transactionId) {
        if (paymentStatus != PaymentStatus.PENDING) {
            throw new IllegalStateException(
                    String.format("Payment %s is %s, only PENDING payments can be completed", paymentId, paymentStatus));
        }
        this.paymentStatus = PaymentStatus.COMPLETED;
        this.transactionId = transactionId;
        this.paymentDate = Instant.now();
    }

    public void fail() {
        if (paymentStatus != PaymentStatus.PENDING) {
            throw new IllegalStateException(
                    String.format("Payment %s is %s, only PENDING payments can fail", paymentId, paymentStatus));
        }
        this.paymentStatus = PaymentStatus.FAILED;
    }

    public boolean isPending() {
        return paymentStatus == PaymentStatus.PENDING;
    }

    public enum PaymentStatus {
        PENDING,
        COMPLETED,
        FAILED
    }
}
