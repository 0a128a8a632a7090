package com.cred.freestyle.commerce.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Payment gateway confirmation for an order.
 *
 * @author Commerce Platform Team
 */
public class PaymentConfirmationRequest {

    @NotBlank(message = "Transaction ID is required")
    private String transactionId;

    public PaymentConfirmationRequest() {
    }

    public PaymentConfirmationRequest(String transactionId) {
        this.transactionId = transactionId;
    }

    public String getTransactionId() {
        return transactionId;
    }

    public void setTransactionId(String transactionId) {
        this.transactionId = transactionId;
    }
}
