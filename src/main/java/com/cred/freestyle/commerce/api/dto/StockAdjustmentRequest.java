package com.cred.freestyle.commerce.api.dto;

import jakarta.validation.constraints.NotNull;

/**
 * Relative stock change. Negative values remove units.
 *
 * @author Commerce Platform Team
 */
public class StockAdjustmentRequest {

    @NotNull(message = "Delta is required")
    private Integer delta;

    public StockAdjustmentRequest() {
    }

    public StockAdjustmentRequest(Integer delta) {
        this.delta = delta;
    }

    public Integer getDelta() {
        return delta;
    }

    public void setDelta(Integer delta) {
        this.delta = delta;
    }
}
