package com.intellilend.liquidation.dto;

import com.intellilend.liquidation.enums.HealthState;

/**
 * Output of the health evaluator. {@code ratio} is {@link Double#POSITIVE_INFINITY} when debt is zero.
 */
public record HealthClassification(double ratio, HealthState state) {

    public boolean isLiquidatable() {
        return state == HealthState.LIQUIDATABLE;
    }
}
