package com.intellilend.liquidation.enums;

/**
 * Per-borrower health classification. A borrower holds exactly one of these at a time.
 */
public enum HealthState {
    HEALTHY("Collateral ratio at or above the warning threshold"),
    AT_RISK("Collateral ratio below the warning threshold"),
    LIQUIDATABLE("Collateral ratio below the liquidation threshold"),
    PROTECTED("Flash-loan protection absorbed the shortfall"),
    IN_AUCTION("Collateral is being sold in a Dutch auction");

    private final String description;

    HealthState(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * States set by a remediation outcome rather than by classification.
     */
    public boolean isRemediated() {
        return this == PROTECTED || this == IN_AUCTION;
    }
}
