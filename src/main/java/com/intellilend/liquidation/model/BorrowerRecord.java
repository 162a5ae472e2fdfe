package com.intellilend.liquidation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.intellilend.liquidation.enums.HealthState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Tracked state of one borrower, keyed by address. Mutated only by the state tracker;
 * everything outside it sees copies.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BorrowerRecord {

    private String address;
    private BigDecimal debtValue;
    private BigDecimal collateralValue;
    private double collateralRatio;
    private HealthState healthState;
    private Instant lastEvaluated;
    private Instant stateEnteredAt;

    /**
     * Set while a remediation outcome (Protected / InAuction) owns the state; classification
     * does not override a held state until the hold is released or the inputs move.
     */
    @JsonIgnore
    private boolean held;

    /**
     * True while a remediation attempt owns the borrower. Filled in on the copies handed out.
     */
    private boolean remediating;

    public BorrowerRecord copy() {
        return toBuilder().build();
    }
}
