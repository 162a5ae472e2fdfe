package com.intellilend.liquidation.dto;

import com.intellilend.liquidation.enums.HealthState;

/**
 * Outcome of one state-tracker evaluation.
 *
 * @param changed             true when the borrower's state differs from before the evaluation
 * @param remediationRequired true exactly when the caller must hand the borrower to the orchestrator;
 *                            the borrower is already marked in-flight when this is set
 */
public record TransitionResult(
        String borrower,
        HealthState previousState,
        HealthState newState,
        double ratio,
        boolean changed,
        boolean remediationRequired
) {
}
