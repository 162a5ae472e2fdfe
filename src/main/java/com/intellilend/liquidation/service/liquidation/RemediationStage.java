package com.intellilend.liquidation.service.liquidation;

import com.intellilend.liquidation.enums.AuditEventKind;
import com.intellilend.liquidation.enums.HealthState;
import com.intellilend.liquidation.enums.RemediationType;

/**
 * One step of the remediation fallback chain. Stages run in a fixed order, each less
 * reversible for the borrower than the one before.
 */
public interface RemediationStage {

    RemediationType type();

    /**
     * Whether the stage is configured at all (e.g. an auction contract address is set).
     */
    boolean isEnabled();

    /**
     * Destructive stages take collateral away from the borrower; the first one attempted
     * in a cycle is preceded by a {@code LIQUIDATION_INITIATED} audit event.
     */
    boolean isDestructive();

    /**
     * Borrower state after this stage succeeds.
     */
    HealthState resultingState();

    AuditEventKind successEvent();

    /**
     * Makes a single attempt. Gateway errors may propagate; the orchestrator treats them as a failed attempt.
     */
    StageOutcome attempt(RemediationContext ctx);
}
