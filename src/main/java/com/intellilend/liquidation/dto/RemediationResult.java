package com.intellilend.liquidation.dto;

import com.intellilend.liquidation.enums.RemediationType;
import com.intellilend.liquidation.model.ProtectionAttempt;

import java.util.List;

/**
 * Outcome of one pass through the remediation chain.
 *
 * @param type            the stage that succeeded, or the last stage tried when {@code success} is false
 * @param attemptedStages stage names in the order they were attempted
 */
public record RemediationResult(
        String borrower,
        RemediationType type,
        boolean success,
        String transactionHash,
        String auctionId,
        String error,
        List<String> attemptedStages,
        ProtectionAttempt protectionAttempt
) {
}
