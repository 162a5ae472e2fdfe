package com.intellilend.liquidation.service.liquidation;

import com.intellilend.liquidation.model.AuctionRecord;
import com.intellilend.liquidation.model.ProtectionAttempt;

/**
 * Result of one remediation stage.
 *
 * @param skipped true when the stage did not apply (e.g. no active protection grant);
 *                a skipped stage is neither a success nor a failed attempt
 */
public record StageOutcome(
        boolean success,
        boolean skipped,
        String transactionHash,
        AuctionRecord auction,
        ProtectionAttempt protectionAttempt,
        String error
) {

    public static StageOutcome succeeded(String transactionHash) {
        return new StageOutcome(true, false, transactionHash, null, null, null);
    }

    public static StageOutcome failed(String error) {
        return new StageOutcome(false, false, null, null, null, error);
    }

    public static StageOutcome skipped(String reason) {
        return new StageOutcome(false, true, null, null, null, reason);
    }

    public StageOutcome withAuction(AuctionRecord auction) {
        return new StageOutcome(success, skipped, transactionHash, auction, protectionAttempt, error);
    }

    public StageOutcome withProtectionAttempt(ProtectionAttempt attempt) {
        return new StageOutcome(success, skipped, transactionHash, auction, attempt, error);
    }
}
