package com.intellilend.liquidation.dto;

import com.intellilend.liquidation.enums.HealthState;
import com.intellilend.liquidation.model.AuctionRecord;

import java.math.BigDecimal;
import java.util.List;

/**
 * Point-in-time view of one borrower.
 *
 * @param state        classification of the freshly queried ledger values
 * @param trackedState state held by the tracker, null when the borrower is not tracked
 */
public record BorrowerDetail(
        String address,
        BigDecimal debtValue,
        BigDecimal collateralValue,
        double ratio,
        HealthState state,
        HealthState trackedState,
        Thresholds thresholds,
        ProtectionStatus protectionStatus,
        AuctionRecord activeAuction,
        List<LiquidationHistoryEntry> liquidationHistory
) {
}
