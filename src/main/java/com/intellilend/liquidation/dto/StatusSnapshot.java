package com.intellilend.liquidation.dto;

import com.intellilend.liquidation.model.AuctionRecord;
import com.intellilend.liquidation.model.BorrowerRecord;

import java.time.Instant;
import java.util.List;

public record StatusSnapshot(
        boolean running,
        List<BorrowerRecord> atRiskBorrowers,
        List<BorrowerRecord> pendingLiquidations,
        List<AuctionRecord> activeAuctions,
        Thresholds thresholds,
        SweepResult lastSweep,
        Instant lastChecked
) {
}
