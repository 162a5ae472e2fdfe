package com.intellilend.liquidation.dto;

import java.math.BigDecimal;
import java.time.Instant;

public record LiquidationHistoryEntry(
        Instant timestamp,
        BigDecimal collateralLiquidated,
        BigDecimal debtCovered,
        String liquidator,
        String transactionHash,
        long blockNumber
) {
}
