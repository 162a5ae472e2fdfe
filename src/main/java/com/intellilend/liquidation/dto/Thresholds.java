package com.intellilend.liquidation.dto;

import java.math.BigDecimal;

/**
 * Classification cut-offs, read-only at runtime.
 */
public record Thresholds(
        BigDecimal liquidationThreshold,
        BigDecimal warningThreshold,
        long checkIntervalMs
) {
}
