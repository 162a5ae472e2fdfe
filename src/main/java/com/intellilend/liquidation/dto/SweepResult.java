package com.intellilend.liquidation.dto;

import java.time.Instant;

/**
 * Summary of one full sweep. {@code errors} counts borrowers whose evaluation threw.
 */
public record SweepResult(
        int total,
        int healthy,
        int atRisk,
        int liquidatable,
        int protectedCount,
        int inAuction,
        int errors,
        Instant startedAt,
        long durationMs
) {
}
