package com.intellilend.liquidation.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One flash-loan protection activation attempt. Lives for the remediation cycle only;
 * the audit trail is its durable record.
 */
public record ProtectionAttempt(
        String borrower,
        BigDecimal amount,
        boolean success,
        String transactionHash,
        String error,
        Instant attemptedAt
) {
}
