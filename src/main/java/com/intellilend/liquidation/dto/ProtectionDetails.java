package com.intellilend.liquidation.dto;

import java.math.BigDecimal;
import java.time.Instant;

public record ProtectionDetails(BigDecimal amount, Instant expirationTime, int remainingUses) {
}
