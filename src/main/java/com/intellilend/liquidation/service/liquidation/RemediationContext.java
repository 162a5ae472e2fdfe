package com.intellilend.liquidation.service.liquidation;

import java.math.BigDecimal;

/**
 * Position snapshot a remediation cycle works from.
 */
public record RemediationContext(String borrower, BigDecimal debt, BigDecimal collateral, double ratio) {
}
