package com.intellilend.liquidation.enums;

public enum AuditEventKind {
    RISK_WARNING,
    HEALTH_RESTORED,
    LIQUIDATION_INITIATED,
    LIQUIDATION_COMPLETED,
    LIQUIDATION_FAILED,
    LIQUIDATION_CANCELLED,
    PROTECTION_USED,
    PROTECTION_FAILED,
    PROTECTION_ACTIVATED,
    AUCTION_STARTED,
    AUCTION_ENDED
}
