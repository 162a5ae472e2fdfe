package com.intellilend.liquidation.enums;

public enum RemediationType {
    PROTECTION,
    AUCTION,
    DIRECT,
    NONE
}
