package com.intellilend.liquidation.enums;

public enum AuctionStatus {
    ACTIVE,
    SETTLED
}
