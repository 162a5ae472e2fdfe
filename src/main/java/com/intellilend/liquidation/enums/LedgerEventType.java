package com.intellilend.liquidation.enums;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Ledger events the monitor subscribes to. Wire names are the contract event names
 * ({@code Borrow}, {@code CollateralAdded}, ...).
 */
public enum LedgerEventType {
    BORROW("Borrow"),
    REPAY("Repay"),
    COLLATERAL_ADDED("CollateralAdded"),
    COLLATERAL_REMOVED("CollateralRemoved"),
    AUCTION_STARTED("AuctionStarted"),
    AUCTION_ENDED("AuctionEnded"),
    PROTECTION_ACTIVATED("ProtectionActivated");

    private final String wireName;

    LedgerEventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static LedgerEventType fromWire(String value) {
        if (value == null) return null;
        for (LedgerEventType t : values()) {
            if (t.wireName.equalsIgnoreCase(value) || t.name().equals(value.toUpperCase(Locale.ROOT))) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown ledger event type: " + value);
    }
}
