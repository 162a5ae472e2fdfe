package com.intellilend.liquidation.bus;

public final class EventBusConfig {

    private EventBusConfig() {
    }

    /** Outbound audit trail (append-only). */
    public static final String TOPIC_AUDIT = "audit";

    /** Inbound ledger contract events, keyed by borrower address. */
    public static final String TOPIC_LEDGER_EVENTS = "ledger.events";
}
