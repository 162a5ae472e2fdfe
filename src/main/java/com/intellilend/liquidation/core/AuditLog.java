package com.intellilend.liquidation.core;

/**
 * Durable, append-only audit sink.
 *
 * Contracts:
 *  - append is a single attempt; implementations do not retry.
 *  - Failures surface as unchecked exceptions; callers decide whether they matter.
 *  - Thread-safe.
 */
public interface AuditLog {

    /**
     * @param tag     event kind, e.g. {@code LIQUIDATION_COMPLETED}
     * @param payload serialized audit event (UTF-8 JSON)
     * @return identifier assigned to the appended entry
     */
    String append(String tag, byte[] payload);
}
