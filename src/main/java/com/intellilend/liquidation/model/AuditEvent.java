package com.intellilend.liquidation.model;

import com.intellilend.liquidation.enums.AuditEventKind;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable audit entry. The payload is copied on construction; null values are dropped.
 */
public record AuditEvent(
        String id,
        AuditEventKind kind,
        String borrower,
        Map<String, Object> payload,
        Instant timestamp
) {
    public AuditEvent {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (payload != null) {
            payload.forEach((k, v) -> {
                if (k != null && v != null) copy.put(k, v);
            });
        }
        payload = Collections.unmodifiableMap(copy);
    }
}
