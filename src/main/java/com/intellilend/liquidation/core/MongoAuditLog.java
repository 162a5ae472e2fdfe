package com.intellilend.liquidation.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intellilend.liquidation.model.documents.AuditEventDocument;
import com.intellilend.liquidation.repo.documents.AuditEventRepo;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;

/**
 * Audit sink writing one document per event into {@code audit_events}.
 */
@Slf4j
public class MongoAuditLog implements AuditLog {

    private final AuditEventRepo repo;
    private final ObjectMapper mapper;
    private final Clock clock;

    public MongoAuditLog(AuditEventRepo repo, ObjectMapper mapper, Clock clock) {
        this.repo = repo;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public String append(String tag, byte[] payload) {
        String json = new String(payload, StandardCharsets.UTF_8);
        AuditEventDocument doc = AuditEventDocument.builder()
                .tag(tag)
                .borrower(borrowerOf(payload))
                .payload(json)
                .createdAt(Instant.now(clock))
                .build();
        return repo.save(doc).getId();
    }

    private String borrowerOf(byte[] payload) {
        try {
            JsonNode node = mapper.readTree(payload);
            JsonNode b = node == null ? null : node.get("borrower");
            return b == null || b.isNull() ? null : b.asText();
        } catch (IOException e) {
            log.debug("Audit payload is not JSON; storing without borrower index: {}", e.getMessage());
            return null;
        }
    }
}
