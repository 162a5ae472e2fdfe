package com.intellilend.liquidation.service.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intellilend.liquidation.common.Result;
import com.intellilend.liquidation.common.constants.LiquidationConsts;
import com.intellilend.liquidation.core.AuditLog;
import com.intellilend.liquidation.enums.AuditEventKind;
import com.intellilend.liquidation.model.AuditEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Serializes audit events and makes one attempt to append them to the audit log.
 * <p>
 * Never throws: a broken audit channel is logged and reported through the returned {@link Result},
 * and monitoring and remediation carry on regardless.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditRecorder {

    private final AuditLog auditLog;
    private final ObjectMapper mapper;
    private final Clock clock;

    public Result<String> record(AuditEventKind kind, String borrower, Map<String, Object> payload) {
        try {
            AuditEvent event = new AuditEvent(UUID.randomUUID().toString(), kind, borrower, payload, Instant.now(clock));
            ObjectNode json = mapper.valueToTree(event);
            json.put("source", LiquidationConsts.Audit.SOURCE);
            byte[] bytes = mapper.writeValueAsBytes(json);

            log.info("AUDIT kind={} borrower={} payload={}", kind, borrower, event.payload());
            String id = auditLog.append(kind.name(), bytes);
            return Result.ok(id != null ? id : event.id());
        } catch (Exception e) {
            log.warn("Audit write failed for {} borrower={}: {}", kind, borrower, e.toString());
            return Result.fail(e);
        }
    }

    public Result<String> record(AuditEventKind kind, String borrower) {
        return record(kind, borrower, Map.of());
    }
}
