package com.intellilend.liquidation.test.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.intellilend.liquidation.common.Result;
import com.intellilend.liquidation.core.AuditLog;
import com.intellilend.liquidation.enums.AuditEventKind;
import com.intellilend.liquidation.service.audit.AuditRecorder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuditRecorderTest {

    @Mock
    AuditLog auditLog;

    ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
    AuditRecorder recorder;

    @BeforeEach
    void setUp() {
        recorder = new AuditRecorder(auditLog, mapper,
                Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void serializesEventAndAppendsOnceUnderKindTag() throws Exception {
        when(auditLog.append(eq("LIQUIDATION_COMPLETED"), any())).thenReturn("evt-1");
        Map<String, Object> payload = new HashMap<>();
        payload.put("borrower", "0xA");
        payload.put("transactionHash", "0xfeed");
        payload.put("debt", new BigDecimal("1000"));
        payload.put("auctionId", null);

        Result<String> r = recorder.record(AuditEventKind.LIQUIDATION_COMPLETED, "0xA", payload);

        assertThat(r.isOk()).isTrue();
        assertThat(r.get()).isEqualTo("evt-1");

        ArgumentCaptor<byte[]> bytes = ArgumentCaptor.forClass(byte[].class);
        verify(auditLog, times(1)).append(eq("LIQUIDATION_COMPLETED"), bytes.capture());
        JsonNode json = mapper.readTree(bytes.getValue());
        assertThat(json.get("kind").asText()).isEqualTo("LIQUIDATION_COMPLETED");
        assertThat(json.get("borrower").asText()).isEqualTo("0xA");
        assertThat(json.get("source").asText()).isEqualTo("liquidation-engine");
        assertThat(json.get("id").asText()).isNotBlank();
        assertThat(json.path("payload").path("transactionHash").asText()).isEqualTo("0xfeed");
        assertThat(json.path("payload").has("auctionId")).isFalse();
    }

    @Test
    void sinkFailureIsReportedNotThrownAndNotRetried() {
        when(auditLog.append(any(), any())).thenThrow(new IllegalStateException("broker unavailable"));

        Result<String> r = recorder.record(AuditEventKind.RISK_WARNING, "0xA");

        assertThat(r.isFailure()).isTrue();
        assertThat(r.getError()).contains("broker unavailable");
        verify(auditLog, times(1)).append(any(), any());
    }
}
