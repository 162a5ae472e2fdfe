package com.intellilend.liquidation.test.service;

import com.intellilend.liquidation.common.Result;
import com.intellilend.liquidation.common.exception.LedgerException;
import com.intellilend.liquidation.config.LiquidationConfig;
import com.intellilend.liquidation.dto.BorrowerDetail;
import com.intellilend.liquidation.dto.LiquidationHistoryEntry;
import com.intellilend.liquidation.dto.ProtectionDetails;
import com.intellilend.liquidation.dto.StatusSnapshot;
import com.intellilend.liquidation.dto.Thresholds;
import com.intellilend.liquidation.enums.AuctionStatus;
import com.intellilend.liquidation.enums.HealthState;
import com.intellilend.liquidation.model.AuctionRecord;
import com.intellilend.liquidation.service.audit.AuditRecorder;
import com.intellilend.liquidation.service.health.HealthEvaluator;
import com.intellilend.liquidation.service.ledger.LedgerGateway;
import com.intellilend.liquidation.service.liquidation.LiquidationOrchestrator;
import com.intellilend.liquidation.service.monitor.LiquidationMonitorService;
import com.intellilend.liquidation.service.monitor.MonitorScheduler;
import com.intellilend.liquidation.service.tracker.BorrowerStateTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LiquidationMonitorServiceTest {

    private static final Thresholds TH = new Thresholds(new BigDecimal("1.10"), new BigDecimal("1.25"), 60_000);

    @Mock
    MonitorScheduler monitor;
    @Mock
    LiquidationOrchestrator orchestrator;
    @Mock
    LedgerGateway ledger;
    @Mock
    LiquidationConfig config;
    @Mock
    AuditRecorder audit;

    BorrowerStateTracker tracker;
    LiquidationMonitorService service;

    @BeforeEach
    void setUp() {
        lenient().when(config.thresholds()).thenReturn(TH);
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
        HealthEvaluator evaluator = new HealthEvaluator();
        tracker = new BorrowerStateTracker(evaluator, config, audit, clock);
        service = new LiquidationMonitorService(monitor, tracker, orchestrator, evaluator, ledger, config);
    }

    @Test
    void statusSnapshotListsAtRiskPendingAndAuctions() {
        tracker.evaluate("0xwarn", new BigDecimal("1000"), new BigDecimal("1200"));
        tracker.evaluate("0xbad", new BigDecimal("1000"), new BigDecimal("1000"));
        tracker.evaluate("0xok", new BigDecimal("1000"), new BigDecimal("2000"));
        AuctionRecord auction = AuctionRecord.builder().auctionId("3").borrower("0xold").status(AuctionStatus.ACTIVE).build();
        when(orchestrator.activeAuctions()).thenReturn(List.of(auction));
        when(monitor.isRunning()).thenReturn(true);

        Result<StatusSnapshot> r = service.getStatus();

        assertThat(r.isOk()).isTrue();
        StatusSnapshot s = r.get();
        assertThat(s.running()).isTrue();
        assertThat(s.atRiskBorrowers()).extracting("address").containsExactly("0xwarn");
        assertThat(s.pendingLiquidations()).extracting("address").containsExactly("0xbad");
        assertThat(s.activeAuctions()).containsExactly(auction);
        assertThat(s.thresholds()).isEqualTo(TH);
    }

    @Test
    void borrowerWithFailedRemediationStaysInPendingLiquidations() {
        tracker.evaluate("0xbad", new BigDecimal("1000"), new BigDecimal("1000"));
        tracker.failRemediation("0xbad");
        when(orchestrator.activeAuctions()).thenReturn(List.of());

        StatusSnapshot s = service.getStatus().get();

        assertThat(s.atRiskBorrowers()).isEmpty();
        assertThat(s.pendingLiquidations()).singleElement().satisfies(r -> {
            assertThat(r.getAddress()).isEqualTo("0xbad");
            assertThat(r.getHealthState()).isEqualTo(HealthState.LIQUIDATABLE);
            assertThat(r.isRemediating()).isFalse();
        });
    }

    @Test
    void borrowerDetailCombinesLedgerAndTrackedState() {
        when(config.protectionEnabled()).thenReturn(true);
        when(ledger.getDebt("0xA")).thenReturn(new BigDecimal("1000"));
        when(ledger.getCollateral("0xA")).thenReturn(new BigDecimal("1200"));
        when(ledger.getProtectionDetails("0xA"))
                .thenReturn(Optional.of(new ProtectionDetails(new BigDecimal("250"), Instant.parse("2024-07-01T00:00:00Z"), 1)));
        LiquidationHistoryEntry past = new LiquidationHistoryEntry(Instant.parse("2024-01-01T00:00:00Z"),
                new BigDecimal("10"), new BigDecimal("9"), "0xL", "0xh", 100L);
        when(ledger.getLiquidationHistory("0xA")).thenReturn(List.of(past));
        when(orchestrator.activeAuctionFor("0xA")).thenReturn(Optional.empty());
        tracker.evaluate("0xA", new BigDecimal("1000"), new BigDecimal("1200"));

        Result<BorrowerDetail> r = service.getBorrowerDetail("0xA");

        assertThat(r.isOk()).isTrue();
        BorrowerDetail d = r.get();
        assertThat(d.state()).isEqualTo(HealthState.AT_RISK);
        assertThat(d.trackedState()).isEqualTo(HealthState.AT_RISK);
        assertThat(d.ratio()).isEqualTo(1.2);
        assertThat(d.protectionStatus().active()).isTrue();
        assertThat(d.protectionStatus().details().remainingUses()).isEqualTo(1);
        assertThat(d.liquidationHistory()).containsExactly(past);
        assertThat(d.activeAuction()).isNull();
    }

    @Test
    void auxiliaryLookupsDegradeInsteadOfFailing() {
        when(config.protectionEnabled()).thenReturn(true);
        when(ledger.getDebt("0xA")).thenReturn(new BigDecimal("1000"));
        when(ledger.getCollateral("0xA")).thenReturn(new BigDecimal("1500"));
        when(ledger.getProtectionDetails("0xA")).thenThrow(new LedgerException("down"));
        when(ledger.getLiquidationHistory("0xA")).thenThrow(new LedgerException("down"));
        when(orchestrator.activeAuctionFor("0xA")).thenReturn(Optional.empty());

        Result<BorrowerDetail> r = service.getBorrowerDetail("0xA");

        assertThat(r.isOk()).isTrue();
        assertThat(r.get().protectionStatus()).isNull();
        assertThat(r.get().liquidationHistory()).isEmpty();
        assertThat(r.get().trackedState()).isNull();
    }

    @Test
    void ledgerOutageFailsDetailWithErrorCode() {
        when(ledger.getDebt("0xA")).thenThrow(new LedgerException(LedgerException.CIRCUIT_OPEN, "circuit open", null));

        Result<BorrowerDetail> r = service.getBorrowerDetail("0xA");

        assertThat(r.isFailure()).isTrue();
        assertThat(r.getErrorCode()).isEqualTo(LedgerException.CIRCUIT_OPEN);
    }

    @Test
    void blankAddressIsRejected() {
        Result<BorrowerDetail> r = service.getBorrowerDetail(" ");

        assertThat(r.isFailure()).isTrue();
        assertThat(r.getErrorCode()).isEqualTo("ERR-VAL-001");
        verifyNoInteractions(ledger);
    }

    @Test
    void autoStartHonoursConfiguration() {
        when(config.isAutoStart()).thenReturn(false);
        service.autoStart();
        verify(monitor, never()).start();

        when(config.isAutoStart()).thenReturn(true);
        when(monitor.start()).thenReturn(Result.ok());
        service.autoStart();
        verify(monitor).start();
    }
}
