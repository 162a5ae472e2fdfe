package com.intellilend.liquidation.test.service;

import com.intellilend.liquidation.common.Result;
import com.intellilend.liquidation.common.exception.LedgerException;
import com.intellilend.liquidation.config.LiquidationConfig;
import com.intellilend.liquidation.dto.LedgerEvent;
import com.intellilend.liquidation.dto.SweepResult;
import com.intellilend.liquidation.dto.Thresholds;
import com.intellilend.liquidation.enums.AuctionStatus;
import com.intellilend.liquidation.enums.AuditEventKind;
import com.intellilend.liquidation.enums.LedgerEventType;
import com.intellilend.liquidation.model.AuctionRecord;
import com.intellilend.liquidation.service.audit.AuditRecorder;
import com.intellilend.liquidation.service.health.HealthEvaluator;
import com.intellilend.liquidation.service.ledger.LedgerEventListener;
import com.intellilend.liquidation.service.ledger.LedgerEventSource;
import com.intellilend.liquidation.service.ledger.LedgerGateway;
import com.intellilend.liquidation.service.ledger.LedgerSubscription;
import com.intellilend.liquidation.service.liquidation.LiquidationOrchestrator;
import com.intellilend.liquidation.service.monitor.MonitorScheduler;
import com.intellilend.liquidation.service.tracker.BorrowerStateTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MonitorSchedulerTest {

    private static final BigDecimal DEBT = new BigDecimal("1000");
    private static final BigDecimal HEALTHY_COLLATERAL = new BigDecimal("1300");

    @Mock
    LedgerGateway ledger;
    @Mock
    LedgerEventSource events;
    @Mock
    LedgerSubscription subscription;
    @Mock
    LiquidationOrchestrator orchestrator;
    @Mock
    AuditRecorder audit;
    @Mock
    TaskScheduler scheduler;
    @Mock
    ScheduledFuture<?> future;
    @Mock
    LiquidationConfig config;

    BorrowerStateTracker tracker;
    MonitorScheduler monitor;

    @BeforeEach
    void setUp() {
        lenient().when(config.thresholds())
                .thenReturn(new Thresholds(new BigDecimal("1.10"), new BigDecimal("1.25"), 60_000));
        lenient().when(config.getCheckIntervalMs()).thenReturn(60_000L);

        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
        tracker = new BorrowerStateTracker(new HealthEvaluator(), config, audit, clock);
        monitor = new MonitorScheduler(ledger, events, tracker, orchestrator, audit, scheduler, config, clock);
    }

    private void stubStartCollaborators() {
        when(events.subscribe(any())).thenReturn(subscription);
        doReturn(future).when(scheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
    }

    @Test
    void oneFailingBorrowerDoesNotAbortTheSweep() {
        List<String> borrowers = IntStream.range(0, 50).mapToObj(i -> "0xb" + i).collect(Collectors.toList());
        when(ledger.listActiveBorrowers()).thenReturn(borrowers);
        when(ledger.getDebt(anyString())).thenAnswer(inv -> {
            if ("0xb13".equals(inv.getArgument(0))) throw new LedgerException("rpc timeout");
            return DEBT;
        });
        when(ledger.getCollateral(anyString())).thenReturn(HEALTHY_COLLATERAL);

        SweepResult r = monitor.sweep();

        assertThat(r.total()).isEqualTo(50);
        assertThat(r.errors()).isEqualTo(1);
        assertThat(r.healthy()).isEqualTo(49);
        assertThat(monitor.getLastSweep()).isEqualTo(r);
        assertThat(monitor.getLastChecked()).isNotNull();
        verify(ledger, times(50)).getDebt(anyString());
    }

    @Test
    void sweepCountsStatesAndDispatchesRemediationOnce() {
        when(ledger.listActiveBorrowers()).thenReturn(List.of("0xok", "0xwarn", "0xbad"));
        when(ledger.getDebt(anyString())).thenReturn(DEBT);
        when(ledger.getCollateral("0xok")).thenReturn(HEALTHY_COLLATERAL);
        when(ledger.getCollateral("0xwarn")).thenReturn(new BigDecimal("1200"));
        when(ledger.getCollateral("0xbad")).thenReturn(new BigDecimal("1050"));

        SweepResult first = monitor.sweep();
        SweepResult second = monitor.sweep();

        assertThat(first.healthy()).isEqualTo(1);
        assertThat(first.atRisk()).isEqualTo(1);
        assertThat(first.liquidatable()).isEqualTo(1);
        assertThat(second.liquidatable()).isEqualTo(1);
        verify(orchestrator, times(1)).remediateAsync(eq("0xbad"), eq(DEBT), eq(new BigDecimal("1050")), anyDouble());
    }

    @Test
    void trackedBorrowersAreSweptWhenListingFails() {
        tracker.evaluate("0xknown", DEBT, HEALTHY_COLLATERAL);
        when(ledger.listActiveBorrowers()).thenThrow(new LedgerException("circuit open"));
        when(ledger.getDebt("0xknown")).thenReturn(DEBT);
        when(ledger.getCollateral("0xknown")).thenReturn(HEALTHY_COLLATERAL);

        SweepResult r = monitor.sweep();

        assertThat(r.total()).isEqualTo(1);
        assertThat(r.errors()).isEqualTo(1);
        verify(ledger).getDebt("0xknown");
    }

    @Test
    void startSweepsImmediatelyThenSchedulesAndIsIdempotent() {
        stubStartCollaborators();
        when(ledger.listActiveBorrowers()).thenReturn(List.of());

        Result<Void> first = monitor.start();
        Result<Void> second = monitor.start();

        assertThat(first.isOk()).isTrue();
        assertThat(second.isOk()).isTrue();
        assertThat(monitor.isRunning()).isTrue();

        InOrder order = inOrder(events, ledger, scheduler);
        order.verify(events).subscribe(any());
        order.verify(ledger).listActiveBorrowers();
        order.verify(scheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), eq(Duration.ofMinutes(1)));
        verify(events, times(1)).subscribe(any());
        verify(ledger, times(1)).listActiveBorrowers();
    }

    @Test
    void stopWithoutStartIsHarmless() {
        Result<Void> r = monitor.stop();

        assertThat(r.isOk()).isTrue();
        assertThat(monitor.isRunning()).isFalse();
        verifyNoInteractions(events, scheduler);
    }

    @Test
    void stopCancelsTimerAndDetachesSubscription() {
        stubStartCollaborators();
        when(ledger.listActiveBorrowers()).thenReturn(List.of());
        monitor.start();

        monitor.stop();
        monitor.stop();

        assertThat(monitor.isRunning()).isFalse();
        verify(future, times(1)).cancel(false);
        verify(subscription, times(1)).close();
    }

    @Test
    void ledgerEventsDriveTargetedEvaluation() {
        stubStartCollaborators();
        when(ledger.listActiveBorrowers()).thenReturn(List.of());
        monitor.start();

        ArgumentCaptor<LedgerEventListener> listener = ArgumentCaptor.forClass(LedgerEventListener.class);
        verify(events).subscribe(listener.capture());

        when(ledger.getDebt("0xA")).thenReturn(DEBT);
        when(ledger.getCollateral("0xA")).thenReturn(new BigDecimal("1200"));

        listener.getValue().onEvent(LedgerEvent.builder().type(LedgerEventType.COLLATERAL_REMOVED).borrower("0xA").build());

        verify(ledger).getDebt("0xA");
        assertThat(tracker.find("0xA")).isPresent();

        LedgerEvent ended = LedgerEvent.builder().type(LedgerEventType.AUCTION_ENDED).borrower("0xA").auctionId("5").build();
        listener.getValue().onEvent(ended);
        verify(orchestrator).onAuctionEnded(ended);
        verify(ledger, times(2)).getDebt("0xA");

        LedgerEvent started = LedgerEvent.builder().type(LedgerEventType.AUCTION_STARTED).borrower("0xC").auctionId("6").build();
        listener.getValue().onEvent(started);
        verify(orchestrator).onAuctionStarted(started);

        listener.getValue().onEvent(LedgerEvent.builder().type(LedgerEventType.PROTECTION_ACTIVATED).borrower("0xA").protectionId("p1").build());
        verify(audit).record(eq(AuditEventKind.PROTECTION_ACTIVATED), eq("0xA"), anyMap());
    }

    @Test
    void auctionEndedWithoutBorrowerReevaluatesTheAuctionedBorrower() {
        stubStartCollaborators();
        when(ledger.listActiveBorrowers()).thenReturn(List.of());
        monitor.start();

        ArgumentCaptor<LedgerEventListener> listener = ArgumentCaptor.forClass(LedgerEventListener.class);
        verify(events).subscribe(listener.capture());

        LedgerEvent ended = LedgerEvent.builder().type(LedgerEventType.AUCTION_ENDED)
                .auctionId("9").winner("0xW").finalPrice(new BigDecimal("880")).build();
        AuctionRecord settled = AuctionRecord.builder().auctionId("9").borrower("0xA")
                .status(AuctionStatus.SETTLED).winner("0xW").finalPrice(new BigDecimal("880")).build();
        when(orchestrator.onAuctionEnded(ended)).thenReturn(Optional.of(settled));
        when(ledger.getDebt("0xA")).thenReturn(DEBT);
        when(ledger.getCollateral("0xA")).thenReturn(HEALTHY_COLLATERAL);

        listener.getValue().onEvent(ended);

        verify(orchestrator).onAuctionEnded(ended);
        verify(ledger).getDebt("0xA");
        assertThat(tracker.find("0xA")).isPresent();
    }

    @Test
    void failingEventHandlingIsContained() {
        stubStartCollaborators();
        when(ledger.listActiveBorrowers()).thenReturn(List.of());
        monitor.start();

        ArgumentCaptor<LedgerEventListener> listener = ArgumentCaptor.forClass(LedgerEventListener.class);
        verify(events).subscribe(listener.capture());
        when(ledger.getDebt("0xZ")).thenThrow(new LedgerException("down"));

        listener.getValue().onEvent(LedgerEvent.builder().type(LedgerEventType.BORROW).borrower("0xZ").build());

        assertThat(tracker.find("0xZ")).isEmpty();
        assertThat(monitor.isRunning()).isTrue();
    }
}
