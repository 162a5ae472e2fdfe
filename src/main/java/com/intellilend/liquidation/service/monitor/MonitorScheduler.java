package com.intellilend.liquidation.service.monitor;

import com.intellilend.liquidation.common.Result;
import com.intellilend.liquidation.config.LiquidationConfig;
import com.intellilend.liquidation.dto.LedgerEvent;
import com.intellilend.liquidation.dto.SweepResult;
import com.intellilend.liquidation.dto.TransitionResult;
import com.intellilend.liquidation.enums.AuditEventKind;
import com.intellilend.liquidation.model.AuctionRecord;
import com.intellilend.liquidation.service.audit.AuditRecorder;
import com.intellilend.liquidation.service.ledger.LedgerEventSource;
import com.intellilend.liquidation.service.ledger.LedgerGateway;
import com.intellilend.liquidation.service.ledger.LedgerSubscription;
import com.intellilend.liquidation.service.liquidation.LiquidationOrchestrator;
import com.intellilend.liquidation.service.tracker.BorrowerStateTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives evaluation from two sources: a full sweep every {@code checkIntervalMs} and targeted
 * re-evaluation on ledger events. Stopped -> Running on {@link #start()}, back on {@link #stop()};
 * both are idempotent. Stopping never interrupts remediation already handed to a worker.
 */
@Slf4j
@Service
public class MonitorScheduler {

    private final LedgerGateway ledger;
    private final LedgerEventSource events;
    private final BorrowerStateTracker tracker;
    private final LiquidationOrchestrator orchestrator;
    private final AuditRecorder audit;
    private final TaskScheduler scheduler;
    private final LiquidationConfig config;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final ReentrantLock lifecycle = new ReentrantLock();
    private final ReentrantLock sweepLock = new ReentrantLock();
    private final AtomicReference<SweepResult> lastSweep = new AtomicReference<>();
    private final AtomicReference<Instant> lastChecked = new AtomicReference<>();

    private ScheduledFuture<?> sweepTask;
    private LedgerSubscription subscription;

    public MonitorScheduler(LedgerGateway ledger,
                            LedgerEventSource events,
                            BorrowerStateTracker tracker,
                            LiquidationOrchestrator orchestrator,
                            AuditRecorder audit,
                            TaskScheduler scheduler,
                            LiquidationConfig config,
                            Clock clock) {
        this.ledger = ledger;
        this.events = events;
        this.tracker = tracker;
        this.orchestrator = orchestrator;
        this.audit = audit;
        this.scheduler = scheduler;
        this.config = config;
        this.clock = clock;
    }

    // ---------- lifecycle ----------

    public Result<Void> start() {
        lifecycle.lock();
        try {
            if (running.get()) {
                log.debug("Monitor already running");
                return Result.ok();
            }
            subscription = events.subscribe(this::onLedgerEvent);
            running.set(true);

            SweepResult first = sweep();
            log.info("Monitor started: initial sweep {} borrowers ({} errors)", first.total(), first.errors());

            Duration interval = Duration.ofMillis(config.getCheckIntervalMs());
            sweepTask = scheduler.scheduleAtFixedRate(this::scheduledSweep, Instant.now(clock).plus(interval), interval);
            return Result.ok();
        } catch (RuntimeException e) {
            log.error("Monitor start failed", e);
            detach();
            running.set(false);
            return Result.fail(e);
        } finally {
            lifecycle.unlock();
        }
    }

    public Result<Void> stop() {
        lifecycle.lock();
        try {
            if (!running.getAndSet(false)) {
                return Result.ok();
            }
            detach();
            log.info("Monitor stopped");
            return Result.ok();
        } finally {
            lifecycle.unlock();
        }
    }

    @PreDestroy
    void shutdown() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    private void detach() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
            sweepTask = null;
        }
        if (subscription != null) {
            subscription.close();
            subscription = null;
        }
    }

    // ---------- sweep ----------

    private void scheduledSweep() {
        if (!running.get()) return;
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Scheduled sweep failed", e);
        }
    }

    /**
     * Evaluates every known borrower once. A sweep already in progress makes this call a no-op
     * that returns the previous summary.
     */
    public SweepResult sweep() {
        if (!sweepLock.tryLock()) {
            log.info("Sweep already in progress, skipping");
            SweepResult prev = lastSweep.get();
            return prev != null ? prev : new SweepResult(0, 0, 0, 0, 0, 0, 0, Instant.now(clock), 0);
        }
        try {
            Instant started = Instant.now(clock);
            long t0 = System.nanoTime();

            Set<String> borrowers = new LinkedHashSet<>();
            int errors = 0;
            try {
                borrowers.addAll(ledger.listActiveBorrowers());
            } catch (RuntimeException e) {
                log.warn("Could not list active borrowers, sweeping tracked borrowers only: {}", e.getMessage());
                errors++;
            }
            borrowers.addAll(tracker.knownBorrowers());

            int healthy = 0, atRisk = 0, liquidatable = 0, protectedCount = 0, inAuction = 0;
            for (String b : borrowers) {
                try {
                    TransitionResult r = evaluateBorrower(b);
                    switch (r.newState()) {
                        case HEALTHY -> healthy++;
                        case AT_RISK -> atRisk++;
                        case LIQUIDATABLE -> liquidatable++;
                        case PROTECTED -> protectedCount++;
                        case IN_AUCTION -> inAuction++;
                    }
                } catch (RuntimeException e) {
                    errors++;
                    log.warn("Evaluation of {} failed: {}", b, e.getMessage());
                }
            }

            long ms = Duration.ofNanos(System.nanoTime() - t0).toMillis();
            SweepResult res = new SweepResult(borrowers.size(), healthy, atRisk, liquidatable, protectedCount,
                    inAuction, errors, started, ms);
            lastSweep.set(res);
            lastChecked.set(Instant.now(clock));
            log.info("Sweep done in {}ms: total={} healthy={} atRisk={} liquidatable={} protected={} inAuction={} errors={}",
                    ms, res.total(), healthy, atRisk, liquidatable, protectedCount, inAuction, errors);
            return res;
        } finally {
            sweepLock.unlock();
        }
    }

    /**
     * Fetches the borrower's position, runs it through the tracker and dispatches remediation when required.
     */
    public TransitionResult evaluateBorrower(String borrower) {
        BigDecimal debt = ledger.getDebt(borrower);
        BigDecimal collateral = ledger.getCollateral(borrower);
        TransitionResult r = tracker.evaluate(borrower, debt, collateral);
        if (r.remediationRequired()) {
            orchestrator.remediateAsync(borrower, debt, collateral, r.ratio());
        }
        return r;
    }

    // ---------- ledger events ----------

    void onLedgerEvent(LedgerEvent event) {
        String borrower = event.getBorrower();
        try {
            switch (event.getType()) {
                case BORROW, REPAY, COLLATERAL_ADDED, COLLATERAL_REMOVED -> evaluateBorrower(borrower);
                case AUCTION_STARTED -> orchestrator.onAuctionStarted(event);
                case AUCTION_ENDED -> orchestrator.onAuctionEnded(event)
                        .map(AuctionRecord::getBorrower)
                        .or(() -> Optional.ofNullable(borrower))
                        .ifPresent(this::evaluateBorrower);
                case PROTECTION_ACTIVATED -> {
                    Map<String, Object> p = new LinkedHashMap<>();
                    p.put("borrower", borrower);
                    p.put("protectionId", event.getProtectionId());
                    p.put("amount", event.getAmount());
                    p.put("transactionHash", event.getTransactionHash());
                    audit.record(AuditEventKind.PROTECTION_ACTIVATED, borrower, p);
                }
            }
        } catch (RuntimeException e) {
            log.warn("Handling {} for {} failed: {}", event.getType(), borrower, e.getMessage());
        }
    }

    public SweepResult getLastSweep() {
        return lastSweep.get();
    }

    public Instant getLastChecked() {
        return lastChecked.get();
    }
}
