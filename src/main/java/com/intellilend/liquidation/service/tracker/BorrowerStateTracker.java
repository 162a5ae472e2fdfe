package com.intellilend.liquidation.service.tracker;

import com.intellilend.liquidation.common.exception.ValidationException;
import com.intellilend.liquidation.config.LiquidationConfig;
import com.intellilend.liquidation.dto.HealthClassification;
import com.intellilend.liquidation.dto.Thresholds;
import com.intellilend.liquidation.dto.TransitionResult;
import com.intellilend.liquidation.enums.AuditEventKind;
import com.intellilend.liquidation.enums.HealthState;
import com.intellilend.liquidation.model.BorrowerRecord;
import com.intellilend.liquidation.service.audit.AuditRecorder;
import com.intellilend.liquidation.service.health.HealthEvaluator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Owns every {@link BorrowerRecord} and the in-flight remediation set.
 *
 * Contracts:
 *  - All mutation for one borrower is serialized on that borrower's lock stripe.
 *  - A borrower in flight stays Liquidatable until the orchestrator reports back,
 *    so it can never be AtRisk and in flight at once.
 *  - remediationRequired is raised at most once per in-flight period; after a failed
 *    attempt the next evaluation that still finds the borrower Liquidatable raises it again.
 *  - Callers only ever see copies of records.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BorrowerStateTracker {

    private final HealthEvaluator evaluator;
    private final LiquidationConfig config;
    private final AuditRecorder audit;
    private final Clock clock;

    private static final int LOCK_STRIPES = 64;

    private final Map<String, BorrowerRecord> records = new ConcurrentHashMap<>();
    private final ReentrantLock[] locks = newStripes();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public TransitionResult evaluate(String borrower, BigDecimal debt, BigDecimal collateral) {
        if (borrower == null || borrower.isBlank()) {
            throw new ValidationException("borrower address is blank");
        }
        Thresholds thresholds = config.thresholds();
        HealthClassification c = evaluator.classify(debt, collateral, thresholds);

        List<Runnable> audits = new ArrayList<>(2);
        TransitionResult result;
        ReentrantLock lock = lockFor(borrower);
        lock.lock();
        try {
            result = apply(borrower, debt, collateral, c, thresholds, audits);
        } finally {
            lock.unlock();
        }
        audits.forEach(Runnable::run);

        if (result.changed()) {
            log.info("Borrower {} {} -> {} (ratio={})", borrower, result.previousState(), result.newState(), fmt(result.ratio()));
        }
        return result;
    }

    private TransitionResult apply(String borrower,
                                   BigDecimal debt,
                                   BigDecimal collateral,
                                   HealthClassification c,
                                   Thresholds thresholds,
                                   List<Runnable> audits) {
        Instant now = Instant.now(clock);
        BorrowerRecord cur = records.get(borrower);
        HealthState prev = cur == null ? HealthState.HEALTHY : cur.getHealthState();
        boolean busy = inFlight.contains(borrower);

        // fully repaid: nothing left to monitor
        if (debt.signum() == 0 && !busy && !(cur != null && cur.isHeld() && prev == HealthState.IN_AUCTION)) {
            records.remove(borrower);
            queueTransitionAudits(borrower, prev, HealthState.HEALTHY, c.ratio(), thresholds, audits);
            return new TransitionResult(borrower, prev, HealthState.HEALTHY, c.ratio(), prev != HealthState.HEALTHY, false);
        }

        boolean held = cur != null && cur.isHeld();
        HealthState next;
        if (busy) {
            next = prev;
        } else if (held && prev == HealthState.IN_AUCTION) {
            next = prev;
        } else if (held && prev == HealthState.PROTECTED && sameInputs(cur, debt, collateral)) {
            next = prev;
        } else {
            held = false;
            next = c.state();
        }

        boolean changed = next != prev;
        BorrowerRecord updated = (cur == null ? BorrowerRecord.builder().address(borrower).stateEnteredAt(now) : cur.toBuilder())
                .debtValue(debt)
                .collateralValue(collateral)
                .collateralRatio(c.ratio())
                .healthState(next)
                .held(held)
                .lastEvaluated(now)
                .build();
        if (changed) updated.setStateEnteredAt(now);
        records.put(borrower, updated);

        boolean remediationRequired = next == HealthState.LIQUIDATABLE && !busy && inFlight.add(borrower);
        if (changed) {
            queueTransitionAudits(borrower, prev, next, c.ratio(), thresholds, audits);
        }
        return new TransitionResult(borrower, prev, next, c.ratio(), changed, remediationRequired);
    }

    private void queueTransitionAudits(String borrower,
                                       HealthState prev,
                                       HealthState next,
                                       double ratio,
                                       Thresholds thresholds,
                                       List<Runnable> audits) {
        if (prev == HealthState.LIQUIDATABLE && next != HealthState.LIQUIDATABLE) {
            Map<String, Object> p = new LinkedHashMap<>();
            p.put("borrower", borrower);
            p.put("ratio", ratio);
            p.put("newState", next.name());
            audits.add(() -> audit.record(AuditEventKind.LIQUIDATION_CANCELLED, borrower, p));
        }
        if (next == HealthState.AT_RISK && prev != HealthState.AT_RISK) {
            Map<String, Object> p = new LinkedHashMap<>();
            p.put("borrower", borrower);
            p.put("ratio", ratio);
            p.put("liquidationThreshold", thresholds.liquidationThreshold());
            p.put("warningThreshold", thresholds.warningThreshold());
            p.put("message", "Collateral ratio " + fmt(ratio) + " is below the warning threshold "
                    + thresholds.warningThreshold().toPlainString()
                    + "; add collateral or repay debt to avoid liquidation at "
                    + thresholds.liquidationThreshold().toPlainString());
            audits.add(() -> audit.record(AuditEventKind.RISK_WARNING, borrower, p));
        }
        if (prev == HealthState.AT_RISK && next == HealthState.HEALTHY) {
            Map<String, Object> p = new LinkedHashMap<>();
            p.put("borrower", borrower);
            p.put("ratio", ratio);
            audits.add(() -> audit.record(AuditEventKind.HEALTH_RESTORED, borrower, p));
        }
    }

    /**
     * Orchestrator callback: the chain succeeded and left the borrower in {@code outcome}
     * (Protected, InAuction, or Healthy after direct liquidation).
     */
    public void completeRemediation(String borrower, HealthState outcome) {
        ReentrantLock lock = lockFor(borrower);
        lock.lock();
        try {
            Instant now = Instant.now(clock);
            BorrowerRecord cur = records.get(borrower);
            BorrowerRecord.BorrowerRecordBuilder b = cur == null
                    ? BorrowerRecord.builder().address(borrower)
                    : cur.toBuilder();
            records.put(borrower, b.healthState(outcome)
                    .held(outcome.isRemediated())
                    .stateEnteredAt(now)
                    .lastEvaluated(now)
                    .build());
            inFlight.remove(borrower);
        } finally {
            lock.unlock();
        }
        log.info("Borrower {} remediated -> {}", borrower, outcome);
    }

    /**
     * Orchestrator callback: every stage failed. The borrower stays Liquidatable and becomes
     * eligible for a fresh attempt on its next evaluation.
     */
    public void failRemediation(String borrower) {
        ReentrantLock lock = lockFor(borrower);
        lock.lock();
        try {
            inFlight.remove(borrower);
        } finally {
            lock.unlock();
        }
        log.warn("Borrower {} remediation failed; will retry on next evaluation", borrower);
    }

    /**
     * The borrower's auction settled; classification owns its state again from the next evaluation.
     */
    public void releaseAuctionHold(String borrower) {
        ReentrantLock lock = lockFor(borrower);
        lock.lock();
        try {
            BorrowerRecord cur = records.get(borrower);
            if (cur != null && cur.getHealthState() == HealthState.IN_AUCTION) {
                cur.setHeld(false);
            }
        } finally {
            lock.unlock();
        }
    }

    public Optional<BorrowerRecord> find(String borrower) {
        BorrowerRecord r = records.get(borrower);
        return r == null ? Optional.empty() : Optional.of(view(r));
    }

    public List<BorrowerRecord> snapshot(HealthState state) {
        return records.values().stream()
                .filter(r -> r.getHealthState() == state)
                .map(this::view)
                .sorted(Comparator.comparingDouble(BorrowerRecord::getCollateralRatio))
                .collect(Collectors.toList());
    }

    /**
     * Liquidatable borrowers awaiting resolution, whether a remediation attempt is running
     * ({@code remediating}) or the last one failed and the next evaluation will retry.
     */
    public List<BorrowerRecord> pending() {
        return records.values().stream()
                .filter(r -> r.getHealthState() == HealthState.LIQUIDATABLE || inFlight.contains(r.getAddress()))
                .map(this::view)
                .sorted(Comparator.comparing(BorrowerRecord::getAddress))
                .collect(Collectors.toList());
    }

    public Set<String> knownBorrowers() {
        return new TreeSet<>(records.keySet());
    }

    public boolean isInFlight(String borrower) {
        return inFlight.contains(borrower);
    }

    private BorrowerRecord view(BorrowerRecord r) {
        BorrowerRecord copy = r.copy();
        copy.setRemediating(inFlight.contains(r.getAddress()));
        return copy;
    }

    private ReentrantLock lockFor(String borrower) {
        return locks[Math.floorMod(borrower.hashCode(), LOCK_STRIPES)];
    }

    private static ReentrantLock[] newStripes() {
        ReentrantLock[] stripes = new ReentrantLock[LOCK_STRIPES];
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new ReentrantLock();
        }
        return stripes;
    }

    private static boolean sameInputs(BorrowerRecord r, BigDecimal debt, BigDecimal collateral) {
        return r.getDebtValue() != null && r.getCollateralValue() != null
                && r.getDebtValue().compareTo(debt) == 0
                && r.getCollateralValue().compareTo(collateral) == 0;
    }

    private static String fmt(double ratio) {
        return Double.isInfinite(ratio) ? "inf" : String.format(Locale.ROOT, "%.4f", ratio);
    }
}
