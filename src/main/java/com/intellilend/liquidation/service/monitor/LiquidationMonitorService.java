package com.intellilend.liquidation.service.monitor;

import com.intellilend.liquidation.common.Result;
import com.intellilend.liquidation.common.exception.ValidationException;
import com.intellilend.liquidation.config.LiquidationConfig;
import com.intellilend.liquidation.dto.BorrowerDetail;
import com.intellilend.liquidation.dto.HealthClassification;
import com.intellilend.liquidation.dto.LiquidationHistoryEntry;
import com.intellilend.liquidation.dto.ProtectionDetails;
import com.intellilend.liquidation.dto.ProtectionStatus;
import com.intellilend.liquidation.dto.StatusSnapshot;
import com.intellilend.liquidation.dto.SweepResult;
import com.intellilend.liquidation.dto.Thresholds;
import com.intellilend.liquidation.enums.HealthState;
import com.intellilend.liquidation.model.BorrowerRecord;
import com.intellilend.liquidation.service.health.HealthEvaluator;
import com.intellilend.liquidation.service.ledger.LedgerGateway;
import com.intellilend.liquidation.service.liquidation.LiquidationOrchestrator;
import com.intellilend.liquidation.service.tracker.BorrowerStateTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Read and control surface of the engine: status snapshot, borrower detail and lifecycle.
 * Every operation answers with a {@link Result}; nothing here throws to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LiquidationMonitorService {

    private final MonitorScheduler monitor;
    private final BorrowerStateTracker tracker;
    private final LiquidationOrchestrator orchestrator;
    private final HealthEvaluator evaluator;
    private final LedgerGateway ledger;
    private final LiquidationConfig config;

    @EventListener(ApplicationReadyEvent.class)
    public void autoStart() {
        if (!config.isAutoStart()) {
            log.info("Monitor auto-start disabled; waiting for POST /api/liquidation/start");
            return;
        }
        monitor.start().ifFailure(err -> log.error("Monitor auto-start failed: {}", err));
    }

    public Result<Void> start() {
        return monitor.start();
    }

    public Result<Void> stop() {
        return monitor.stop();
    }

    public Result<SweepResult> sweep() {
        try {
            return Result.ok(monitor.sweep());
        } catch (RuntimeException e) {
            log.error("Manual sweep failed", e);
            return Result.fail(e);
        }
    }

    public Result<StatusSnapshot> getStatus() {
        try {
            return Result.ok(new StatusSnapshot(
                    monitor.isRunning(),
                    tracker.snapshot(HealthState.AT_RISK),
                    tracker.pending(),
                    orchestrator.activeAuctions(),
                    config.thresholds(),
                    monitor.getLastSweep(),
                    monitor.getLastChecked()));
        } catch (RuntimeException e) {
            log.error("Status snapshot failed", e);
            return Result.fail(e);
        }
    }

    public Result<BorrowerDetail> getBorrowerDetail(String address) {
        if (address == null || address.isBlank()) {
            return Result.fail(new ValidationException("borrower address is required"));
        }
        try {
            BigDecimal debt = ledger.getDebt(address);
            BigDecimal collateral = ledger.getCollateral(address);
            Thresholds thresholds = config.thresholds();
            HealthClassification c = evaluator.classify(debt, collateral, thresholds);
            HealthState tracked = tracker.find(address).map(BorrowerRecord::getHealthState).orElse(null);

            return Result.ok(new BorrowerDetail(
                    address,
                    debt,
                    collateral,
                    c.ratio(),
                    c.state(),
                    tracked,
                    thresholds,
                    protectionStatus(address),
                    orchestrator.activeAuctionFor(address).orElse(null),
                    history(address)));
        } catch (RuntimeException e) {
            log.warn("Borrower detail for {} failed: {}", address, e.getMessage());
            return Result.fail(e);
        }
    }

    private ProtectionStatus protectionStatus(String address) {
        if (!config.protectionEnabled()) return null;
        try {
            Optional<ProtectionDetails> details = ledger.getProtectionDetails(address);
            return new ProtectionStatus(details.isPresent(), details.orElse(null));
        } catch (RuntimeException e) {
            log.warn("Protection lookup for {} failed: {}", address, e.getMessage());
            return null;
        }
    }

    private List<LiquidationHistoryEntry> history(String address) {
        try {
            return ledger.getLiquidationHistory(address);
        } catch (RuntimeException e) {
            log.warn("Liquidation history for {} failed: {}", address, e.getMessage());
            return List.of();
        }
    }
}
