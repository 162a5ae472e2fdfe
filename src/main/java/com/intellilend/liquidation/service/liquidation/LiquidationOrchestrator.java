package com.intellilend.liquidation.service.liquidation;

import com.intellilend.liquidation.config.LiquidationConfig;
import com.intellilend.liquidation.dto.LedgerEvent;
import com.intellilend.liquidation.dto.RemediationResult;
import com.intellilend.liquidation.enums.AuctionStatus;
import com.intellilend.liquidation.enums.AuditEventKind;
import com.intellilend.liquidation.enums.RemediationType;
import com.intellilend.liquidation.model.AuctionRecord;
import com.intellilend.liquidation.model.ProtectionAttempt;
import com.intellilend.liquidation.service.audit.AuditRecorder;
import com.intellilend.liquidation.service.tracker.BorrowerStateTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs the remediation fallback chain for a borrower that just became Liquidatable:
 * protection, then Dutch auction, then direct liquidation. The first stage that succeeds
 * ends the cycle; a failed stage falls through to the next one without an inline retry.
 * <p>
 * Also owns the auction book: externally observed auction starts and settlements update it,
 * and settled auctions are evicted after a grace window.
 */
@Slf4j
@Service
public class LiquidationOrchestrator {

    private final List<RemediationStage> stages;
    private final BorrowerStateTracker tracker;
    private final AuditRecorder audit;
    private final AuctionBook auctions;
    private final LiquidationConfig config;
    private final Executor remediationExecutor;
    private final Clock clock;

    public LiquidationOrchestrator(List<RemediationStage> stages,
                                   BorrowerStateTracker tracker,
                                   AuditRecorder audit,
                                   AuctionBook auctions,
                                   LiquidationConfig config,
                                   @Qualifier("remediationExecutor") Executor remediationExecutor,
                                   Clock clock) {
        List<RemediationStage> ordered = new ArrayList<>(stages);
        ordered.sort(Comparator.comparingInt(s -> s.type().ordinal()));
        this.stages = List.copyOf(ordered);
        this.tracker = tracker;
        this.audit = audit;
        this.auctions = auctions;
        this.config = config;
        this.remediationExecutor = remediationExecutor;
        this.clock = clock;
    }

    /**
     * Hands the borrower to a remediation worker. The borrower must already be marked in flight.
     */
    public CompletableFuture<RemediationResult> remediateAsync(String borrower, BigDecimal debt,
                                                               BigDecimal collateral, double ratio) {
        try {
            return CompletableFuture.supplyAsync(() -> remediate(borrower, debt, collateral, ratio), remediationExecutor);
        } catch (RejectedExecutionException e) {
            log.error("Remediation queue full, dropping {} until next evaluation", borrower);
            tracker.failRemediation(borrower);
            return CompletableFuture.failedFuture(e);
        }
    }

    public RemediationResult remediate(String borrower, BigDecimal debt, BigDecimal collateral, double ratio) {
        RemediationContext ctx = new RemediationContext(borrower, debt, collateral, ratio);
        List<String> attempted = new ArrayList<>();
        ProtectionAttempt protection = null;
        RemediationType lastType = RemediationType.NONE;
        String lastError = null;
        boolean initiated = false;
        boolean settled = false;

        log.info("Remediating {} (debt={}, collateral={}, ratio={})", borrower, debt, collateral, ratio);
        try {
            for (RemediationStage stage : stages) {
                if (!stage.isEnabled()) continue;

                if (stage.isDestructive() && !initiated) {
                    audit.record(AuditEventKind.LIQUIDATION_INITIATED, borrower, initiatedPayload(ctx));
                    initiated = true;
                }

                StageOutcome out;
                try {
                    out = stage.attempt(ctx);
                } catch (RuntimeException e) {
                    out = StageOutcome.failed(e.getMessage() == null ? e.toString() : e.getMessage());
                }
                if (out.protectionAttempt() != null) protection = out.protectionAttempt();
                if (out.skipped()) {
                    log.debug("Stage {} skipped for {}: {}", stage.type(), borrower, out.error());
                    continue;
                }

                attempted.add(stage.type().name());
                lastType = stage.type();

                if (out.success()) {
                    onStageSuccess(stage, ctx, out);
                    settled = true;
                    return new RemediationResult(borrower, stage.type(), true, out.transactionHash(),
                            out.auction() == null ? null : out.auction().getAuctionId(), null,
                            List.copyOf(attempted), protection);
                }

                lastError = out.error();
                log.warn("Stage {} failed for {}: {}", stage.type(), borrower, lastError);
                if (stage.type() == RemediationType.PROTECTION) {
                    audit.record(AuditEventKind.PROTECTION_FAILED, borrower, failurePayload(borrower, lastError));
                }
            }

            Map<String, Object> p = failurePayload(borrower, lastError);
            p.put("attemptedStages", List.copyOf(attempted));
            audit.record(AuditEventKind.LIQUIDATION_FAILED, borrower, p);
            tracker.failRemediation(borrower);
            settled = true;
            return new RemediationResult(borrower, lastType, false, null, null, lastError, List.copyOf(attempted), protection);
        } finally {
            if (!settled) {
                // unexpected exception: release the borrower so the next evaluation can retry
                tracker.failRemediation(borrower);
            }
        }
    }

    private void onStageSuccess(RemediationStage stage, RemediationContext ctx, StageOutcome out) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("borrower", ctx.borrower());
        p.put("stage", stage.type().name());
        p.put("transactionHash", out.transactionHash());
        p.put("debt", ctx.debt());
        p.put("collateral", ctx.collateral());

        AuctionRecord auction = out.auction();
        if (auction != null) {
            auctions.track(auction);
            p.put("auctionId", auction.getAuctionId());
            p.put("startPrice", auction.getStartPrice());
            p.put("reservePrice", auction.getReservePrice());
            p.put("duration", auction.getDurationSec());
        }

        tracker.completeRemediation(ctx.borrower(), stage.resultingState());
        audit.record(stage.successEvent(), ctx.borrower(), p);
        log.info("Borrower {} remediated by {} (tx={})", ctx.borrower(), stage.type(), out.transactionHash());
    }

    // ---------- auction lifecycle ----------

    /**
     * Tracks an auction started outside this engine so it shows up as active.
     */
    public void onAuctionStarted(LedgerEvent event) {
        if (event.getAuctionId() == null || auctions.contains(event.getAuctionId())) return;
        AuctionRecord record = AuctionRecord.builder()
                .auctionId(event.getAuctionId())
                .borrower(event.getBorrower())
                .collateralAmount(event.getAmount())
                .status(AuctionStatus.ACTIVE)
                .transactionHash(event.getTransactionHash())
                .startedAt(event.getTimestamp() != null ? event.getTimestamp() : Instant.now(clock))
                .build();
        auctions.track(record);
        log.info("Tracking external auction {} for {}", event.getAuctionId(), event.getBorrower());
    }

    /**
     * Settles the matching auction, records {@code AUCTION_ENDED} and schedules the record for eviction.
     */
    public Optional<AuctionRecord> onAuctionEnded(LedgerEvent event) {
        if (event.getAuctionId() == null) {
            log.warn("AuctionEnded without auction id for {}", event.getBorrower());
            return Optional.empty();
        }
        Instant now = Instant.now(clock);
        Instant endedAt = event.getTimestamp() != null ? event.getTimestamp() : now;
        Instant evictAfter = now.plus(Duration.ofMillis(config.getAuctionGraceMs()));

        Optional<AuctionRecord> settled = auctions.settle(event.getAuctionId(), event.getWinner(),
                event.getFinalPrice(), endedAt, evictAfter);
        if (settled.isEmpty()) {
            log.info("AuctionEnded for unknown or already settled auction {}", event.getAuctionId());
            return Optional.empty();
        }

        AuctionRecord r = settled.get();
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("borrower", r.getBorrower());
        p.put("auctionId", r.getAuctionId());
        p.put("winner", r.getWinner());
        p.put("finalPrice", r.getFinalPrice());
        p.put("transactionHash", event.getTransactionHash());
        audit.record(AuditEventKind.AUCTION_ENDED, r.getBorrower(), p);

        if (r.getBorrower() != null) tracker.releaseAuctionHold(r.getBorrower());
        log.info("Auction {} settled (winner={}, price={})", r.getAuctionId(), r.getWinner(), r.getFinalPrice());
        return settled;
    }

    public int evictSettledAuctions() {
        int n = auctions.evictExpired(Instant.now(clock));
        if (n > 0) log.info("Evicted {} settled auction(s)", n);
        return n;
    }

    public List<AuctionRecord> activeAuctions() {
        return auctions.active();
    }

    public Optional<AuctionRecord> activeAuctionFor(String borrower) {
        return auctions.findActiveFor(borrower);
    }

    private static Map<String, Object> initiatedPayload(RemediationContext ctx) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("borrower", ctx.borrower());
        p.put("debt", ctx.debt());
        p.put("collateral", ctx.collateral());
        p.put("ratio", ctx.ratio());
        return p;
    }

    private static Map<String, Object> failurePayload(String borrower, String error) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("borrower", borrower);
        p.put("error", error == null ? "unknown" : error);
        return p;
    }
}
