package com.intellilend.liquidation.service.liquidation;

import com.intellilend.liquidation.config.LiquidationConfig;
import com.intellilend.liquidation.dto.TxResult;
import com.intellilend.liquidation.enums.AuditEventKind;
import com.intellilend.liquidation.enums.HealthState;
import com.intellilend.liquidation.enums.RemediationType;
import com.intellilend.liquidation.model.ProtectionAttempt;
import com.intellilend.liquidation.service.ledger.LedgerGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Activates the borrower's flash-loan protection grant, if they hold one.
 */
@Slf4j
@Order(1)
@Component
@RequiredArgsConstructor
public class ProtectionStage implements RemediationStage {

    private final LedgerGateway ledger;
    private final LiquidationConfig config;
    private final Clock clock;

    @Override
    public RemediationType type() {
        return RemediationType.PROTECTION;
    }

    @Override
    public boolean isEnabled() {
        return config.protectionEnabled();
    }

    @Override
    public boolean isDestructive() {
        return false;
    }

    @Override
    public HealthState resultingState() {
        return HealthState.PROTECTED;
    }

    @Override
    public AuditEventKind successEvent() {
        return AuditEventKind.PROTECTION_USED;
    }

    @Override
    public StageOutcome attempt(RemediationContext ctx) {
        boolean active;
        try {
            active = ledger.hasActiveProtection(ctx.borrower());
        } catch (RuntimeException e) {
            log.warn("Protection lookup failed for {}, treating as unprotected: {}", ctx.borrower(), e.getMessage());
            return StageOutcome.skipped("protection lookup failed: " + e.getMessage());
        }
        if (!active) {
            return StageOutcome.skipped("no active protection");
        }

        Instant now = Instant.now(clock);
        try {
            TxResult tx = ledger.activateProtection(ctx.borrower());
            ProtectionAttempt attempt = new ProtectionAttempt(ctx.borrower(), ctx.debt(), tx.success(),
                    tx.transactionHash(), tx.error(), now);
            StageOutcome out = tx.success()
                    ? StageOutcome.succeeded(tx.transactionHash())
                    : StageOutcome.failed(tx.error());
            return out.withProtectionAttempt(attempt);
        } catch (RuntimeException e) {
            ProtectionAttempt attempt = new ProtectionAttempt(ctx.borrower(), ctx.debt(), false, null, e.getMessage(), now);
            return StageOutcome.failed(e.getMessage()).withProtectionAttempt(attempt);
        }
    }
}
