package com.intellilend.liquidation.service.liquidation;

import com.intellilend.liquidation.dto.TxResult;
import com.intellilend.liquidation.enums.AuditEventKind;
import com.intellilend.liquidation.enums.HealthState;
import com.intellilend.liquidation.enums.RemediationType;
import com.intellilend.liquidation.service.ledger.LedgerGateway;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Last resort: liquidate the full position through the lending pool.
 */
@Order(3)
@Component
@RequiredArgsConstructor
public class DirectLiquidationStage implements RemediationStage {

    private final LedgerGateway ledger;

    @Override
    public RemediationType type() {
        return RemediationType.DIRECT;
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public boolean isDestructive() {
        return true;
    }

    @Override
    public HealthState resultingState() {
        return HealthState.HEALTHY;
    }

    @Override
    public AuditEventKind successEvent() {
        return AuditEventKind.LIQUIDATION_COMPLETED;
    }

    @Override
    public StageOutcome attempt(RemediationContext ctx) {
        TxResult tx = ledger.liquidate(ctx.borrower());
        if (tx == null) return StageOutcome.failed("no transaction result");
        return tx.success() ? StageOutcome.succeeded(tx.transactionHash()) : StageOutcome.failed(tx.error());
    }
}
