package com.intellilend.liquidation.service.liquidation;

import com.intellilend.liquidation.common.constants.LiquidationConsts;
import com.intellilend.liquidation.config.LiquidationConfig;
import com.intellilend.liquidation.dto.AuctionStartResult;
import com.intellilend.liquidation.enums.AuctionStatus;
import com.intellilend.liquidation.enums.AuditEventKind;
import com.intellilend.liquidation.enums.HealthState;
import com.intellilend.liquidation.enums.RemediationType;
import com.intellilend.liquidation.model.AuctionRecord;
import com.intellilend.liquidation.service.ledger.LedgerGateway;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;

/**
 * Starts a Dutch auction for the borrower's collateral. Prices descend from
 * 1.20x to a 0.70x reserve of the collateral value over the configured duration.
 */
@Order(2)
@Component
@RequiredArgsConstructor
public class AuctionStage implements RemediationStage {

    private final LedgerGateway ledger;
    private final LiquidationConfig config;
    private final Clock clock;

    @Override
    public RemediationType type() {
        return RemediationType.AUCTION;
    }

    @Override
    public boolean isEnabled() {
        return config.auctionEnabled();
    }

    @Override
    public boolean isDestructive() {
        return true;
    }

    @Override
    public HealthState resultingState() {
        return HealthState.IN_AUCTION;
    }

    @Override
    public AuditEventKind successEvent() {
        return AuditEventKind.AUCTION_STARTED;
    }

    @Override
    public StageOutcome attempt(RemediationContext ctx) {
        BigDecimal collateral = ctx.collateral();
        BigDecimal startPrice = collateral.multiply(LiquidationConsts.Auction.START_PRICE_FACTOR);
        BigDecimal reservePrice = collateral.multiply(LiquidationConsts.Auction.RESERVE_PRICE_FACTOR);
        long duration = config.getAuctionDurationSec();

        AuctionStartResult res = ledger.startAuction(ctx.borrower(), collateral, startPrice, reservePrice, duration);
        if (res == null || res.tx() == null || !res.tx().success()) {
            return StageOutcome.failed(res == null || res.tx() == null ? "no auction result" : res.tx().error());
        }
        if (res.auctionId() == null || res.auctionId().isBlank()) {
            return StageOutcome.failed("auction contract returned no auction id");
        }

        AuctionRecord record = AuctionRecord.builder()
                .auctionId(res.auctionId())
                .borrower(ctx.borrower())
                .collateralAmount(collateral)
                .startPrice(startPrice)
                .reservePrice(reservePrice)
                .durationSec(duration)
                .status(AuctionStatus.ACTIVE)
                .transactionHash(res.tx().transactionHash())
                .startedAt(Instant.now(clock))
                .build();
        return StageOutcome.succeeded(res.tx().transactionHash()).withAuction(record);
    }
}
