package com.intellilend.liquidation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.intellilend.liquidation.enums.AuctionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A Dutch auction of a borrower's collateral, identified by the id the auction contract assigned.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AuctionRecord {

    private String auctionId;
    private String borrower;
    private BigDecimal collateralAmount;
    private BigDecimal startPrice;
    private BigDecimal reservePrice;
    private long durationSec;
    private AuctionStatus status;
    private String winner;
    private BigDecimal finalPrice;
    private String transactionHash;
    private Instant startedAt;
    private Instant endedAt;

    /** Settled records are evicted once this instant has passed. */
    @JsonIgnore
    private Instant evictAfter;

    public boolean isActive() {
        return status == AuctionStatus.ACTIVE;
    }

    public AuctionRecord copy() {
        return toBuilder().build();
    }
}
