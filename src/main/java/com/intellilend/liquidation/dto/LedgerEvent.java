package com.intellilend.liquidation.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.intellilend.liquidation.enums.LedgerEventType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A ledger contract event as delivered on the {@code ledger.events} topic.
 * Only the fields relevant to {@link #type} are populated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LedgerEvent {

    private LedgerEventType type;
    private String borrower;
    private BigDecimal amount;

    // AuctionStarted / AuctionEnded
    private String auctionId;
    private String winner;
    private BigDecimal finalPrice;

    // ProtectionActivated
    private String protectionId;

    private String transactionHash;
    private Long blockNumber;
    private Instant timestamp;
}
