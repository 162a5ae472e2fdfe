package com.intellilend.liquidation.jobs;

import com.intellilend.liquidation.service.liquidation.LiquidationOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically drops settled auctions whose grace window has passed.
 * <p>
 * Configure (optional):
 * liquidation.auction.eviction-check-ms=60000
 * liquidation.auction.grace-ms=3600000
 */
@Component
@Slf4j
public class AuctionEvictionJob {

    @Autowired
    private LiquidationOrchestrator orchestrator;

    @Scheduled(fixedDelayString = "${liquidation.auction.eviction-check-ms:60000}")
    public void evictSettled() {
        try {
            orchestrator.evictSettledAuctions();
        } catch (RuntimeException e) {
            log.warn("Auction eviction error: {}", e.getMessage(), e);
        }
    }
}
