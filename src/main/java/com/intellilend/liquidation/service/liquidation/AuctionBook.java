package com.intellilend.liquidation.service.liquidation;

import com.intellilend.liquidation.enums.AuctionStatus;
import com.intellilend.liquidation.model.AuctionRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Auction records keyed by auction id. Written only by the orchestrator; readers get copies.
 */
@Component
public class AuctionBook {

    private final Map<String, AuctionRecord> auctions = new ConcurrentHashMap<>();

    public void track(AuctionRecord record) {
        auctions.put(record.getAuctionId(), record.copy());
    }

    public boolean contains(String auctionId) {
        return auctions.containsKey(auctionId);
    }

    /**
     * Marks the auction settled. Returns the settled record, or empty if the id is unknown
     * or the auction already settled.
     */
    public Optional<AuctionRecord> settle(String auctionId, String winner, BigDecimal finalPrice,
                                          Instant endedAt, Instant evictAfter) {
        AuctionRecord[] out = new AuctionRecord[1];
        auctions.computeIfPresent(auctionId, (id, r) -> {
            if (r.getStatus() == AuctionStatus.SETTLED) return r;
            AuctionRecord settled = r.toBuilder()
                    .status(AuctionStatus.SETTLED)
                    .winner(winner)
                    .finalPrice(finalPrice)
                    .endedAt(endedAt)
                    .evictAfter(evictAfter)
                    .build();
            out[0] = settled.copy();
            return settled;
        });
        return Optional.ofNullable(out[0]);
    }

    public Optional<AuctionRecord> find(String auctionId) {
        AuctionRecord r = auctions.get(auctionId);
        return r == null ? Optional.empty() : Optional.of(r.copy());
    }

    public Optional<AuctionRecord> findActiveFor(String borrower) {
        return auctions.values().stream()
                .filter(r -> r.isActive() && borrower.equals(r.getBorrower()))
                .findFirst()
                .map(AuctionRecord::copy);
    }

    public List<AuctionRecord> active() {
        return auctions.values().stream()
                .filter(AuctionRecord::isActive)
                .map(AuctionRecord::copy)
                .sorted(Comparator.comparing(AuctionRecord::getStartedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .collect(Collectors.toList());
    }

    public List<AuctionRecord> all() {
        return auctions.values().stream().map(AuctionRecord::copy).collect(Collectors.toList());
    }

    /**
     * Drops settled auctions whose grace window ended at or before {@code now}.
     */
    public int evictExpired(Instant now) {
        int before = auctions.size();
        auctions.values().removeIf(r -> r.getStatus() == AuctionStatus.SETTLED
                && r.getEvictAfter() != null
                && !r.getEvictAfter().isAfter(now));
        return before - auctions.size();
    }
}
