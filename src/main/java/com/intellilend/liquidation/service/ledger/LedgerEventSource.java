package com.intellilend.liquidation.service.ledger;

/**
 * Delivers ledger contract events (Borrow, Repay, CollateralAdded, CollateralRemoved,
 * AuctionStarted, AuctionEnded, ProtectionActivated). Events for one borrower arrive in chain order.
 */
public interface LedgerEventSource {

    LedgerSubscription subscribe(LedgerEventListener listener);
}
