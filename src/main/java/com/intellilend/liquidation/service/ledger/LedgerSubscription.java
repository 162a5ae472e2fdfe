package com.intellilend.liquidation.service.ledger;

/**
 * Handle to an active ledger event subscription. Closing detaches the listener; it is idempotent.
 */
public interface LedgerSubscription extends AutoCloseable {

    @Override
    void close();

    boolean isOpen();
}
