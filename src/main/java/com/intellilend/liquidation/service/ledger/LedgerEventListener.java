package com.intellilend.liquidation.service.ledger;

import com.intellilend.liquidation.dto.LedgerEvent;

@FunctionalInterface
public interface LedgerEventListener {

    void onEvent(LedgerEvent event);
}
