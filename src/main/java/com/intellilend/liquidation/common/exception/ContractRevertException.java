package com.intellilend.liquidation.common.exception;

/**
 * The contract rejected the call (e.g. "position not undercollateralized").
 * Terminal for that call: never retried and not counted against the circuit breaker.
 */
public class ContractRevertException extends LedgerException {
    private static final String DEFAULT_ERROR_CODE = "ERR-LEDGER-REVERT";

    public ContractRevertException(String message) {
        super(message);
    }

    @Override
    public boolean isTransient() {
        return false;
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
