package com.intellilend.liquidation.common.exception;

/**
 * Ledger gateway call failed: transport error, timeout, open circuit or an
 * unexpected response. Transient unless stated otherwise by a subclass.
 */
public class LedgerException extends BaseLiquidationException {
    private static final String DEFAULT_ERROR_CODE = "ERR-LEDGER-001";

    public static final String TIMEOUT = "ERR-LEDGER-TIMEOUT";
    public static final String CIRCUIT_OPEN = "ERR-LEDGER-CIRCUIT-OPEN";

    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }

    public LedgerException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    /**
     * Whether a retry of the same call may succeed.
     */
    public boolean isTransient() {
        return !CIRCUIT_OPEN.equals(getErrorCode());
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
