package com.intellilend.liquidation.common.exception;

/**
 * Malformed numeric state (null, negative or unparseable amounts, bad thresholds).
 * The borrower's evaluation for the cycle is skipped; the borrower is not transitioned.
 */
public class ValidationException extends BaseLiquidationException {
    private static final String DEFAULT_ERROR_CODE = "ERR-VAL-001";

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
