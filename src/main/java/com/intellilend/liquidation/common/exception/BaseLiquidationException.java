package com.intellilend.liquidation.common.exception;

import lombok.Getter;

/**
 * Root of the engine's exception hierarchy. Every subclass carries an error code
 * that survives into {@link com.intellilend.liquidation.common.Result} and REST responses.
 */
@Getter
public abstract class BaseLiquidationException extends RuntimeException {

    private final String errorCode;

    protected BaseLiquidationException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected BaseLiquidationException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    protected BaseLiquidationException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    protected abstract String getDefaultErrorCode();
}
