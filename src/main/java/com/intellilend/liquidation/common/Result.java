package com.intellilend.liquidation.common;

import com.intellilend.liquidation.common.exception.BaseLiquidationException;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Success/failure envelope returned by every boundary that must not throw
 * (audit writes, lifecycle control, status queries, REST).
 */
@Getter
@ToString
public final class Result<T> {

    private final boolean success;
    private final T data;
    private final String error;
    private final String errorCode;
    private final Instant timestamp;

    private Result(boolean success, T data, String error, String errorCode) {
        this.success = success;
        this.data = data;
        this.error = error;
        this.errorCode = errorCode;
        this.timestamp = Instant.now();
    }

    // ---------- factories ----------
    public static <T> Result<T> ok(T data) {
        return new Result<>(true, data, null, null);
    }

    public static <T> Result<T> ok() {
        return new Result<>(true, null, null, null);
    }

    public static <T> Result<T> fail(String message) {
        return new Result<>(false, null, message, null);
    }

    public static <T> Result<T> fail(String code, String message) {
        return new Result<>(false, null, message, code);
    }

    /**
     * Failure carrying the exception message; error code is taken from
     * {@link BaseLiquidationException} when available.
     */
    public static <T> Result<T> fail(Throwable t) {
        if (t == null) return new Result<>(false, null, "Unknown error", null);
        String msg = t.getMessage() == null ? t.toString() : t.getMessage();
        String code = (t instanceof BaseLiquidationException) ? ((BaseLiquidationException) t).getErrorCode() : null;
        return new Result<>(false, null, msg, code);
    }

    // ---------- convenience helpers ----------

    public boolean isOk() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    /**
     * Alias for {@link #getData()}.
     */
    public T get() {
        return data;
    }

    public T getOrElse(T fallback) {
        return (success && data != null) ? data : fallback;
    }

    public void ifFailure(Consumer<? super String> consumer) {
        if (isFailure()) consumer.accept(error);
    }

    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        if (isFailure()) return Result.fail(errorCode, error);
        return Result.ok(mapper.apply(data));
    }
}
