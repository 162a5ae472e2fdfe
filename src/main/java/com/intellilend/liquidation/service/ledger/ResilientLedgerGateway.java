package com.intellilend.liquidation.service.ledger;

import com.intellilend.liquidation.common.exception.BaseLiquidationException;
import com.intellilend.liquidation.common.exception.LedgerException;
import com.intellilend.liquidation.dto.AuctionStartResult;
import com.intellilend.liquidation.dto.LiquidationHistoryEntry;
import com.intellilend.liquidation.dto.ProtectionDetails;
import com.intellilend.liquidation.dto.TxResult;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Decorates a {@link LedgerGateway} with a per-call timeout, retries with backoff and a circuit breaker.
 * <p>
 * Layering, outermost first: retry, circuit breaker, time limiter. Only transient failures
 * (timeouts and transport errors) are retried or counted by the breaker; contract reverts and
 * malformed data surface immediately. An open breaker fails fast with {@link LedgerException#CIRCUIT_OPEN}.
 */
@Slf4j
public class ResilientLedgerGateway implements LedgerGateway {

    private final LedgerGateway delegate;
    private final CircuitBreaker circuitBreaker;
    private final Retry retry;
    private final TimeLimiter timeLimiter;
    private final Executor executor;

    public ResilientLedgerGateway(LedgerGateway delegate,
                                  CircuitBreaker circuitBreaker,
                                  Retry retry,
                                  TimeLimiter timeLimiter,
                                  Executor executor) {
        this.delegate = delegate;
        this.circuitBreaker = circuitBreaker;
        this.retry = retry;
        this.timeLimiter = timeLimiter;
        this.executor = executor;
    }

    /**
     * Failure classification shared by the retry and circuit breaker configuration.
     */
    public static boolean isTransient(Throwable t) {
        Throwable cause = unwrap(t);
        if (cause instanceof TimeoutException) return true;
        if (cause instanceof LedgerException) return ((LedgerException) cause).isTransient();
        return false;
    }

    @Override
    public BigDecimal getDebt(String borrower) {
        return call("getDebt", () -> delegate.getDebt(borrower));
    }

    @Override
    public BigDecimal getCollateral(String borrower) {
        return call("getCollateral", () -> delegate.getCollateral(borrower));
    }

    @Override
    public List<String> listActiveBorrowers() {
        return call("listActiveBorrowers", delegate::listActiveBorrowers);
    }

    @Override
    public boolean hasActiveProtection(String borrower) {
        return call("hasActiveProtection", () -> delegate.hasActiveProtection(borrower));
    }

    @Override
    public Optional<ProtectionDetails> getProtectionDetails(String borrower) {
        return call("getProtectionDetails", () -> delegate.getProtectionDetails(borrower));
    }

    @Override
    public TxResult activateProtection(String borrower) {
        return call("activateProtection", () -> delegate.activateProtection(borrower));
    }

    @Override
    public AuctionStartResult startAuction(String borrower,
                                           BigDecimal collateralAmount,
                                           BigDecimal startPrice,
                                           BigDecimal reservePrice,
                                           long durationSec) {
        return call("startAuction",
                () -> delegate.startAuction(borrower, collateralAmount, startPrice, reservePrice, durationSec));
    }

    @Override
    public TxResult liquidate(String borrower) {
        return call("liquidate", () -> delegate.liquidate(borrower));
    }

    @Override
    public List<LiquidationHistoryEntry> getLiquidationHistory(String borrower) {
        return call("getLiquidationHistory", () -> delegate.getLiquidationHistory(borrower));
    }

    private <T> T call(String op, Supplier<T> supplier) {
        Supplier<CompletableFuture<T>> async = () -> CompletableFuture.supplyAsync(supplier, executor);
        Callable<T> timed = TimeLimiter.decorateFutureSupplier(timeLimiter, async);
        Callable<T> guarded = CircuitBreaker.decorateCallable(circuitBreaker, timed);
        Callable<T> retried = Retry.decorateCallable(retry, guarded);
        try {
            return retried.call();
        } catch (Exception e) {
            throw translate(op, unwrap(e));
        }
    }

    private RuntimeException translate(String op, Throwable t) {
        if (t instanceof CallNotPermittedException) {
            log.warn("Ledger circuit open, rejecting {}", op);
            return new LedgerException(LedgerException.CIRCUIT_OPEN, "Ledger circuit open: " + op + " rejected", t);
        }
        if (t instanceof TimeoutException) {
            log.warn("Ledger call {} timed out after {}", op, timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
            return new LedgerException(LedgerException.TIMEOUT, "Ledger call " + op + " timed out", t);
        }
        if (t instanceof BaseLiquidationException) {
            return (BaseLiquidationException) t;
        }
        log.error("Ledger call {} failed unexpectedly", op, t);
        return new LedgerException("Ledger call " + op + " failed: " + t.getMessage(), t);
    }

    private static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof ExecutionException || cur instanceof CompletionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }
}
