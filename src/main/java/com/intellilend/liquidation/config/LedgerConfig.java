package com.intellilend.liquidation.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intellilend.liquidation.bus.EventBusConfig;
import com.intellilend.liquidation.bus.KafkaLedgerEventSource;
import com.intellilend.liquidation.service.ledger.HttpLedgerGateway;
import com.intellilend.liquidation.service.ledger.LedgerEventSource;
import com.intellilend.liquidation.service.ledger.LedgerGateway;
import com.intellilend.liquidation.service.ledger.ResilientLedgerGateway;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Ledger gateway wiring: HTTP adapter client wrapped in the retry / circuit breaker / timeout policy.
 */
@Slf4j
@Configuration
public class LedgerConfig {

    @Value("${liquidation.ledger.retry.max-attempts:3}")
    private int retryMaxAttempts;

    @Value("${liquidation.ledger.retry.wait-ms:500}")
    private long retryWaitMs;

    @Value("${liquidation.ledger.circuit.failure-rate:50}")
    private float circuitFailureRate;

    @Value("${liquidation.ledger.circuit.window:20}")
    private int circuitWindow;

    @Value("${liquidation.ledger.circuit.open-ms:30000}")
    private long circuitOpenMs;

    @Bean
    public CircuitBreaker ledgerCircuitBreaker() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(circuitFailureRate)
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(circuitWindow)
                .minimumNumberOfCalls(circuitWindow)
                .permittedNumberOfCallsInHalfOpenState(3)
                .waitDurationInOpenState(Duration.ofMillis(circuitOpenMs))
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .recordException(ResilientLedgerGateway::isTransient)
                .build();
        CircuitBreaker cb = CircuitBreaker.of("ledger", config);
        cb.getEventPublisher().onStateTransition(e ->
                log.warn("Ledger circuit breaker {}", e.getStateTransition()));
        return cb;
    }

    @Bean
    public Retry ledgerRetry() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(retryMaxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(retryWaitMs, 2))
                .retryOnException(ResilientLedgerGateway::isTransient)
                .build();
        Retry retry = Retry.of("ledger", config);
        retry.getEventPublisher().onRetry(e ->
                log.debug("Retrying ledger call (attempt {}): {}", e.getNumberOfRetryAttempts(), e.getLastThrowable().toString()));
        return retry;
    }

    @Bean
    public TimeLimiter ledgerTimeLimiter(LiquidationConfig cfg) {
        return TimeLimiter.of("ledger", TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(cfg.getLedgerTimeoutMs()))
                .cancelRunningFuture(true)
                .build());
    }

    @Bean
    public ThreadPoolTaskExecutor ledgerCallExecutor() {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(8);
        ex.setMaxPoolSize(32);
        ex.setQueueCapacity(256);
        ex.setThreadNamePrefix("ledger-call-");
        ex.initialize();
        return ex;
    }

    @Bean
    public LedgerGateway ledgerGateway(LiquidationConfig cfg,
                                       ObjectMapper mapper,
                                       CircuitBreaker ledgerCircuitBreaker,
                                       Retry ledgerRetry,
                                       TimeLimiter ledgerTimeLimiter,
                                       @Qualifier("ledgerCallExecutor") ThreadPoolTaskExecutor ledgerCallExecutor) {
        Duration timeout = Duration.ofMillis(cfg.getLedgerTimeoutMs());
        HttpClient http = HttpClient.newBuilder().connectTimeout(timeout).build();
        HttpLedgerGateway raw = new HttpLedgerGateway(http, mapper, cfg.getLedgerBaseUrl(), timeout,
                cfg.getLendingPoolAddress(), cfg.getAuctionAddress(), cfg.getProtectionAddress());
        log.info("Ledger gateway -> {} (pool={}, auction={}, protection={})", cfg.getLedgerBaseUrl(),
                cfg.getLendingPoolAddress(),
                cfg.auctionEnabled() ? cfg.getAuctionAddress() : "disabled",
                cfg.protectionEnabled() ? cfg.getProtectionAddress() : "disabled");
        return new ResilientLedgerGateway(raw, ledgerCircuitBreaker, ledgerRetry, ledgerTimeLimiter, ledgerCallExecutor);
    }

    @Bean
    public LedgerEventSource ledgerEventSource(ObjectMapper mapper) {
        return new KafkaLedgerEventSource(EventBusConfig.TOPIC_LEDGER_EVENTS, mapper);
    }
}
