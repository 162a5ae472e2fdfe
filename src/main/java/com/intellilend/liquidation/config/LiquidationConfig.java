package com.intellilend.liquidation.config;

import com.intellilend.liquidation.dto.Thresholds;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Load-time engine settings. Invalid or missing mandatory values fail start-up.
 */
@Getter
@Component
public class LiquidationConfig {

    @Value("${liquidation.threshold.liquidation:1.10}")
    private BigDecimal liquidationThreshold;

    @Value("${liquidation.threshold.warning:1.25}")
    private BigDecimal warningThreshold;

    @Value("${liquidation.check-interval-ms:60000}")
    private long checkIntervalMs;

    @Value("${liquidation.monitor.auto-start:false}")
    private boolean autoStart;

    @Value("${liquidation.auction.duration-sec:3600}")
    private long auctionDurationSec;

    @Value("${liquidation.auction.grace-ms:3600000}")
    private long auctionGraceMs;

    @Value("${liquidation.contracts.lending-pool:}")
    private String lendingPoolAddress;

    @Value("${liquidation.contracts.auction:}")
    private String auctionAddress;

    @Value("${liquidation.contracts.protection:}")
    private String protectionAddress;

    @Value("${liquidation.ledger.base-url:}")
    private String ledgerBaseUrl;

    @Value("${liquidation.ledger.timeout-ms:5000}")
    private long ledgerTimeoutMs;

    @Value("${liquidation.remediation.max-concurrency:4}")
    private int remediationConcurrency;

    @PostConstruct
    public void validate() {
        require(ledgerBaseUrl, "liquidation.ledger.base-url");
        require(lendingPoolAddress, "liquidation.contracts.lending-pool");
        if (liquidationThreshold == null || liquidationThreshold.signum() <= 0) {
            throw new IllegalStateException("liquidation.threshold.liquidation must be positive: " + liquidationThreshold);
        }
        if (warningThreshold == null || warningThreshold.compareTo(liquidationThreshold) < 0) {
            throw new IllegalStateException("liquidation.threshold.warning (" + warningThreshold
                    + ") must not be below liquidation threshold (" + liquidationThreshold + ")");
        }
        if (checkIntervalMs <= 0) {
            throw new IllegalStateException("liquidation.check-interval-ms must be positive: " + checkIntervalMs);
        }
        if (ledgerTimeoutMs <= 0) {
            throw new IllegalStateException("liquidation.ledger.timeout-ms must be positive: " + ledgerTimeoutMs);
        }
    }

    public Thresholds thresholds() {
        return new Thresholds(liquidationThreshold, warningThreshold, checkIntervalMs);
    }

    public boolean auctionEnabled() {
        return notBlank(auctionAddress);
    }

    public boolean protectionEnabled() {
        return notBlank(protectionAddress);
    }

    private static void require(String v, String key) {
        if (!notBlank(v)) throw new IllegalStateException("Missing mandatory configuration: " + key);
    }

    private static boolean notBlank(String s) {
        return s != null && !s.trim().isEmpty();
    }
}
