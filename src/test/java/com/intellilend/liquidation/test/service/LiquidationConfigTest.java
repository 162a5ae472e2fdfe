package com.intellilend.liquidation.test.service;

import com.intellilend.liquidation.config.LiquidationConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.support.PropertiesLoaderUtils;
import org.springframework.mock.env.MockEnvironment;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LiquidationConfigTest {

    LiquidationConfig cfg;

    @BeforeEach
    void setUp() {
        cfg = new LiquidationConfig();
        ReflectionTestUtils.setField(cfg, "liquidationThreshold", new BigDecimal("1.10"));
        ReflectionTestUtils.setField(cfg, "warningThreshold", new BigDecimal("1.25"));
        ReflectionTestUtils.setField(cfg, "checkIntervalMs", 60_000L);
        ReflectionTestUtils.setField(cfg, "ledgerTimeoutMs", 5_000L);
        ReflectionTestUtils.setField(cfg, "ledgerBaseUrl", "http://ledger.local");
        ReflectionTestUtils.setField(cfg, "lendingPoolAddress", "0xPOOL");
        ReflectionTestUtils.setField(cfg, "auctionAddress", "");
        ReflectionTestUtils.setField(cfg, "protectionAddress", "0xPROT");
    }

    @Test
    void validConfigurationPasses() {
        assertThatCode(cfg::validate).doesNotThrowAnyException();
        assertThat(cfg.auctionEnabled()).isFalse();
        assertThat(cfg.protectionEnabled()).isTrue();
        assertThat(cfg.thresholds().liquidationThreshold()).isEqualByComparingTo("1.10");
        assertThat(cfg.thresholds().checkIntervalMs()).isEqualTo(60_000L);
    }

    @Test
    void missingLedgerEndpointFailsStartup() {
        ReflectionTestUtils.setField(cfg, "ledgerBaseUrl", " ");

        assertThatThrownBy(cfg::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("liquidation.ledger.base-url");
    }

    @Test
    void missingLendingPoolFailsStartup() {
        ReflectionTestUtils.setField(cfg, "lendingPoolAddress", "");

        assertThatThrownBy(cfg::validate).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void warningBelowLiquidationThresholdIsRejected() {
        ReflectionTestUtils.setField(cfg, "warningThreshold", new BigDecimal("1.05"));

        assertThatThrownBy(cfg::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("warning");
    }

    @Test
    void shippedPropertiesLeaveMandatorySettingsToTheDeployment() throws IOException {
        Properties shipped = PropertiesLoaderUtils.loadProperties(new ClassPathResource("application.properties"));
        MockEnvironment env = new MockEnvironment();
        shipped.stringPropertyNames().forEach(k -> env.setProperty(k, shipped.getProperty(k)));

        assertThat(env.getProperty("liquidation.contracts.lending-pool")).isEmpty();
        assertThat(env.getProperty("liquidation.ledger.base-url")).isEmpty();

        ReflectionTestUtils.setField(cfg, "ledgerBaseUrl", env.getProperty("liquidation.ledger.base-url"));
        ReflectionTestUtils.setField(cfg, "lendingPoolAddress", env.getProperty("liquidation.contracts.lending-pool"));

        assertThatThrownBy(cfg::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Missing mandatory configuration");
    }
}
