package com.intellilend.liquidation.bus;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * KafkaPropertiesHelper
 * ------------------------------------------------------------
 * Loads producer/consumer Properties from the classpath and settles
 * bootstrap.servers from a single precedence chain:
 *  1) Env: KAFKA_BOOTSTRAP_SERVERS
 *  2) Sys Prop: kafka.bootstrap.servers
 *  3) application.properties -> liquidation.kafka.bootstrap-servers
 *  4) producer/consumer.properties -> bootstrap.servers (as-is)
 */
public final class KafkaPropertiesHelper {

    private static final String APP_PROPS = "/application.properties";
    private static final String PRODUCER_PROPS = "/producer.properties";
    private static final String CONSUMER_PROPS = "/consumer.properties";

    private static final String APP_BOOTSTRAP_KEY = "liquidation.kafka.bootstrap-servers";
    private static final String BOOTSTRAP_KEY = "bootstrap.servers";

    private KafkaPropertiesHelper() { /* no instances */ }

    public static Properties loadProducerProps() {
        Properties p = withBootstrap(readProps(PRODUCER_PROPS));
        putIfAbsent(p, "key.serializer", "org.apache.kafka.common.serialization.StringSerializer");
        putIfAbsent(p, "value.serializer", "org.apache.kafka.common.serialization.StringSerializer");
        putIfAbsent(p, "acks", "all");
        putIfAbsent(p, "enable.idempotence", "true");
        putIfAbsent(p, "delivery.timeout.ms", "30000");
        putIfAbsent(p, "request.timeout.ms", "10000");
        putIfAbsent(p, "max.block.ms", "5000");
        putIfAbsent(p, "client.id", "liquidation-engine-audit");
        return p;
    }

    public static Properties loadConsumerProps() {
        Properties p = withBootstrap(readProps(CONSUMER_PROPS));
        putIfAbsent(p, "key.deserializer", "org.apache.kafka.common.serialization.StringDeserializer");
        putIfAbsent(p, "value.deserializer", "org.apache.kafka.common.serialization.StringDeserializer");
        putIfAbsent(p, "group.id", "liquidation-engine");
        putIfAbsent(p, "auto.offset.reset", "latest");
        putIfAbsent(p, "session.timeout.ms", "10000");
        putIfAbsent(p, "heartbeat.interval.ms", "3000");
        putIfAbsent(p, "client.id", "liquidation-engine-ledger");
        return p;
    }

    static String resolveBootstrapServers(Properties appProps) {
        String env = System.getenv("KAFKA_BOOTSTRAP_SERVERS");
        if (notBlank(env)) return env.trim();

        String sys = System.getProperty("kafka.bootstrap.servers");
        if (notBlank(sys)) return sys.trim();

        String app = appProps == null ? null : appProps.getProperty(APP_BOOTSTRAP_KEY);
        if (notBlank(app)) return app.trim();

        return null;
    }

    private static Properties withBootstrap(Properties base) {
        String bs = resolveBootstrapServers(readProps(APP_PROPS));
        if (bs != null) {
            base.setProperty(BOOTSTRAP_KEY, bs);
        }
        return base;
    }

    private static Properties readProps(String classpathResource) {
        Properties p = new Properties();
        try (InputStream in = KafkaPropertiesHelper.class.getResourceAsStream(classpathResource)) {
            if (in != null) p.load(in);
        } catch (IOException e) {
            // unreadable resource: fall back to the defaults applied by the callers
        }
        return p;
    }

    private static void putIfAbsent(Properties p, String key, String value) {
        if (!notBlank(p.getProperty(key))) {
            p.setProperty(key, value);
        }
    }

    private static boolean notBlank(String s) {
        return s != null && !s.trim().isEmpty();
    }
}
