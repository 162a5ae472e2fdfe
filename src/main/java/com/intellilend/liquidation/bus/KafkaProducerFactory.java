package com.intellilend.liquidation.bus;

import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;

import java.util.Properties;

/**
 * One shared producer per JVM; KafkaProducer is thread-safe.
 */
public final class KafkaProducerFactory {

    private static volatile Producer<String, String> INSTANCE;

    public static Producer<String, String> get() {
        if (INSTANCE == null) {
            synchronized (KafkaProducerFactory.class) {
                if (INSTANCE == null) {
                    Properties props = KafkaPropertiesHelper.loadProducerProps();
                    INSTANCE = new KafkaProducer<>(props);
                }
            }
        }
        return INSTANCE;
    }

    private KafkaProducerFactory() {
    }
}
