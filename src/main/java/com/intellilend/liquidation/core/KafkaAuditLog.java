package com.intellilend.liquidation.core;

import com.intellilend.liquidation.bus.EventPublisher;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Audit sink publishing to a Kafka topic, keyed by event kind.
 * Delivery is asynchronous; send failures are reported by the publisher's callback.
 */
public class KafkaAuditLog implements AuditLog {

    private final EventPublisher publisher;
    private final String topic;

    public KafkaAuditLog(EventPublisher publisher, String topic) {
        this.publisher = publisher;
        this.topic = topic;
    }

    @Override
    public String append(String tag, byte[] payload) {
        publisher.publish(topic, tag, new String(payload, StandardCharsets.UTF_8));
        return UUID.randomUUID().toString();
    }
}
