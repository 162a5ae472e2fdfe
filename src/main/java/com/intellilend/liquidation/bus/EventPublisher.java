package com.intellilend.liquidation.bus;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;

import java.time.Duration;

/**
 * Fire-and-forget Kafka publisher. Send failures are logged from the producer callback;
 * only synchronous failures (buffer full, serialization) reach the caller.
 */
@Slf4j
public class EventPublisher {
    private final Producer<String, String> producer;

    public EventPublisher(Producer<String, String> producer) {
        this.producer = producer;
    }

    public void publish(String topic, String key, String json) {
        if (json == null) json = "{}";
        producer.send(new ProducerRecord<>(topic, key, json), (m, e) -> {
            if (e == null) {
                log.debug("kafka sent topic={} partition={} offset={}", m.topic(), m.partition(), m.offset());
            } else {
                log.warn("kafka send failed topic={} key={} cause={}", topic, key, e.toString());
            }
        });
    }

    @PreDestroy
    public void close() {
        producer.close(Duration.ofSeconds(5));
    }
}
