package com.intellilend.liquidation.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intellilend.liquidation.bus.EventBusConfig;
import com.intellilend.liquidation.bus.EventPublisher;
import com.intellilend.liquidation.bus.KafkaProducerFactory;
import com.intellilend.liquidation.core.AuditLog;
import com.intellilend.liquidation.core.KafkaAuditLog;
import com.intellilend.liquidation.core.MongoAuditLog;
import com.intellilend.liquidation.repo.documents.AuditEventRepo;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Picks the audit sink from {@code liquidation.audit.sink}.
 */
public class AuditSinkConfig {

    private AuditSinkConfig() {
    }

    @Configuration
    @ConditionalOnProperty(name = "liquidation.audit.sink", havingValue = "kafka", matchIfMissing = true)
    public static class Kafka {

        @Bean
        public EventPublisher eventPublisher() {
            return new EventPublisher(KafkaProducerFactory.get());
        }

        @Bean
        public AuditLog auditLog(EventPublisher eventPublisher) {
            return new KafkaAuditLog(eventPublisher, EventBusConfig.TOPIC_AUDIT);
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "liquidation.audit.sink", havingValue = "mongo")
    public static class Mongo {

        @Bean
        public AuditLog auditLog(AuditEventRepo repo, ObjectMapper mapper, Clock clock) {
            return new MongoAuditLog(repo, mapper, clock);
        }
    }
}
