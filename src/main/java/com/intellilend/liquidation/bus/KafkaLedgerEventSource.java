package com.intellilend.liquidation.bus;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intellilend.liquidation.dto.LedgerEvent;
import com.intellilend.liquidation.service.ledger.LedgerEventListener;
import com.intellilend.liquidation.service.ledger.LedgerEventSource;
import com.intellilend.liquidation.service.ledger.LedgerSubscription;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.errors.WakeupException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Ledger events from Kafka. Each subscription owns one consumer polled on one thread, so records
 * of a partition (keyed by borrower) reach the listener in ledger order.
 */
@Slf4j
public class KafkaLedgerEventSource implements LedgerEventSource {

    private static final Duration POLL_TIMEOUT = Duration.ofMillis(500);

    private final String topic;
    private final ObjectMapper mapper;
    private final Supplier<Consumer<String, String>> consumerFactory;

    public KafkaLedgerEventSource(String topic, ObjectMapper mapper) {
        this(topic, mapper, () -> new KafkaConsumer<>(KafkaPropertiesHelper.loadConsumerProps()));
    }

    public KafkaLedgerEventSource(String topic, ObjectMapper mapper, Supplier<Consumer<String, String>> consumerFactory) {
        this.topic = topic;
        this.mapper = mapper;
        this.consumerFactory = consumerFactory;
    }

    @Override
    public LedgerSubscription subscribe(LedgerEventListener listener) {
        Consumer<String, String> consumer = consumerFactory.get();
        consumer.subscribe(List.of(topic));

        KafkaSubscription sub = new KafkaSubscription(consumer);
        sub.exec.submit(() -> pollLoop(sub, listener));
        log.info("Subscribed to ledger events on '{}'", topic);
        return sub;
    }

    private void pollLoop(KafkaSubscription sub, LedgerEventListener listener) {
        Consumer<String, String> consumer = sub.consumer;
        try {
            while (sub.open.get()) {
                ConsumerRecords<String, String> records = consumer.poll(POLL_TIMEOUT);
                for (ConsumerRecord<String, String> r : records) {
                    dispatch(r, listener);
                }
            }
        } catch (WakeupException e) {
            if (sub.open.get()) throw e;
            log.debug("Ledger event consumer woken up for shutdown");
        } catch (RuntimeException e) {
            log.error("Ledger event loop on '{}' failed", topic, e);
        } finally {
            consumer.close(Duration.ofSeconds(5));
            log.info("Ledger event consumer on '{}' closed", topic);
        }
    }

    void dispatch(ConsumerRecord<String, String> r, LedgerEventListener listener) {
        LedgerEvent event;
        try {
            event = mapper.readValue(r.value(), LedgerEvent.class);
        } catch (Exception e) {
            log.warn("Skipping malformed ledger event at {}-{}@{}: {}", r.topic(), r.partition(), r.offset(), e.getMessage());
            return;
        }
        if (!isAddressable(event)) {
            log.warn("Skipping incomplete ledger event at {}-{}@{}", r.topic(), r.partition(), r.offset());
            return;
        }
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            log.error("Ledger event listener failed for {} {}", event.getType(), event.getBorrower(), e);
        }
    }

    /**
     * Auction events are keyed by auction id ({@code AuctionEnded} carries no borrower); every other event by borrower.
     */
    static boolean isAddressable(LedgerEvent event) {
        if (event == null || event.getType() == null) return false;
        return switch (event.getType()) {
            case AUCTION_STARTED, AUCTION_ENDED -> event.getAuctionId() != null;
            default -> event.getBorrower() != null;
        };
    }

    private static final class KafkaSubscription implements LedgerSubscription {
        private final Consumer<String, String> consumer;
        private final AtomicBoolean open = new AtomicBoolean(true);
        private final ExecutorService exec = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "ledger-events");
            t.setDaemon(true);
            return t;
        });

        private KafkaSubscription(Consumer<String, String> consumer) {
            this.consumer = consumer;
        }

        @Override
        public void close() {
            if (open.compareAndSet(true, false)) {
                consumer.wakeup();
                exec.shutdown();
            }
        }

        @Override
        public boolean isOpen() {
            return open.get();
        }
    }
}
