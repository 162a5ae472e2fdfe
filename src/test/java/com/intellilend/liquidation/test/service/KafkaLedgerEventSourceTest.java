package com.intellilend.liquidation.test.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.intellilend.liquidation.bus.EventBusConfig;
import com.intellilend.liquidation.bus.KafkaLedgerEventSource;
import com.intellilend.liquidation.dto.LedgerEvent;
import com.intellilend.liquidation.enums.LedgerEventType;
import com.intellilend.liquidation.service.ledger.LedgerSubscription;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class KafkaLedgerEventSourceTest {

    private static final String TOPIC = EventBusConfig.TOPIC_LEDGER_EVENTS;
    private static final TopicPartition TP = new TopicPartition(TOPIC, 0);

    @Test
    void deliversEventsInOrderAndSkipsMalformedOnes() throws Exception {
        MockConsumer<String, String> consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        Map<TopicPartition, Long> start = new HashMap<>();
        start.put(TP, 0L);
        consumer.updateBeginningOffsets(start);
        consumer.schedulePollTask(() -> {
            consumer.rebalance(Collections.singletonList(TP));
            consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 0L, "0xA",
                    "{\"type\":\"Borrow\",\"borrower\":\"0xA\",\"amount\":\"100\"}"));
            consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 1L, "0xA", "{not json"));
            consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 2L, "0xA", "{\"type\":\"Repay\"}"));
            consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 3L, "0xA",
                    "{\"type\":\"AuctionEnded\",\"borrower\":\"0xA\",\"auctionId\":\"9\",\"winner\":\"0xW\",\"finalPrice\":\"880.5\"}"));
        });

        List<LedgerEvent> received = new CopyOnWriteArrayList<>();
        CountDownLatch twoEvents = new CountDownLatch(2);
        KafkaLedgerEventSource source = new KafkaLedgerEventSource(TOPIC,
                new ObjectMapper().registerModule(new JavaTimeModule()), () -> consumer);

        LedgerSubscription sub = source.subscribe(e -> {
            received.add(e);
            twoEvents.countDown();
        });
        try {
            assertThat(twoEvents.await(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            sub.close();
        }

        assertThat(sub.isOpen()).isFalse();
        assertThat(received).extracting(LedgerEvent::getType)
                .containsExactly(LedgerEventType.BORROW, LedgerEventType.AUCTION_ENDED);
        assertThat(received.get(1).getFinalPrice()).isEqualByComparingTo("880.5");
        assertThat(received.get(1).getWinner()).isEqualTo("0xW");
    }

    @Test
    void auctionEventsAreKeyedByAuctionIdNotBorrower() throws Exception {
        MockConsumer<String, String> consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        Map<TopicPartition, Long> start = new HashMap<>();
        start.put(TP, 0L);
        consumer.updateBeginningOffsets(start);
        consumer.schedulePollTask(() -> {
            consumer.rebalance(Collections.singletonList(TP));
            consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 0L, "9",
                    "{\"type\":\"AuctionEnded\",\"winner\":\"0xW\",\"finalPrice\":\"1\"}"));
            consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 1L, "9",
                    "{\"type\":\"AuctionEnded\",\"auctionId\":\"9\",\"winner\":\"0xW\",\"finalPrice\":\"880\"}"));
        });

        List<LedgerEvent> received = new CopyOnWriteArrayList<>();
        CountDownLatch delivered = new CountDownLatch(1);
        KafkaLedgerEventSource source = new KafkaLedgerEventSource(TOPIC,
                new ObjectMapper().registerModule(new JavaTimeModule()), () -> consumer);

        LedgerSubscription sub = source.subscribe(e -> {
            received.add(e);
            delivered.countDown();
        });
        try {
            assertThat(delivered.await(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            sub.close();
        }

        assertThat(received).hasSize(1);
        LedgerEvent ended = received.get(0);
        assertThat(ended.getType()).isEqualTo(LedgerEventType.AUCTION_ENDED);
        assertThat(ended.getAuctionId()).isEqualTo("9");
        assertThat(ended.getBorrower()).isNull();
        assertThat(ended.getFinalPrice()).isEqualByComparingTo("880");
    }
}
