package com.flagship.general_ledger.outbox;

import com.flagship.general_ledger.ledger.LedgerService;
import com.flagship.general_ledger.ledger.Voucher;
import com.flagship.general_ledger.support.PostgresIntegrationTest;
import com.flagship.general_ledger.support.TestVouchers;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox events reach Kafka keyed by aggregate id and are marked published.
 */
class OutboxKafkaPublishingTest extends PostgresIntegrationTest {

    private static final String TOPIC = "ledger-events";

    static final KafkaContainer KAFKA = new KafkaContainer(DockerImageName.parse("confluentinc/cp-kafka:7.5.0"));

    @DynamicPropertySource
    static void kafkaProperties(DynamicPropertyRegistry registry) {
        KAFKA.start();
        registry.add("spring.kafka.bootstrap-servers", KAFKA::getBootstrapServers);
        // enabled so the bean exists; the long interval leaves publishing to the test
        registry.add("outbox.publisher.enabled", () -> "true");
        registry.add("outbox.publisher.poll-interval-ms", () -> "3600000");
        registry.add("ledger.events.topic", () -> TOPIC);
    }

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private LedgerService ledgerService;

    private KafkaConsumer<String, String> consumer;

    @BeforeEach
    void setUpConsumer() {
        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, KAFKA.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "test-group-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(Collections.singletonList(TOPIC));
    }

    @AfterEach
    void closeConsumer() {
        consumer.close();
    }

    // the topic outlives each test, so only records of the given aggregate count
    private List<ConsumerRecord<String, String>> consumeRecords(UUID aggregateId, int expected, long timeoutMs) {
        List<ConsumerRecord<String, String>> records = new ArrayList<>();
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (records.size() < expected && System.currentTimeMillis() < deadline) {
            for (ConsumerRecord<String, String> record : consumer.poll(Duration.ofMillis(250))) {
                if (aggregateId.toString().equals(record.key())) {
                    records.add(record);
                }
            }
        }
        return records;
    }

    @Test
    @DisplayName("voucher events are published to Kafka and leave the backlog")
    void publishesVoucherEvents() {
        printTestHeader("Outbox to Kafka");
        Voucher voucher = ledgerService.createVoucher("JE-2025-0001",
            TestVouchers.balanced(new BigDecimal("100.00")), "clerk");
        ledgerService.post(voucher.getId(), "supervisor");
        assertEquals(2, outboxService.countUnpublished());

        outboxPublisher.publishPendingEvents();

        assertEquals(0, outboxService.countUnpublished());
        List<ConsumerRecord<String, String>> records = consumeRecords(voucher.getId(), 2, 15000);
        printOutput("Records received", records.size());

        assertEquals(2, records.size());
        for (ConsumerRecord<String, String> record : records) {
            assertEquals(voucher.getId().toString(), record.key());
        }
        assertTrue(records.get(0).value().contains("VoucherCreated"));
        assertTrue(records.get(1).value().contains("VoucherPosted"));
        assertEquals(records.get(0).partition(), records.get(1).partition());
        printSuccess("Events of one voucher share a partition, in order");
    }

    @Test
    void publishedEventsAreNotSentAgain() {
        Voucher voucher = ledgerService.createVoucher("JE-2025-0002",
            TestVouchers.balanced(BigDecimal.TEN), "clerk");

        outboxPublisher.publishPendingEvents();
        outboxPublisher.publishPendingEvents();

        List<ConsumerRecord<String, String>> records = consumeRecords(voucher.getId(), 2, 5000);
        assertEquals(1, records.size());
        assertNotNull(outboxService.getEventsForAggregate("Voucher", voucher.getId()).get(0).getPublishedAt());
    }
}
