package com.flagship.crypto_settlement.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox to Kafka delivery of ledger sync jobs.
 *
 * The scheduled poll is pushed out to an hour so each test drives the
 * publisher through {@link OutboxPublisher#triggerPublish()}.
 */
@SpringBootTest
@Testcontainers
class OutboxPublisherTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("crypto_settlement_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static KafkaContainer kafka = new KafkaContainer(
            DockerImageName.parse("confluentinc/cp-kafka:7.5.0"));

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
        registry.add("outbox.publisher.enabled", () -> "true");
        registry.add("outbox.publisher.poll-interval-ms", () -> "3600000");
    }

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private LedgerSyncQueue ledgerSyncQueue;

    @Autowired
    private ObjectMapper objectMapper;

    @Value("${kafka.topic.ledger-sync:ledger-sync}")
    private String ledgerSyncTopic;

    private KafkaConsumer<String, String> consumer;

    @BeforeEach
    void setUp() {
        outboxEventRepository.deleteAll();

        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "test-group-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(Collections.singletonList(ledgerSyncTopic));

        System.out.println("\n--- Test Setup ---");
        System.out.println("Kafka bootstrap servers: " + kafka.getBootstrapServers());
        System.out.println("Topic: " + ledgerSyncTopic);
    }

    @AfterEach
    void tearDown() {
        consumer.close();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("Ledger sync job is sent to Kafka keyed by invoice id and marked published")
    void testPublisher_SendsLedgerSyncRequested() throws Exception {
        printTestHeader("Publisher Sends Ledger Sync Job");
        UUID invoiceId = UUID.randomUUID();
        UUID organizationId = UUID.randomUUID();
        ledgerSyncQueue.enqueue(invoiceId, organizationId, "hedera_0.0.1111-1700000000-000000001");
        assertEquals(1, outboxService.countUnpublished());

        outboxPublisher.triggerPublish();

        assertEquals(0, outboxService.countUnpublished(), "All events should be published");

        List<ConsumerRecord<String, String>> records = consumeRecords(Set.of(invoiceId.toString()), 1, 10000);
        assertEquals(1, records.size());
        ConsumerRecord<String, String> record = records.get(0);
        System.out.println("Record key: " + record.key());
        System.out.println("Record value: " + record.value());

        assertEquals(invoiceId.toString(), record.key());
        JsonNode payload = objectMapper.readTree(record.value());
        assertEquals(organizationId.toString(), payload.path("organizationId").asText());
        assertEquals("hedera_0.0.1111-1700000000-000000001", payload.path("correlationId").asText());
        printSuccess("Ledger sync job delivered");
    }

    @Test
    @DisplayName("Jobs for one invoice share a partition")
    void testPublisher_InvoiceIdIsPartitionKey() {
        printTestHeader("Invoice Id Is Partition Key");
        UUID invoiceId = UUID.randomUUID();
        UUID other = UUID.randomUUID();
        ledgerSyncQueue.enqueue(invoiceId, UUID.randomUUID(), "hedera_a");
        ledgerSyncQueue.enqueue(other, UUID.randomUUID(), "hedera_b");
        ledgerSyncQueue.enqueue(invoiceId, UUID.randomUUID(), "hedera_c");

        outboxPublisher.triggerPublish();

        List<ConsumerRecord<String, String>> records = consumeRecords(
            Set.of(invoiceId.toString(), other.toString()), 3, 10000);
        assertEquals(3, records.size());

        Set<Integer> partitions = new HashSet<>();
        for (ConsumerRecord<String, String> record : records) {
            System.out.println("Key: " + record.key() + ", Partition: " + record.partition());
            if (record.key().equals(invoiceId.toString())) {
                partitions.add(record.partition());
            }
        }
        assertEquals(1, partitions.size(), "Both jobs for the invoice should land on one partition");
        printSuccess("Partitioned by invoice id");
    }

    @Test
    @DisplayName("Unknown event type is recorded as a failed attempt")
    void testPublisher_UnknownEventTypeFails() {
        printTestHeader("Unknown Event Type");
        UUID aggregateId = UUID.randomUUID();
        outboxEventRepository.save(OutboxEventEntity.fromDomain(
            OutboxEvent.create("Invoice", aggregateId, "SomethingElse", "{}")));

        outboxPublisher.triggerPublish();

        OutboxEvent stored = outboxService.getEventsForAggregate("Invoice", aggregateId).get(0);
        assertEquals(1, stored.getRetryCount());
        assertFalse(stored.isPublished());
        assertNotNull(stored.getLastError());
        printSuccess("Failure recorded, event kept");
    }

    /**
     * Earlier tests share the topic, so only records keyed by this test's invoices count.
     */
    private List<ConsumerRecord<String, String>> consumeRecords(Set<String> keys, int expected, long timeoutMs) {
        List<ConsumerRecord<String, String>> allRecords = new ArrayList<>();
        long endTime = System.currentTimeMillis() + timeoutMs;

        while (System.currentTimeMillis() < endTime && allRecords.size() < expected) {
            ConsumerRecords<String, String> records = consumer.poll(Duration.ofMillis(100));
            for (ConsumerRecord<String, String> record : records) {
                if (keys.contains(record.key())) {
                    allRecords.add(record);
                }
            }
        }

        return allRecords;
    }
}
