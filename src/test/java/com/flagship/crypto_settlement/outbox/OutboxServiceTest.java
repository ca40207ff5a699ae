package com.flagship.crypto_settlement.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox writes join the caller's transaction; bookkeeping runs in its own.
 */
@SpringBootTest
@Testcontainers
class OutboxServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("crypto_settlement_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // Publisher off, Kafka unreachable
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
    }

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private LedgerSyncQueue ledgerSyncQueue;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        outboxEventRepository.deleteAll();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private OutboxEvent saveInTransaction(UUID aggregateId) {
        return transactionTemplate.execute(status -> outboxService.saveEvent(
            OutboxLedgerSyncQueue.AGGREGATE_TYPE, aggregateId, LedgerSyncRequested.EVENT_TYPE,
            Map.of("invoiceId", aggregateId.toString())));
    }

    @Test
    @DisplayName("Ledger sync job is written with the invoice as aggregate")
    void testEnqueue_WritesLedgerSyncRequested() throws Exception {
        printTestHeader("Enqueue Ledger Sync");
        UUID invoiceId = UUID.randomUUID();
        UUID organizationId = UUID.randomUUID();

        ledgerSyncQueue.enqueue(invoiceId, organizationId, "hedera_0.0.1-1-000000001");

        List<OutboxEvent> events = outboxService.getEventsForAggregate(OutboxLedgerSyncQueue.AGGREGATE_TYPE, invoiceId);
        assertEquals(1, events.size());
        OutboxEvent event = events.get(0);
        assertEquals(LedgerSyncRequested.EVENT_TYPE, event.getEventType());
        assertFalse(event.isPublished());
        assertEquals(0, event.getRetryCount());
        assertNotNull(event.getSequenceNumber());

        JsonNode payload = objectMapper.readTree(event.getPayload());
        System.out.println("Payload: " + payload);
        assertEquals(invoiceId.toString(), payload.path("invoiceId").asText());
        assertEquals(organizationId.toString(), payload.path("organizationId").asText());
        assertEquals("hedera_0.0.1-1-000000001", payload.path("correlationId").asText());
        assertFalse(Instant.parse(payload.path("requestedAt").asText()).isAfter(Instant.now()));
        printSuccess("Ledger sync job written");
    }

    @Test
    @DisplayName("Saving outside a transaction is refused")
    void testSaveEvent_RequiresTransaction() {
        printTestHeader("Save Without Transaction");

        assertThrows(IllegalTransactionStateException.class, () -> outboxService.saveEvent(
            "Invoice", UUID.randomUUID(), LedgerSyncRequested.EVENT_TYPE, Map.of()));
        assertEquals(0, outboxService.countUnpublished());
        printSuccess("MANDATORY propagation enforced");
    }

    @Test
    @DisplayName("Event rolls back with the caller's transaction")
    void testSaveEvent_RollsBackWithCaller() {
        printTestHeader("Atomic With Caller");
        UUID aggregateId = UUID.randomUUID();

        assertThrows(IllegalStateException.class, () -> transactionTemplate.execute(status -> {
            outboxService.saveEvent("Invoice", aggregateId, LedgerSyncRequested.EVENT_TYPE, Map.of());
            throw new IllegalStateException("business write failed");
        }));

        assertTrue(outboxService.getEventsForAggregate("Invoice", aggregateId).isEmpty());
        printSuccess("No orphan event");
    }

    @Test
    @DisplayName("Unpublished events come back oldest first")
    void testFindUnpublishedEvents_Ordered() {
        printTestHeader("Find Unpublished");
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        saveInTransaction(first);
        saveInTransaction(second);

        List<OutboxEvent> events = outboxService.findUnpublishedEvents(10);

        assertEquals(List.of(first, second), events.stream().map(OutboxEvent::getAggregateId).toList());
        assertEquals(1, outboxService.findUnpublishedEvents(1).size());
        printSuccess("Batch ordered by sequence number");
    }

    @Test
    @DisplayName("Published events leave the backlog")
    void testMarkPublished() {
        printTestHeader("Mark Published");
        OutboxEvent event = saveInTransaction(UUID.randomUUID());
        assertEquals(1, outboxService.countUnpublished());

        outboxService.markPublished(event.getId());

        assertEquals(0, outboxService.countUnpublished());
        assertTrue(outboxService.findUnpublishedEvents(10).isEmpty());
        OutboxEvent stored = outboxService.getEventsForAggregate("Invoice", event.getAggregateId()).get(0);
        assertNotNull(stored.getPublishedAt());
        printSuccess("Event published");
    }

    @Test
    @DisplayName("Failures bump the retry count and keep the event pending")
    void testMarkFailed_IncrementsRetryCount() {
        printTestHeader("Mark Failed");
        OutboxEvent event = saveInTransaction(UUID.randomUUID());

        outboxService.markFailed(event.getId(), "broker down");
        outboxService.markFailed(event.getId(), "broker still down");

        OutboxEvent stored = outboxService.getEventsForAggregate("Invoice", event.getAggregateId()).get(0);
        assertEquals(2, stored.getRetryCount());
        assertEquals("broker still down", stored.getLastError());
        assertFalse(stored.isPublished());
        assertEquals(1, outboxService.countUnpublished());
        printSuccess("Retry count tracked");
    }
}
