package com.flagship.recon_ledger.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.recon_ledger.event.JournalEntryPostedEvent;
import com.flagship.recon_ledger.event.JournalEntryVoidedEvent;
import com.flagship.recon_ledger.ledger.AccountService;
import com.flagship.recon_ledger.ledger.AccountType;
import com.flagship.recon_ledger.ledger.Direction;
import com.flagship.recon_ledger.ledger.JournalEntry;
import com.flagship.recon_ledger.ledger.JournalLine;
import com.flagship.recon_ledger.ledger.LedgerService;
import com.flagship.recon_ledger.ledger.SourceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox tests.
 *
 * These tests verify that:
 * - Events are written to the outbox with the ledger change that caused them
 * - Unpublished events can be fetched and marked published
 * - Failures increment the retry count and keep the last error
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class OutboxServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("recon_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // Disable outbox publisher during tests
        registry.add("outbox.publisher.enabled", () -> "false");
        // Disable Kafka for these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("consumer.enabled", () -> "false");
        registry.add("reconciliation.consistency.schedule-enabled", () -> "false");
    }

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private ObjectMapper objectMapper;

    private UUID cashId;
    private UUID revenueId;

    @BeforeEach
    void setUp() {
        outboxEventRepository.deleteAll();

        String suffix = UUID.randomUUID().toString().substring(0, 8);
        cashId = accountService.createAccount("CASH-" + suffix, "Cash", AccountType.ASSET, "USD").getId();
        revenueId = accountService.createAccount("REV-" + suffix, "Revenue", AccountType.INCOME, "USD").getId();
    }

    @Test
    @DisplayName("Outbox event should be created with correct data")
    void testSaveEvent_CreatesCorrectEvent() throws Exception {
        UUID aggregateId = UUID.randomUUID();

        OutboxEvent event = outboxService.saveEvent("JournalEntry", aggregateId, "TestEvent",
            new TestPayload("test-value", 123));

        assertNotNull(event.getId());
        assertEquals("JournalEntry", event.getAggregateType());
        assertEquals(aggregateId, event.getAggregateId());
        assertEquals("TestEvent", event.getEventType());
        assertFalse(event.isPublished());
        assertEquals(0, event.getRetryCount());

        TestPayload payload = objectMapper.readValue(event.getPayload(), TestPayload.class);
        assertEquals("test-value", payload.name());
        assertEquals(123, payload.value());
    }

    @Test
    @DisplayName("Posting an entry writes a JournalEntryPosted event")
    void testPostedEventIsWritten() throws Exception {
        JournalEntry posted = postEntry("250.00");

        List<OutboxEvent> events = outboxService.getEventsForAggregate("JournalEntry", posted.getId());
        OutboxEvent postedEvent = events.stream()
                .filter(e -> e.getEventType().equals(JournalEntryPostedEvent.EVENT_TYPE))
                .findFirst()
                .orElseThrow(() -> new AssertionError("JournalEntryPosted event not found"));

        JsonNode payload = objectMapper.readTree(postedEvent.getPayload());
        assertEquals(posted.getId().toString(), payload.get("entryId").asText());
        assertEquals(0, new BigDecimal("250.00").compareTo(payload.get("totalDebits").decimalValue()));
        assertEquals(2, payload.get("lineCount").asInt());
    }

    @Test
    @DisplayName("Voiding a posted entry adds a voided event after the posted one")
    void testVoidEventFollowsPostedEvent() {
        JournalEntry posted = postEntry("40.00");
        ledgerService.voidEntry(posted.getId(), "Duplicate booking");

        List<String> types = outboxService.getEventsForAggregate("JournalEntry", posted.getId()).stream()
                .map(OutboxEvent::getEventType)
                .toList();

        assertEquals(List.of(JournalEntryPostedEvent.EVENT_TYPE, JournalEntryVoidedEvent.EVENT_TYPE), types);
    }

    @Test
    @DisplayName("Event should be marked as published")
    void testMarkPublished() {
        postEntry("100.00");
        assertEquals(1, outboxService.countUnpublished());

        List<OutboxEvent> unpublished = outboxService.findUnpublishedEvents(10, 5);
        assertEquals(1, unpublished.size());

        outboxService.markPublished(unpublished.get(0).getId());

        assertTrue(outboxService.findUnpublishedEvents(10, 5).isEmpty());
        assertEquals(0, outboxService.countUnpublished());
    }

    @Test
    @DisplayName("Failed event should increment retry count and stop being fetched at the limit")
    void testMarkFailed_IncrementsRetryCount() {
        postEntry("100.00");
        OutboxEvent event = outboxService.findUnpublishedEvents(10, 5).get(0);

        outboxService.markFailed(event.getId(), "Connection timeout");
        outboxService.markFailed(event.getId(), "Kafka unavailable");
        outboxService.markFailed(event.getId(), "Broker not available");

        OutboxEventEntity entity = outboxEventRepository.findById(event.getId()).orElseThrow();
        assertEquals(3, entity.getRetryCount());
        assertEquals("Broker not available", entity.getLastError());

        assertTrue(outboxService.findUnpublishedEvents(10, 3).isEmpty());
        assertEquals(1, outboxService.findUnpublishedEvents(10, 4).size());
    }

    private JournalEntry postEntry(String amount) {
        JournalEntry draft = ledgerService.createDraft(LocalDate.of(2024, 5, 1), "Test sale", SourceType.MANUAL, List.of(
                JournalLine.of(cashId, Direction.DEBIT, new BigDecimal(amount), "USD"),
                JournalLine.of(revenueId, Direction.CREDIT, new BigDecimal(amount), "USD")));
        return ledgerService.post(draft.getId(), draft.getVersion());
    }

    record TestPayload(String name, int value) {}
}
