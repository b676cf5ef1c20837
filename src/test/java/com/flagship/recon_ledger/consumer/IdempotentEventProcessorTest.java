package com.flagship.recon_ledger.consumer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Idempotent event processing tests.
 *
 * These tests verify that:
 * - Events are processed once per consumer group
 * - Duplicate deliveries are ignored
 * - A failing handler leaves no record, so redelivery retries it
 * - Skipped events are never reconsidered
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class IdempotentEventProcessorTest {

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
        // No broker for these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("reconciliation.consistency.schedule-enabled", () -> "false");
    }

    @Autowired
    private IdempotentEventProcessor eventProcessor;

    @Autowired
    private ProcessedEventRepository repository;

    private static final String CONSUMER_GROUP = "test-consumer";
    private static final String EVENT_TYPE = "StatementExtracted";
    private static final String AGGREGATE_TYPE = "Statement";

    @Test
    @DisplayName("First delivery runs the handler and records the event")
    void testFirstDeliveryRunsHandler() {
        UUID eventId = UUID.randomUUID();

        Optional<String> result = eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE,
            UUID.randomUUID(), CONSUMER_GROUP, () -> "ingested");

        assertEquals(Optional.of("ingested"), result);
        ProcessedEventEntity entity = repository.findByEventIdAndConsumerGroup(eventId, CONSUMER_GROUP).orElseThrow();
        assertEquals(ProcessedEvent.ProcessingResult.SUCCESS, entity.getProcessingResult());
    }

    @Test
    @DisplayName("Redelivered event does not run the handler again")
    void testDuplicateDeliverySkipped() {
        UUID eventId = UUID.randomUUID();
        UUID aggregateId = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        Optional<Integer> first = eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, aggregateId,
            CONSUMER_GROUP, calls::incrementAndGet);
        Optional<Integer> second = eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, aggregateId,
            CONSUMER_GROUP, calls::incrementAndGet);

        assertTrue(first.isPresent());
        assertTrue(second.isEmpty());
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Each consumer group processes the same event once")
    void testConsumerGroupsAreIndependent() {
        UUID eventId = UUID.randomUUID();
        UUID aggregateId = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, aggregateId, "ingestion", calls::incrementAndGet);
        eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, aggregateId, "audit", calls::incrementAndGet);
        eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, aggregateId, "audit", calls::incrementAndGet);

        assertEquals(2, calls.get());
        assertTrue(eventProcessor.isAlreadyProcessed(eventId, "ingestion"));
        assertTrue(eventProcessor.isAlreadyProcessed(eventId, "audit"));
        assertFalse(eventProcessor.isAlreadyProcessed(eventId, "other-group"));
    }

    @Test
    @DisplayName("Failing handler leaves no record so the event is retried")
    void testFailureIsRetried() {
        UUID eventId = UUID.randomUUID();
        UUID aggregateId = UUID.randomUUID();

        assertThrows(IllegalStateException.class, () -> eventProcessor.processEvent(eventId, EVENT_TYPE,
            AGGREGATE_TYPE, aggregateId, CONSUMER_GROUP, () -> {
                throw new IllegalStateException("Simulated processing failure");
            }));
        assertFalse(eventProcessor.isAlreadyProcessed(eventId, CONSUMER_GROUP));

        Optional<String> retried = eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, aggregateId,
            CONSUMER_GROUP, () -> "ok");
        assertEquals(Optional.of("ok"), retried);
    }

    @Test
    @DisplayName("Skipped event is never processed later")
    void testSkipPreventsProcessing() {
        UUID eventId = UUID.randomUUID();
        UUID aggregateId = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        eventProcessor.skipEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, aggregateId, CONSUMER_GROUP,
            "Invalid statement");
        Optional<Integer> result = eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, aggregateId,
            CONSUMER_GROUP, calls::incrementAndGet);

        assertTrue(result.isEmpty());
        assertEquals(0, calls.get());
        ProcessedEventEntity entity = repository.findByEventIdAndConsumerGroup(eventId, CONSUMER_GROUP).orElseThrow();
        assertEquals(ProcessedEvent.ProcessingResult.SKIPPED, entity.getProcessingResult());
        assertEquals("Invalid statement", entity.getErrorMessage());
    }

    @Test
    @DisplayName("Concurrent deliveries leave exactly one processed record")
    void testConcurrentDeliveries() throws InterruptedException {
        UUID eventId = UUID.randomUUID();
        UUID aggregateId = UUID.randomUUID();
        AtomicInteger committed = new AtomicInteger();

        int threadCount = 8;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);

        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    Optional<Boolean> result = eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE,
                        aggregateId, CONSUMER_GROUP, () -> Boolean.TRUE);
                    if (result.isPresent()) {
                        committed.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (RuntimeException e) {
                    // losers of the insert race roll back
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(1, committed.get());
        assertTrue(eventProcessor.isAlreadyProcessed(eventId, CONSUMER_GROUP));
    }
}
