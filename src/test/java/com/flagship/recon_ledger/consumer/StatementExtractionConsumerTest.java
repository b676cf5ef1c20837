package com.flagship.recon_ledger.consumer;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.flagship.recon_ledger.exception.NotFoundException;
import com.flagship.recon_ledger.statement.TransactionDirection;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.Acknowledgment;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Message handling of the statement consumer, without a broker.
 *
 * These tests verify that:
 * - Unparseable and invalid messages are skipped and acknowledged
 * - Rejections that redelivery cannot fix are skipped and acknowledged
 * - Other failures are left unacknowledged for redelivery
 */
@ExtendWith(MockitoExtension.class)
class StatementExtractionConsumerTest {

    @Mock
    private IdempotentEventProcessor eventProcessor;

    @Mock
    private StatementExtractionHandler handler;

    @Mock
    private Acknowledgment ack;

    private StatementExtractionConsumer consumer;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        Validator validator = Validation.buildDefaultValidatorFactory().getValidator();
        consumer = new StatementExtractionConsumer(eventProcessor, handler, objectMapper, validator);
    }

    @Test
    @DisplayName("Envelope is parsed with snake_case statement fields")
    void testParse() {
        UUID eventId = UUID.randomUUID();
        UUID accountId = UUID.randomUUID();

        Optional<StatementExtractionConsumer.Envelope> envelope = consumer.parse(message(eventId, accountId, "12.50"));

        assertTrue(envelope.isPresent());
        assertEquals(eventId, envelope.get().getEventId());
        assertEquals(accountId, envelope.get().aggregateId());
        assertEquals(0, new BigDecimal("12.50").compareTo(
            envelope.get().getStatement().getTransactions().get(0).getAmount()));
        assertEquals(TransactionDirection.OUT, envelope.get().getStatement().getTransactions().get(0).getDirection());
    }

    @Test
    @DisplayName("Garbage is acknowledged without processing")
    void testGarbageSkipped() {
        consumer.consume(record("not json"), ack);

        verify(ack).acknowledge();
        verifyNoInteractions(eventProcessor);
    }

    @Test
    @DisplayName("Statement failing validation is recorded as skipped")
    void testInvalidStatementSkipped() {
        UUID eventId = UUID.randomUUID();
        consumer.consume(record(message(eventId, UUID.randomUUID(), "0.00")), ack);

        verify(eventProcessor).skipEvent(eq(eventId), eq("StatementExtracted"), anyString(), any(),
            eq(StatementExtractionConsumer.CONSUMER_GROUP), anyString());
        verify(eventProcessor, never()).processEvent(any(), anyString(), anyString(), any(), anyString(), any());
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Unknown account is skipped and acknowledged")
    void testUnknownAccountSkipped() {
        UUID eventId = UUID.randomUUID();
        UUID accountId = UUID.randomUUID();
        when(eventProcessor.processEvent(eq(eventId), anyString(), anyString(), any(), anyString(), any()))
            .thenThrow(new NotFoundException("Account", accountId));

        consumer.consume(record(message(eventId, accountId, "12.50")), ack);

        verify(eventProcessor).skipEvent(eq(eventId), anyString(), anyString(), eq(accountId),
            eq(StatementExtractionConsumer.CONSUMER_GROUP), anyString());
        verify(ack).acknowledge();
        verify(handler, never()).afterCommit(any());
    }

    @Test
    @DisplayName("Transient failure propagates without acknowledgment")
    void testTransientFailureNotAcknowledged() {
        UUID eventId = UUID.randomUUID();
        when(eventProcessor.processEvent(eq(eventId), anyString(), anyString(), any(), anyString(), any()))
            .thenThrow(new IllegalStateException("database unavailable"));

        ConsumerRecord<String, String> record = record(message(eventId, UUID.randomUUID(), "12.50"));
        assertThrows(IllegalStateException.class, () -> consumer.consume(record, ack));

        verify(ack, never()).acknowledge();
    }

    @Test
    @DisplayName("Duplicate event is acknowledged without an auto-run")
    void testDuplicateAcknowledged() {
        UUID eventId = UUID.randomUUID();
        when(eventProcessor.processEvent(eq(eventId), anyString(), anyString(), any(), anyString(), any()))
            .thenReturn(Optional.empty());

        consumer.consume(record(message(eventId, UUID.randomUUID(), "12.50")), ack);

        verify(ack).acknowledge();
        verify(handler, never()).afterCommit(any());
    }

    private static ConsumerRecord<String, String> record(String value) {
        return new ConsumerRecord<>("statement-extractions", 0, 0L, "key", value);
    }

    private static String message(UUID eventId, UUID accountId, String amount) {
        return String.format("""
            {
              "eventId": "%s",
              "eventType": "StatementExtracted",
              "statement": {
                "source_account_id": "%s",
                "opening_balance": 100.00,
                "closing_balance": 87.50,
                "currency": "USD",
                "extractor_balance_ok": true,
                "transactions": [
                  {"txn_date": "2024-04-02", "amount": %s, "direction": "OUT", "description": "Coffee beans"}
                ]
              }
            }
            """, eventId, accountId, amount);
    }
}
