package com.flagship.recon_ledger.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.recon_ledger.exception.NotFoundException;
import com.flagship.recon_ledger.statement.IngestionResult;
import com.flagship.recon_ledger.statement.dto.StatementSubmissionRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Consumes the extractor's structured statements.
 *
 * Message shape: {@code {"eventId": ..., "eventType": "StatementExtracted", "statement": {...}}}
 * where {@code statement} has the same fields as a POST /api/statements body. Offsets are
 * acknowledged manually after processing. Malformed or rejected messages are recorded as
 * skipped and acknowledged; any other failure is not acknowledged and will be redelivered.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class StatementExtractionConsumer {

    static final String CONSUMER_GROUP = "statement-extraction-consumer";
    static final String EVENT_TYPE = "StatementExtracted";
    private static final String AGGREGATE_TYPE = "Statement";

    private final IdempotentEventProcessor eventProcessor;
    private final StatementExtractionHandler handler;
    private final ObjectMapper objectMapper;
    private final Validator validator;

    @KafkaListener(
        topics = "${kafka.topic.statement-extractions:statement-extractions}",
        groupId = "${spring.kafka.consumer.group-id:recon-ledger-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
            record.topic(), record.partition(), record.offset(), record.key());

        Optional<Envelope> parsed = parse(record.value());
        if (parsed.isEmpty()) {
            log.warn("Could not parse statement message at offset {}, acknowledging to skip", record.offset());
            ack.acknowledge();
            return;
        }
        Envelope envelope = parsed.get();

        if (!EVENT_TYPE.equals(envelope.getEventType())) {
            eventProcessor.skipEvent(envelope.getEventId(), envelope.getEventType(), AGGREGATE_TYPE,
                envelope.aggregateId(), CONSUMER_GROUP, "Unknown event type");
            ack.acknowledge();
            return;
        }

        Set<ConstraintViolation<StatementSubmissionRequest>> violations = validator.validate(envelope.getStatement());
        if (!violations.isEmpty()) {
            eventProcessor.skipEvent(envelope.getEventId(), envelope.getEventType(), AGGREGATE_TYPE,
                envelope.aggregateId(), CONSUMER_GROUP, "Invalid statement: " + violations.iterator().next().getMessage());
            log.warn("Skipping invalid statement event {}: {} violation(s)", envelope.getEventId(), violations.size());
            ack.acknowledge();
            return;
        }

        Optional<IngestionResult> result;
        try {
            result = eventProcessor.processEvent(envelope.getEventId(), envelope.getEventType(),
                AGGREGATE_TYPE, envelope.aggregateId(), CONSUMER_GROUP,
                () -> handler.ingest(envelope.getStatement()));
        } catch (NotFoundException | IllegalArgumentException e) {
            // Redelivery cannot fix an unknown or inactive account.
            eventProcessor.skipEvent(envelope.getEventId(), envelope.getEventType(), AGGREGATE_TYPE,
                envelope.aggregateId(), CONSUMER_GROUP, "Rejected: " + e.getMessage());
            ack.acknowledge();
            return;
        }
        ack.acknowledge();

        result.ifPresent(this::autoRun);
    }

    private void autoRun(IngestionResult result) {
        try {
            handler.afterCommit(result);
        } catch (RuntimeException e) {
            log.error("Auto-run after ingestion failed: batchId={}", result.getBatch().getId(), e);
        }
    }

    Optional<Envelope> parse(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            JsonNode statementNode = node.get("statement");
            if (!node.hasNonNull("eventId") || statementNode == null || statementNode.isNull()) {
                return Optional.empty();
            }
            UUID eventId = UUID.fromString(node.get("eventId").asText());
            String eventType = node.hasNonNull("eventType") ? node.get("eventType").asText() : EVENT_TYPE;
            StatementSubmissionRequest statement = objectMapper.treeToValue(statementNode, StatementSubmissionRequest.class);
            return Optional.of(new Envelope(eventId, eventType, statement));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to parse statement envelope: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @Value
    static class Envelope {
        UUID eventId;
        String eventType;
        StatementSubmissionRequest statement;

        UUID aggregateId() {
            return statement.getSourceAccountId() == null ? eventId : statement.getSourceAccountId();
        }
    }
}
