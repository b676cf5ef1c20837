package com.flagship.recon_ledger.outbox;

import com.flagship.recon_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Polls the outbox and publishes events to Kafka.
 *
 * Journal entry events go to the ledger topic; match and consistency-check events go to
 * the reconciliation topic. The aggregate id is the record key, so events of one
 * aggregate stay ordered within a partition. Sends are synchronous; an event is marked
 * published only after the broker acknowledged it.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    static final String JOURNAL_ENTRY_AGGREGATE = "JournalEntry";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.ledger-events:ledger-events}")
    private String ledgerEventsTopic;

    @Value("${kafka.topic.reconciliation-events:reconciliation-events}")
    private String reconciliationEventsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> events;
        try {
            events = outboxService.findUnpublishedEvents(batchSize, maxRetries);
        } catch (RuntimeException e) {
            log.error("Outbox poll failed", e);
            return;
        }
        if (events.isEmpty()) {
            return;
        }

        log.debug("Found {} unpublished events to process", events.size());
        for (OutboxEvent event : events) {
            publishEvent(event);
        }
    }

    private void publishEvent(OutboxEvent event) {
        String topic = topicFor(event);
        try {
            SendResult<String, String> result =
                kafkaTemplate.send(topic, event.getAggregateId().toString(), event.getPayload()).get();

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                event.getId(), topic, result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset(), event.getEventType());
            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while publishing event {}", event.getId());
            outboxService.markFailed(event.getId(), "interrupted");
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                event.getId(), event.getEventType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());
            if (event.getRetryCount() + 1 >= maxRetries) {
                log.warn("Event {} reached max retries ({}) and is dead-lettered: eventType={}, aggregateId={}",
                    event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }

    String topicFor(OutboxEvent event) {
        return switch (event.getAggregateType()) {
            case JOURNAL_ENTRY_AGGREGATE -> ledgerEventsTopic;
            default -> reconciliationEventsTopic;
        };
    }
}
