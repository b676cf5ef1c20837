package com.flagship.recon_ledger.consumer;

import com.flagship.recon_ledger.observability.ReconciliationMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Runs an event handler at most once per event and consumer group.
 *
 * The processed-event row is written in the handler's transaction, so a handler that
 * throws leaves no row behind and the event is retried on redelivery.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;
    private final ReconciliationMetrics metrics;

    /**
     * @return the handler's result, or empty if this group already handled the event
     */
    @Transactional
    public <T> Optional<T> processEvent(UUID eventId, String eventType, String aggregateType, UUID aggregateId,
                                        String consumerGroup, Supplier<T> handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            metrics.recordEventProcessed(eventType, false);
            return Optional.empty();
        }

        T result;
        try {
            result = handler.get();
        } catch (RuntimeException e) {
            metrics.recordEventProcessingFailure(eventType, e.getClass().getSimpleName());
            log.error("Failed to process event {} by consumer group {}: {}", eventId, consumerGroup, e.getMessage(), e);
            throw e;
        }

        repository.save(ProcessedEventEntity.fromDomain(
            ProcessedEvent.success(eventId, eventType, aggregateType, aggregateId, consumerGroup)));
        metrics.recordEventProcessed(eventType, true);
        log.debug("Processed event {} by consumer group {}", eventId, consumerGroup);
        return Optional.ofNullable(result);
    }

    /**
     * Marks an event this consumer does not handle, so replays do not reconsider it.
     */
    @Transactional
    public void skipEvent(UUID eventId, String eventType, String aggregateType, UUID aggregateId,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }
        repository.save(ProcessedEventEntity.fromDomain(
            ProcessedEvent.skipped(eventId, eventType, aggregateType, aggregateId, consumerGroup, reason)));
        log.debug("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
    }

    @Transactional(readOnly = true)
    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }
}
