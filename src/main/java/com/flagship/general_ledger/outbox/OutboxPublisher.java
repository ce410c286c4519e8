package com.flagship.general_ledger.outbox;

import com.flagship.general_ledger.config.LedgerProperties;
import com.flagship.general_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Polls the outbox and publishes ledger events to Kafka, keyed by aggregate id.
 *
 * Sends are synchronous so that an event is only marked published after the broker
 * acknowledged it. Failed sends increment the retry count; events that reach
 * {@code outbox.publisher.max-retries} stop being polled and are counted as dead letters.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;
    private final LedgerProperties properties;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Scheduled(fixedDelayString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> events;
        try {
            events = outboxService.findPublishableEvents(batchSize, maxRetries);
        } catch (RuntimeException e) {
            log.error("Could not fetch outbox events", e);
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

    void publishEvent(OutboxEvent event) {
        String topic = properties.getEvents().getTopic();
        String key = event.getAggregateId().toString();

        try {
            SendResult<String, String> result = kafkaTemplate.send(topic, key, event.getPayload())
                .get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                event.getId(),
                result.getRecordMetadata().topic(),
                result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset(),
                event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, "Interrupted while publishing");
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            recordFailure(event, e.getMessage());
        }
    }

    private void recordFailure(OutboxEvent event, String error) {
        log.error("Failed to publish event: eventId={}, eventType={}, error={}",
            event.getId(), event.getEventType(), error);
        outboxService.markFailed(event.getId(), error);
        outboxMetrics.recordEventPublishFailed(event.getEventType());
        if (event.getRetryCount() + 1 >= maxRetries) {
            log.warn("Event {} reached max retries ({}), moving to dead letter. eventType={}, aggregateId={}",
                event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
            outboxMetrics.recordEventDeadLettered(event.getEventType());
        }
    }
}
