package com.flagship.general_ledger.observability;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the outbox backlog from the cached metric values.
 * Dead-lettered events degrade the status, since they need manual intervention.
 */
@Component("outboxHealth")
public class OutboxHealthIndicator implements HealthIndicator {

    static final long BACKLOG_WARNING_THRESHOLD = 1000;
    static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

    private final OutboxMetrics outboxMetrics;

    public OutboxHealthIndicator(OutboxMetrics outboxMetrics) {
        this.outboxMetrics = outboxMetrics;
    }

    @Override
    public Health health() {
        long backlogSize = outboxMetrics.getBacklogSize();
        long deadLettered = outboxMetrics.getDeadLetterCount();

        Health.Builder builder;
        if (backlogSize >= BACKLOG_CRITICAL_THRESHOLD) {
            builder = Health.down();
        } else if (backlogSize >= BACKLOG_WARNING_THRESHOLD || deadLettered > 0) {
            builder = Health.status("WARNING");
        } else {
            builder = Health.up();
        }

        return builder
            .withDetail("backlogSize", backlogSize)
            .withDetail("deadLettered", deadLettered)
            .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
            .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
            .build();
    }
}
