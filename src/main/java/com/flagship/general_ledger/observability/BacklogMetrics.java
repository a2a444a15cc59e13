package com.flagship.general_ledger.observability;

import com.flagship.general_ledger.outbox.OutboxEventRepository;
import com.flagship.general_ledger.reconciliation.BalanceRepairQueue;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Work the ledger still owes downstream: journal events not yet relayed and
 * accounts whose balances are waiting for repair.
 *
 * Gauges expose values cached by {@link MetricsScheduler}; a scrape never
 * queries the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BacklogMetrics {

    private final OutboxEventRepository outboxRepository;
    private final BalanceRepairQueue repairQueue;
    private final MeterRegistry meterRegistry;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    private final AtomicLong pendingEvents = new AtomicLong();
    private final AtomicLong oldestPendingSeconds = new AtomicLong();
    private final AtomicLong deadLetteredEvents = new AtomicLong();
    private final AtomicLong queuedRepairs = new AtomicLong();

    @PostConstruct
    public void registerGauges() {
        Gauge.builder("ledger.outbox.pending", pendingEvents, AtomicLong::get)
                .description("Journal events waiting to be published")
                .register(meterRegistry);
        Gauge.builder("ledger.outbox.oldest.age.seconds", oldestPendingSeconds, AtomicLong::get)
                .description("Age of the oldest unpublished journal event")
                .register(meterRegistry);
        Gauge.builder("ledger.outbox.dead_lettered", deadLetteredEvents, AtomicLong::get)
                .description("Journal events that ran out of publish attempts")
                .register(meterRegistry);
        Gauge.builder("ledger.repair.queue.size", queuedRepairs, AtomicLong::get)
                .description("Accounts with stale projected balances or mirrors")
                .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refresh() {
        try {
            pendingEvents.set(outboxRepository.countUnpublished());
            oldestPendingSeconds.set(outboxRepository.findOldestUnpublishedCreatedAt()
                    .map(oldest -> Math.max(0L, Duration.between(oldest, Instant.now()).getSeconds()))
                    .orElse(0L));
            deadLetteredEvents.set(outboxRepository.countDeadLettered(maxRetries));
            queuedRepairs.set(repairQueue.size());

            log.debug("Backlog refreshed: pendingEvents={}, oldest={}s, deadLettered={}, repairs={}",
                    pendingEvents.get(), oldestPendingSeconds.get(), deadLetteredEvents.get(), queuedRepairs.get());
        } catch (Exception e) {
            log.warn("Failed to refresh backlog metrics: {}", e.getMessage());
        }
    }

    public long getPendingEvents() {
        return pendingEvents.get();
    }

    public long getQueuedRepairs() {
        return queuedRepairs.get();
    }

    public void recordPublished(String eventType) {
        meterRegistry.counter("ledger.outbox.publish", "event_type", eventType, "outcome", "success").increment();
    }

    public void recordPublishFailed(String eventType) {
        meterRegistry.counter("ledger.outbox.publish", "event_type", eventType, "outcome", "failure").increment();
    }

    public void recordDeadLettered(String eventType) {
        meterRegistry.counter("ledger.outbox.publish", "event_type", eventType, "outcome", "dead_letter").increment();
    }
}
