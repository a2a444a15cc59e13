package com.flagship.general_ledger.observability;

import com.flagship.general_ledger.ledger.ConsistencyWarning;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.postings: Counter of posting outcomes, tagged source_type and status
 * - ledger.posting.latency: Timer for the posting path, tagged operation
 * - ledger.idempotency.cache: Counter of fast-path lookups, tagged result
 * - ledger.projection.failures: Counter of projections that failed after commit
 * - ledger.mirror.failures: Counter of mirror refreshes that failed after commit
 * - ledger.consistency.warnings: Counter of detected drifts, tagged kind
 * - ledger.repairs: Counter of accounts repaired from the repair queue
 */
@Component
public class LedgerMetrics {

    public static final String STATUS_POSTED = "posted";
    public static final String STATUS_DRAFTED = "drafted";
    public static final String STATUS_DUPLICATE = "duplicate";
    public static final String STATUS_VOIDED = "voided";
    public static final String STATUS_REJECTED_VALIDATION = "rejected_validation";
    public static final String STATUS_REJECTED_UNBALANCED = "rejected_unbalanced";
    public static final String STATUS_ERROR = "error";

    private final MeterRegistry registry;

    private final Counter projectionFailures;
    private final Counter mirrorFailures;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.projectionFailures = Counter.builder("ledger.projection.failures")
                .description("Balance projections that failed after the entry committed")
                .register(registry);

        this.mirrorFailures = Counter.builder("ledger.mirror.failures")
                .description("Operational mirror refreshes that failed after the entry committed")
                .register(registry);
    }

    public void recordPosting(String sourceType, String status) {
        registry.counter("ledger.postings",
                "source_type", sanitizeTag(sourceType),
                "status", status
        ).increment();
    }

    public void recordPostingLatency(String operation, Duration duration) {
        Timer.builder("ledger.posting.latency")
                .description("Time from proposal to committed and projected entry")
                .tag("operation", operation)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(duration);
    }

    public void recordIdempotencyHit() {
        registry.counter("ledger.idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("ledger.idempotency.cache", "result", "miss").increment();
    }

    public void recordProjectionFailure() {
        projectionFailures.increment();
    }

    public void recordMirrorFailure() {
        mirrorFailures.increment();
    }

    public void recordConsistencyWarning(ConsistencyWarning.Kind kind) {
        registry.counter("ledger.consistency.warnings", "kind", kind.name()).increment();
    }

    public void recordRepair(String outcome) {
        registry.counter("ledger.repairs", "outcome", outcome).increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
