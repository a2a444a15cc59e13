package com.flagship.general_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation id for the current ledger operation.
 *
 * A posting, a void or a reconciliation run each carry one id through every
 * log line they produce (via MDC), so that the projection and mirror work
 * that follows a commit can be traced back to the call that caused it.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ENTRY_NUMBER_MDC_KEY = "entryNumber";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Gets the current correlation ID, or generates a new one if not set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short random id; eight hex characters are enough to tell operations
     * apart in a log.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static boolean hasCorrelationId() {
        return correlationId.get() != null;
    }

    /**
     * Opens a logging scope: puts the correlation id into MDC and reports
     * whether this call created it. Pass the result to {@link #close(boolean)}.
     */
    public static boolean open() {
        boolean owner = !hasCorrelationId();
        MDC.put(CORRELATION_ID_MDC_KEY, getCorrelationId());
        return owner;
    }

    /**
     * Ends a scope opened with {@link #open()}. Only the scope that created
     * the correlation id removes it.
     */
    public static void close(boolean owner) {
        MDC.remove(ENTRY_NUMBER_MDC_KEY);
        if (owner) {
            MDC.remove(CORRELATION_ID_MDC_KEY);
            clear();
        }
    }
}
