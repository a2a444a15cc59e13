package com.flagship.general_ledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Typed view of the {@code ledger.*} settings.
 */
@ConfigurationProperties(prefix = "ledger")
@Getter
@Setter
public class LedgerProperties {

    private Hierarchy hierarchy = new Hierarchy();
    private Reconciliation reconciliation = new Reconciliation();
    private Idempotency idempotency = new Idempotency();

    @Getter
    @Setter
    public static class Hierarchy {
        /**
         * Deepest allowed level in the chart of accounts (root = 1). Also
         * bounds every ancestor walk, so a corrupted parent chain cannot loop.
         */
        private int maxDepth = 8;
    }

    @Getter
    @Setter
    public static class Reconciliation {
        private boolean enabled = true;
        private long repairIntervalMs = 30_000;
        private long sweepIntervalMs = 300_000;
        private int repairBatchSize = 100;
    }

    @Getter
    @Setter
    public static class Idempotency {
        private Cache cache = new Cache();
    }

    @Getter
    @Setter
    public static class Cache {
        private boolean enabled = true;
        private Duration ttl = Duration.ofDays(7);
    }
}
