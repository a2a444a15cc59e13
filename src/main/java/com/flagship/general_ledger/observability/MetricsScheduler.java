package com.flagship.general_ledger.observability;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Re-reads backlog gauges on a fixed rate.
 */
@Component
@RequiredArgsConstructor
public class MetricsScheduler {

    private final BacklogMetrics backlogMetrics;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}",
               initialDelayString = "${metrics.refresh.initial-delay:5000}")
    public void refreshBacklog() {
        backlogMetrics.refresh();
    }
}
