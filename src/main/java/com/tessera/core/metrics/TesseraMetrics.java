package com.tessera.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for Tessera planning requests.
 */
@Service
public class TesseraMetrics {

    private final MeterRegistry registry;

    public TesseraMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordParseResult(String strategy, String confidence) {
        Counter.builder("tessera.parse.results")
                .description("Parse chain results by winning strategy")
                .tag("strategy", strategy)
                .tag("confidence", confidence.toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordAssignmentPath(String path, boolean degraded) {
        Counter.builder("tessera.assignment.path")
                .description("Assignments by the path that produced them")
                .tag("path", path.toLowerCase(Locale.ROOT))
                .tag("degraded", String.valueOf(degraded))
                .register(registry)
                .increment();
    }

    /**
     * Records ids dropped while validating an optimizer proposal.
     *
     * @param kind  "participant" or "item"
     * @param count how many were dropped
     */
    public void recordDroppedIds(String kind, int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder("tessera.assignment.dropped_ids")
                .description("Unknown ids dropped from optimizer proposals")
                .tag("kind", kind)
                .register(registry)
                .increment(count);
    }

    public void recordConsensusDecision(String type) {
        Counter.builder("tessera.consensus.decisions")
                .tag("type", type.toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordGenerationFailure(String kind) {
        Counter.builder("tessera.generation.failures")
                .tag("kind", kind.toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordPlanningDuration(long ms) {
        Timer.builder("tessera.planning.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordItemCount(int count) {
        DistributionSummary.builder("tessera.planning.item_count")
                .description("Work items per planning request")
                .register(registry)
                .record(count);
    }
}
