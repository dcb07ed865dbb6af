// com/implgraph/processing/PerformanceTracker.java
package com.implgraph.processing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Accumulates wall-clock time per pipeline phase across all rule files of a run.
 */
public class PerformanceTracker {
    private static final Logger LOGGER = LoggerFactory.getLogger(PerformanceTracker.class);

    private final Map<String, Long> startTimes = new LinkedHashMap<>();
    private final Map<String, Long> totals = new LinkedHashMap<>();

    public void start(String phase) {
        startTimes.put(phase, System.nanoTime());
    }

    public void end(String phase) {
        Long startTime = startTimes.remove(phase);
        if (startTime == null) {
            LOGGER.warn("No start time found for phase: {}", phase);
            return;
        }
        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000L;
        totals.merge(phase, elapsedMs, Long::sum);
        LOGGER.debug("Phase '{}' took {} ms", phase, elapsedMs);
    }

    public void logSummary() {
        LOGGER.info("=== Performance Summary ===");
        totals.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .forEach(entry -> LOGGER.info("{}: {} ms", entry.getKey(), entry.getValue()));
    }
}
