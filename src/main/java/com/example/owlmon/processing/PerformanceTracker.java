package com.example.owlmon.processing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Measures the wall-clock time of named phases (automaton construction, trimming, stepping).
 * Repeated phases accumulate.
 */
public class PerformanceTracker {
    private static final Logger LOGGER = LoggerFactory.getLogger(PerformanceTracker.class);

    private final Map<String, Long> startTimes = new LinkedHashMap<>();
    private final Map<String, Long> durations = new LinkedHashMap<>();
    private final Map<String, Integer> invocations = new LinkedHashMap<>();

    public void start(String phase) {
        startTimes.put(phase, System.currentTimeMillis());
    }

    public void end(String phase) {
        Long startTime = startTimes.remove(phase);
        if (startTime == null) {
            LOGGER.warn("No start time found for phase: {}", phase);
            return;
        }
        long duration = System.currentTimeMillis() - startTime;
        durations.merge(phase, duration, Long::sum);
        invocations.merge(phase, 1, Integer::sum);
        LOGGER.debug("Phase '{}' took {} ms", phase, duration);
    }

    /**
     * Runs {@code work} as one occurrence of {@code phase}.
     */
    public <T> T time(String phase, Supplier<T> work) {
        start(phase);
        try {
            return work.get();
        } finally {
            end(phase);
        }
    }

    public long getDuration(String phase) {
        return durations.getOrDefault(phase, 0L);
    }

    public void logSummary() {
        LOGGER.info("=== Performance Summary ===");
        durations.forEach((phase, duration) -> {
            int count = invocations.getOrDefault(phase, 1);
            if (count > 1) {
                LOGGER.info("{}: {} ms over {} runs ({} ms avg)", phase, duration, count, duration / count);
            } else {
                LOGGER.info("{}: {} ms", phase, duration);
            }
        });
    }
}
