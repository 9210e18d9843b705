package com.trendwatch.core.trend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-trend outcome of one step of a cycle (sample extraction or
 * rendering), in registry order.
 *
 * @since 1.0.0
 */
public final class StepResult {

    private final List<String> succeeded;
    private final List<String> skipped;
    private final Map<String, String> failed;

    private StepResult(List<String> succeeded, List<String> skipped, Map<String, String> failed) {
        this.succeeded = Collections.unmodifiableList(succeeded);
        this.skipped = Collections.unmodifiableList(skipped);
        this.failed = Collections.unmodifiableMap(failed);
    }

    /**
     * @return names of trends the step completed for
     */
    public List<String> getSucceeded() {
        return succeeded;
    }

    /**
     * @return names of trends the step did not apply to
     */
    public List<String> getSkipped() {
        return skipped;
    }

    /**
     * @return failure message per trend name
     */
    public Map<String, String> getFailed() {
        return failed;
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }

    @Override
    public String toString() {
        return "StepResult{" +
                "succeeded=" + succeeded.size() +
                ", skipped=" + skipped.size() +
                ", failed=" + failed.keySet() +
                '}';
    }

    /** Accumulates outcomes while a registry iterates its trends. */
    static final class Collector {
        private final List<String> succeeded = new ArrayList<>();
        private final List<String> skipped = new ArrayList<>();
        private final Map<String, String> failed = new LinkedHashMap<>();

        void succeeded(String trend) {
            succeeded.add(trend);
        }

        void skipped(String trend) {
            skipped.add(trend);
        }

        void failed(String trend, String message) {
            failed.put(trend, message);
        }

        StepResult build() {
            return new StepResult(new ArrayList<>(succeeded), new ArrayList<>(skipped),
                    new LinkedHashMap<>(failed));
        }
    }
}
