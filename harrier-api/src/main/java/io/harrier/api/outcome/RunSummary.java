package io.harrier.api.outcome;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregated result of a run.
 *
 * @param counts    finished units per outcome kind (every kind present, possibly zero)
 * @param cancelled units that were never scheduled because the run was cancelled
 */
public record RunSummary(
        Instant startTime,
        Instant endTime,
        Duration totalDuration,
        Map<Outcome.Kind, Integer> counts,
        int cancelled,
        boolean cancellationRequested
) {

    public RunSummary {
        EnumMap<Outcome.Kind, Integer> all = new EnumMap<>(Outcome.Kind.class);
        for (Outcome.Kind kind : Outcome.Kind.values()) {
            all.put(kind, counts.getOrDefault(kind, 0));
        }
        counts = Collections.unmodifiableMap(all);
    }

    public int count(Outcome.Kind kind) {
        return counts.get(kind);
    }

    public int finished() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int total() {
        return finished() + cancelled;
    }

    public boolean isSuccessful() {
        return count(Outcome.Kind.FAILED) == 0
                && count(Outcome.Kind.ERRORED) == 0
                && count(Outcome.Kind.PANICKED) == 0;
    }

    /**
     * @return 0 when no finished unit failed, errored or crashed, 1 otherwise
     */
    public int exitCode() {
        return isSuccessful() ? 0 : 1;
    }
}
