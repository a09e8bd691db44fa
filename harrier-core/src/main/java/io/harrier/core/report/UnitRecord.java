package io.harrier.core.report;

import io.harrier.api.check.CheckFailure;
import io.harrier.api.event.UnitFinished;
import io.harrier.api.outcome.Outcome;

import java.time.Instant;
import java.util.List;

/**
 * Flat, serializable view of one finished unit used by the file reports.
 */
public record UnitRecord(
        String project,
        String module,
        String test,
        String outcome,
        Instant startedAt,
        Instant finishedAt,
        long durationMs,
        String detail,
        String location,
        List<CheckFailure> failures
) {

    public static UnitRecord of(UnitFinished event) {
        Outcome outcome = event.outcome();
        String detail = null;
        String location = null;
        List<CheckFailure> failures = List.of();

        if (outcome instanceof Outcome.Failed failed) {
            failures = failed.failures();
            detail = failures.size() + " check(s) failed";
        } else if (outcome instanceof Outcome.Errored errored) {
            detail = errored.cause();
        } else if (outcome instanceof Outcome.Panicked panicked) {
            detail = panicked.message();
            location = panicked.location();
        } else if (outcome instanceof Outcome.Skipped skipped) {
            detail = skipped.reason();
        }

        return new UnitRecord(
                event.project(),
                event.test().module(),
                event.test().displayName(),
                outcome.kind().name(),
                outcome.startedAt(),
                outcome.finishedAt(),
                outcome.duration().toMillis(),
                detail,
                location,
                failures
        );
    }
}
