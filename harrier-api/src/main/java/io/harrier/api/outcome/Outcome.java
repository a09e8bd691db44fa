package io.harrier.api.outcome;

import io.harrier.api.check.CheckFailure;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Terminal classification of one run unit.
 */
public interface Outcome {

    Kind kind();

    Instant startedAt();

    Instant finishedAt();

    default Duration duration() {
        return Duration.between(startedAt(), finishedAt());
    }

    /**
     * @return true for outcomes that do not make the run fail
     */
    default boolean isSuccessful() {
        return kind() == Kind.PASSED || kind() == Kind.SKIPPED;
    }

    enum Kind {
        PASSED,
        FAILED,
        ERRORED,
        PANICKED,
        SKIPPED
    }

    record Passed(Instant startedAt, Instant finishedAt) implements Outcome {
        @Override
        public Kind kind() { return Kind.PASSED; }
    }

    /**
     * One or more checks failed; failures are kept in the order the body made them.
     */
    record Failed(List<CheckFailure> failures, Instant startedAt, Instant finishedAt) implements Outcome {
        public Failed {
            failures = List.copyOf(failures);
        }

        @Override
        public Kind kind() { return Kind.FAILED; }
    }

    /**
     * The body reported an error.
     */
    record Errored(String cause, Instant startedAt, Instant finishedAt) implements Outcome {
        @Override
        public Kind kind() { return Kind.ERRORED; }
    }

    /**
     * The body crashed. {@code location} is the innermost frame, when known.
     */
    record Panicked(String message, String location, Instant startedAt, Instant finishedAt) implements Outcome {
        @Override
        public Kind kind() { return Kind.PANICKED; }
    }

    record Skipped(String reason, Instant startedAt, Instant finishedAt) implements Outcome {
        @Override
        public Kind kind() { return Kind.SKIPPED; }
    }
}
