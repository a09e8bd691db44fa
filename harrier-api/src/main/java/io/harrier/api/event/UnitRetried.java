package io.harrier.api.event;

import io.harrier.api.outcome.Outcome;
import io.harrier.api.test.TestInfo;

import java.time.Duration;
import java.time.Instant;

/**
 * An attempt did not pass and the unit will be executed again after {@code delay}.
 *
 * @param attempt zero based retry attempt about to be made
 */
public record UnitRetried(String unitId, String project, TestInfo test, int attempt, Duration delay,
                          Outcome previous, Instant timestamp) implements UnitEvent {
}
