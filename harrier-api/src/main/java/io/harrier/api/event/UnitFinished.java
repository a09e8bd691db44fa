package io.harrier.api.event;

import io.harrier.api.outcome.Outcome;
import io.harrier.api.test.TestInfo;

import java.time.Instant;

public record UnitFinished(String unitId, String project, TestInfo test, Outcome outcome, Instant timestamp)
        implements UnitEvent {
}
