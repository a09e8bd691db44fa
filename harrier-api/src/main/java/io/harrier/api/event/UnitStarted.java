package io.harrier.api.event;

import io.harrier.api.test.TestInfo;

import java.time.Instant;

public record UnitStarted(String unitId, String project, TestInfo test, Instant timestamp) implements UnitEvent {
}
