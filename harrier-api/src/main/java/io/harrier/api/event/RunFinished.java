package io.harrier.api.event;

import io.harrier.api.outcome.RunSummary;

import java.time.Instant;

public record RunFinished(RunSummary summary, Instant timestamp) implements RunEvent {
}
