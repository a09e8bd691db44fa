package io.harrier.api.event;

import java.time.Instant;

/**
 * Immutable lifecycle or check event published during a run.
 * <p>
 * For a single unit the order is causal: {@link UnitStarted}, then any
 * {@link CheckEvaluated} / {@link UnitRetried}, then {@link UnitFinished}.
 * Events of different units interleave freely.
 */
public interface RunEvent {

    Instant timestamp();
}
