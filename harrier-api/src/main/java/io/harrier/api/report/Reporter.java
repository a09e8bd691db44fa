package io.harrier.api.report;

import io.harrier.api.event.*;

/**
 * Event subscriber with one callback per event type. Override the ones you need.
 * <p>
 * Exceptions thrown from a callback are logged by the bus and do not affect
 * the run or other reporters.
 */
public interface Reporter extends EventSubscriber {

    @Override
    default void onEvent(RunEvent event) {
        if (event instanceof UnitStarted started) {
            onStart(started);
        } else if (event instanceof CheckEvaluated check) {
            onCheck(check);
        } else if (event instanceof UnitRetried retried) {
            onRetry(retried);
        } else if (event instanceof UnitFinished finished) {
            onEnd(finished);
        } else if (event instanceof RunStarted started) {
            onRunStarted(started);
        } else if (event instanceof RunFinished finished) {
            onRunFinished(finished);
        }
    }

    default void onRunStarted(RunStarted event) {}

    default void onStart(UnitStarted event) {}

    default void onCheck(CheckEvaluated event) {}

    default void onRetry(UnitRetried event) {}

    default void onEnd(UnitFinished event) {}

    default void onRunFinished(RunFinished event) {}
}
