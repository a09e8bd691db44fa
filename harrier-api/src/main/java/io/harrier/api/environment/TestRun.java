package io.harrier.api.environment;

import io.harrier.api.outcome.RunSummary;

import java.util.concurrent.CompletableFuture;

/**
 * Handle to a started run. Allows monitoring status and cancelling it.
 */
public interface TestRun {

    /**
     * @return true until every lane has finished
     */
    boolean isRunning();

    /**
     * Stop scheduling new units. Units already running finish normally and
     * the run still completes with a summary.
     */
    void cancel();

    /**
     * @return future completed with the summary once the run finished and subscribers drained
     */
    CompletableFuture<RunSummary> result();

    /**
     * @return number of units currently running
     */
    int runningUnits();

    RunState state();

    enum RunState {
        RUNNING,
        CANCELLING,
        COMPLETED
    }
}
