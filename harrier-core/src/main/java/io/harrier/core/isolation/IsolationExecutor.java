package io.harrier.core.isolation;

import io.harrier.api.check.AssertionFailure;
import io.harrier.api.check.CheckFailure;
import io.harrier.api.check.SkippedException;
import io.harrier.api.context.ContextMissingException;
import io.harrier.api.context.ContextScope;
import io.harrier.api.context.TestContext;
import io.harrier.api.event.UnitFinished;
import io.harrier.api.event.UnitRetried;
import io.harrier.api.outcome.Outcome;
import io.harrier.api.project.RetryPolicy;
import io.harrier.api.test.RunUnit;
import io.harrier.core.bus.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the body of one unit and turns whatever happens into an {@link Outcome}.
 * <p>
 * Nothing thrown by a body escapes: checked exceptions become {@code Errored},
 * recorded check failures become {@code Failed}, unchecked exceptions and
 * errors become {@code Panicked}, {@link io.harrier.api.check.Checks#skip(String)}
 * becomes {@code Skipped}. A missing test context anywhere in the cause chain
 * is reported as {@code Errored}. Exceptions of sub-work the body joined are
 * classified by their cause.
 * <p>
 * Attempts that errored or failed are repeated according to the project's
 * {@link RetryPolicy}; crashes are never retried. {@code UnitFinished} is
 * published once, with the outcome of the last attempt.
 */
public class IsolationExecutor {

    private static final Logger log = LoggerFactory.getLogger(IsolationExecutor.class);

    private final EventBus bus;
    private final Executor workers;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    public IsolationExecutor(EventBus bus, Executor workers, ScheduledExecutorService scheduler) {
        this(bus, workers, scheduler, Clock.systemUTC());
    }

    public IsolationExecutor(EventBus bus, Executor workers, ScheduledExecutorService scheduler, Clock clock) {
        this.bus = bus;
        this.workers = workers;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /**
     * Execute the unit (with retries) on the worker pool.
     *
     * @param cancellation completes when the run is cancelled; pending retry waits are abandoned
     * @return future of the final outcome; never completes exceptionally
     */
    public CompletableFuture<Outcome> execute(RunUnit unit, CompletableFuture<Void> cancellation) {
        Instant firstStart = clock.instant();
        return attempt(unit, 0, cancellation)
                .exceptionally(e -> {
                    Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                    log.error("Unit {} could not be executed", unit.id(), cause);
                    return new Outcome.Errored("unit could not be executed: " + describe(cause), firstStart, clock.instant());
                })
                .thenApply(outcome -> {
                    bus.publish(new UnitFinished(unit.id(), unit.projectName(), unit.info(), outcome, clock.instant()));
                    return outcome;
                });
    }

    private CompletableFuture<Outcome> attempt(RunUnit unit, int retriesUsed, CompletableFuture<Void> cancellation) {
        return CompletableFuture.supplyAsync(() -> runOnce(unit), workers)
                .thenCompose(outcome -> {
                    RetryPolicy retry = unit.project().retry();
                    if (!isRetryable(outcome) || retriesUsed >= retry.count() || cancellation.isDone()) {
                        return CompletableFuture.completedFuture(outcome);
                    }
                    Duration delay = retry.nextDelay(retriesUsed);
                    log.debug("{} {}; retrying in {}ms (attempt {}/{})", unit.id(), outcome.kind(),
                            delay.toMillis(), retriesUsed + 1, retry.count());
                    bus.publish(new UnitRetried(unit.id(), unit.projectName(), unit.info(), retriesUsed, delay,
                            outcome, clock.instant()));

                    return CompletableFuture.anyOf(sleep(delay), cancellation)
                            .thenCompose(ignored -> cancellation.isDone()
                                    ? CompletableFuture.completedFuture(outcome)
                                    : attempt(unit, retriesUsed + 1, cancellation));
                });
    }

    /**
     * Execute the body once on the calling thread, with the unit's context bound.
     */
    public Outcome runOnce(RunUnit unit) {
        CheckRecorder recorder = new CheckRecorder(unit, bus, clock);
        TestContext context = new TestContext(unit.project(), unit.info(), recorder);
        Instant start = clock.instant();
        Throwable thrown = null;

        try (ContextScope.Binding ignored = ContextScope.bind(context)) {
            unit.test().body().execute(context);
        } catch (Throwable t) {
            thrown = t;
        }

        return classify(unit, thrown, recorder.seal(), start, clock.instant());
    }

    static Outcome classify(RunUnit unit, Throwable thrown, List<CheckFailure> failures, Instant start, Instant end) {
        if (thrown == null) {
            return failures.isEmpty() ? new Outcome.Passed(start, end) : new Outcome.Failed(failures, start, end);
        }

        ContextMissingException missing = findContextMissing(thrown);
        if (missing != null) {
            log.debug("{} used a context dependent primitive without a test context", unit.id());
            return new Outcome.Errored("test context missing: " + missing.getMessage(), start, end);
        }

        thrown = unwrap(thrown);

        if (thrown instanceof SkippedException skipped) {
            if (!failures.isEmpty()) {
                return new Outcome.Failed(failures, start, end);
            }
            return new Outcome.Skipped(skipped.reason(), start, end);
        }

        if (thrown instanceof AssertionFailure assertion) {
            List<CheckFailure> all = new ArrayList<>(failures);
            if (!all.contains(assertion.failure())) {
                all.add(assertion.failure());
            }
            return new Outcome.Failed(all, start, end);
        }

        if (thrown instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return new Outcome.Errored("interrupted", start, end);
        }

        if (thrown instanceof Exception && !(thrown instanceof RuntimeException)) {
            log.debug("{} returned an error: {}", unit.id(), thrown.toString());
            return new Outcome.Errored(describe(thrown), start, end);
        }

        StackTraceElement[] frames = thrown.getStackTrace();
        String location = frames.length > 0 ? frames[0].toString() : null;
        String message = unit.info().displayName() + " failed with message: "
                + (thrown.getMessage() != null ? thrown.getMessage() : thrown.getClass().getName());
        log.debug("{} crashed: {}", unit.id(), thrown.toString());
        return new Outcome.Panicked(message, location, start, end);
    }

    /**
     * Strip the wrappers added by futures so sub-work failures the body waited for keep their kind.
     */
    static Throwable unwrap(Throwable thrown) {
        Throwable current = thrown;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    static boolean isRetryable(Outcome outcome) {
        return outcome.kind() == Outcome.Kind.ERRORED || outcome.kind() == Outcome.Kind.FAILED;
    }

    private CompletableFuture<Void> sleep(Duration delay) {
        CompletableFuture<Void> timer = new CompletableFuture<>();
        scheduler.schedule(() -> timer.complete(null), delay.toNanos(), TimeUnit.NANOSECONDS);
        return timer;
    }

    private static ContextMissingException findContextMissing(Throwable thrown) {
        Throwable current = thrown;
        int depth = 0;
        while (current != null && depth++ < 32) {
            if (current instanceof ContextMissingException missing) {
                return missing;
            }
            for (Throwable suppressed : current.getSuppressed()) {
                if (suppressed instanceof ContextMissingException missing) {
                    return missing;
                }
            }
            current = current.getCause();
        }
        return null;
    }

    static String describe(Throwable thrown) {
        StringBuilder sb = new StringBuilder(thrown.toString());
        Throwable cause = thrown.getCause();
        int depth = 0;
        while (cause != null && cause != thrown && depth++ < 8) {
            sb.append("\ncaused by: ").append(cause);
            cause = cause.getCause();
        }
        return sb.toString();
    }
}
