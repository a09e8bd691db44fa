package io.harrier.core.runtime;

import io.harrier.api.environment.RunOptions;
import io.harrier.api.environment.TestRun;
import io.harrier.api.event.RunFinished;
import io.harrier.api.event.RunStarted;
import io.harrier.api.event.UnitStarted;
import io.harrier.api.outcome.Outcome;
import io.harrier.api.outcome.RunSummary;
import io.harrier.api.test.RunUnit;
import io.harrier.core.bus.EventBus;
import io.harrier.core.gate.AdmissionGate;
import io.harrier.core.isolation.IsolationExecutor;
import io.harrier.core.plan.ExecutionPlan;
import io.harrier.core.plan.Lane;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The scheduler that drives an {@link ExecutionPlan}.
 * <p>
 * Every lane gets a cursor: a chain of futures that takes its units one after
 * another through {@code PENDING -> SCHEDULED -> RUNNING -> FINISHED}. A unit
 * becomes scheduled when it obtains a permit from the admission gate, so the
 * number of running units never exceeds the configured concurrency, and the
 * next unit of a lane is only considered after its predecessor finished.
 * <p>
 * Waiting cursors hold no thread; only running bodies occupy worker threads.
 * Cancelling (explicitly or through the global timeout) stops cursors from
 * scheduling further units while running units finish normally. The run ends
 * with {@code RunFinished} once every cursor is done.
 */
public class TestRuntime implements TestRun {

    private static final Logger log = LoggerFactory.getLogger(TestRuntime.class);

    private final ExecutionPlan plan;
    private final List<String> projects;
    private final RunOptions options;
    private final EventBus bus;
    private final Clock clock;
    private final AdmissionGate gate;

    private final AtomicReference<RunState> state = new AtomicReference<>(RunState.RUNNING);
    private final Map<String, UnitState> unitStates = new ConcurrentHashMap<>();
    private final Map<Outcome.Kind, AtomicInteger> counts = new EnumMap<>(Outcome.Kind.class);
    private final AtomicInteger cancelledUnits = new AtomicInteger(0);
    private final AtomicInteger runningUnits = new AtomicInteger(0);
    private final CompletableFuture<Void> cancellation = new CompletableFuture<>();
    private final CompletableFuture<RunSummary> resultFuture = new CompletableFuture<>();

    private ExecutorService workers;
    private ScheduledExecutorService scheduler;
    private IsolationExecutor isolation;
    private ScheduledFuture<?> timeoutTask;
    private Instant startTime;

    public TestRuntime(ExecutionPlan plan, List<String> projects, RunOptions options, EventBus bus) {
        this(plan, projects, options, bus, Clock.systemUTC());
    }

    public TestRuntime(ExecutionPlan plan, List<String> projects, RunOptions options, EventBus bus, Clock clock) {
        this.plan = plan;
        this.projects = List.copyOf(projects);
        this.options = options;
        this.bus = bus;
        this.clock = clock;
        this.gate = new AdmissionGate(options.effectiveConcurrency());
        for (Outcome.Kind kind : Outcome.Kind.values()) {
            counts.put(kind, new AtomicInteger(0));
        }
        for (RunUnit unit : plan.units()) {
            unitStates.put(unit.id(), UnitState.PENDING);
        }
    }

    /**
     * Start executing the plan. Returns immediately.
     */
    public void execute() {
        startTime = clock.instant();
        int concurrency = gate.permits();
        log.info("Starting run: {} units in {} lanes, concurrency: {}", plan.unitCount(), plan.lanes().size(),
                concurrency == Integer.MAX_VALUE ? "unbounded" : concurrency);

        workers = new ThreadPoolExecutor(0, Integer.MAX_VALUE, 60L, TimeUnit.SECONDS,
                new SynchronousQueue<>(), daemonThreads("harrier-worker-"));
        scheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("harrier-scheduler-"));
        isolation = new IsolationExecutor(bus, workers, scheduler, clock);

        bus.publish(new RunStarted(projects, plan.unitCount(), plan.lanes().size(), startTime));

        Duration timeout = options.globalTimeout();
        if (timeout != null) {
            timeoutTask = scheduler.schedule(() -> {
                log.info("Global timeout of {}ms elapsed, cancelling run", timeout.toMillis());
                cancel();
            }, timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        CompletableFuture<?>[] cursors = plan.lanes().stream()
                .map(lane -> runLane(lane, 0))
                .toArray(CompletableFuture[]::new);

        CompletableFuture.allOf(cursors)
                .whenCompleteAsync((ignored, error) -> {
                    if (error != null) {
                        log.error("Lane cursor failed unexpectedly", error);
                    }
                    finish();
                }, scheduler);
    }

    /**
     * Take the lane's unit at {@code index} through its lifecycle, then continue with the next one.
     */
    private CompletableFuture<Void> runLane(Lane lane, int index) {
        if (index >= lane.size()) {
            return CompletableFuture.completedFuture(null);
        }
        if (cancellation.isDone()) {
            markCancelled(lane, index);
            return CompletableFuture.completedFuture(null);
        }

        RunUnit unit = lane.units().get(index);
        return gate.acquire().thenCompose(permit -> {
            if (cancellation.isDone()) {
                permit.close();
                markCancelled(lane, index);
                return CompletableFuture.completedFuture(null);
            }
            unitStates.put(unit.id(), UnitState.SCHEDULED);
            return start(unit)
                    .whenComplete((outcome, error) -> {
                        runningUnits.decrementAndGet();
                        permit.close();
                    })
                    .thenCompose(outcome -> runLane(lane, index + 1));
        });
    }

    private CompletableFuture<Outcome> start(RunUnit unit) {
        unitStates.put(unit.id(), UnitState.RUNNING);
        runningUnits.incrementAndGet();
        bus.publish(new UnitStarted(unit.id(), unit.projectName(), unit.info(), clock.instant()));

        return isolation.execute(unit, cancellation)
                .thenApply(outcome -> {
                    counts.get(outcome.kind()).incrementAndGet();
                    unitStates.put(unit.id(), UnitState.FINISHED);
                    log.debug("{} finished: {}", unit.id(), outcome.kind());
                    return outcome;
                });
    }

    private void markCancelled(Lane lane, int fromIndex) {
        List<RunUnit> remaining = lane.units().subList(fromIndex, lane.size());
        for (RunUnit unit : remaining) {
            unitStates.put(unit.id(), UnitState.CANCELLED);
        }
        cancelledUnits.addAndGet(remaining.size());
        log.debug("Lane {} cancelled with {} units not scheduled", lane.name(), remaining.size());
    }

    private void finish() {
        Instant endTime = clock.instant();
        RunSummary summary = buildSummary(endTime);
        bus.publish(new RunFinished(summary, endTime));

        if (timeoutTask != null) {
            timeoutTask.cancel(false);
        }
        bus.close();
        if (!bus.awaitDrained(options.drainTimeout())) {
            log.warn("Not every subscriber consumed its events within {}ms", options.drainTimeout().toMillis());
        }

        workers.shutdown();
        scheduler.shutdown();
        state.set(RunState.COMPLETED);

        log.info("Run completed in {}ms: {} passed, {} failed, {} errored, {} panicked, {} skipped, {} cancelled",
                summary.totalDuration().toMillis(),
                summary.count(Outcome.Kind.PASSED), summary.count(Outcome.Kind.FAILED),
                summary.count(Outcome.Kind.ERRORED), summary.count(Outcome.Kind.PANICKED),
                summary.count(Outcome.Kind.SKIPPED), summary.cancelled());
        resultFuture.complete(summary);
    }

    private RunSummary buildSummary(Instant endTime) {
        Map<Outcome.Kind, Integer> totals = new EnumMap<>(Outcome.Kind.class);
        counts.forEach((kind, count) -> totals.put(kind, count.get()));
        return new RunSummary(startTime, endTime, Duration.between(startTime, endTime), totals,
                cancelledUnits.get(), cancellation.isDone());
    }

    @Override
    public void cancel() {
        if (state.compareAndSet(RunState.RUNNING, RunState.CANCELLING)) {
            log.info("Cancelling run; {} units still running will finish", runningUnits.get());
            cancellation.complete(null);
        }
    }

    @Override
    public boolean isRunning() {
        return state.get() != RunState.COMPLETED;
    }

    @Override
    public CompletableFuture<RunSummary> result() {
        return resultFuture;
    }

    @Override
    public int runningUnits() {
        return runningUnits.get();
    }

    @Override
    public RunState state() {
        return state.get();
    }

    public UnitState unitState(String unitId) {
        UnitState unitState = unitStates.get(unitId);
        if (unitState == null) {
            throw new IllegalArgumentException("Unknown unit: " + unitId);
        }
        return unitState;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
