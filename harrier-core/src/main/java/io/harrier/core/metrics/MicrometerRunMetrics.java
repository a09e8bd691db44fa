package io.harrier.core.metrics;

import io.harrier.api.event.UnitFinished;
import io.harrier.api.event.UnitRetried;
import io.harrier.api.event.UnitStarted;
import io.harrier.api.outcome.Outcome;
import io.harrier.api.report.Reporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default metrics subscriber using Micrometer.
 * Records unit durations and outcome counts per project, retries, and the
 * number of units currently running.
 */
public class MicrometerRunMetrics implements Reporter {

    public static final String UNIT_DURATION = "harrier.unit.duration";
    public static final String UNIT_OUTCOMES = "harrier.unit.outcomes";
    public static final String UNIT_RETRIES = "harrier.unit.retries";
    public static final String UNITS_RUNNING = "harrier.units.running";

    private final MeterRegistry registry;
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final AtomicInteger running = new AtomicInteger(0);

    public MicrometerRunMetrics() {
        this(new SimpleMeterRegistry());
    }

    public MicrometerRunMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder(UNITS_RUNNING, running, AtomicInteger::get)
                .description("Units currently executing")
                .register(registry);
    }

    @Override
    public void onStart(UnitStarted event) {
        running.incrementAndGet();
    }

    @Override
    public void onRetry(UnitRetried event) {
        counter(UNIT_RETRIES, event.project(), null).increment();
    }

    @Override
    public void onEnd(UnitFinished event) {
        running.decrementAndGet();
        Outcome outcome = event.outcome();
        String kind = outcome.kind().name().toLowerCase(Locale.ROOT);
        timer(event.project(), kind).record(outcome.duration());
        counter(UNIT_OUTCOMES, event.project(), kind).increment();
    }

    public MeterRegistry registry() {
        return registry;
    }

    public int running() {
        return running.get();
    }

    /**
     * @return finished units of a project with the given outcome
     */
    public double count(String project, Outcome.Kind kind) {
        Counter counter = registry.find(UNIT_OUTCOMES)
                .tag("project", project)
                .tag("outcome", kind.name().toLowerCase(Locale.ROOT))
                .counter();
        return counter != null ? counter.count() : 0.0;
    }

    private Timer timer(String project, String outcome) {
        return timers.computeIfAbsent(project + "|" + outcome, key ->
                Timer.builder(UNIT_DURATION)
                        .tag("project", project)
                        .tag("outcome", outcome)
                        .publishPercentiles(0.5, 0.95, 0.99)
                        .register(registry));
    }

    private Counter counter(String name, String project, String outcome) {
        return counters.computeIfAbsent(name + "|" + project + "|" + outcome, key -> {
            Counter.Builder builder = Counter.builder(name).tag("project", project);
            if (outcome != null) {
                builder.tag("outcome", outcome);
            }
            return builder.register(registry);
        });
    }

    @Override
    public String name() {
        return "metrics";
    }
}
