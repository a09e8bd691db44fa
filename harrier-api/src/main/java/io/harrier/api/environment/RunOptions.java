package io.harrier.api.environment;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Invocation parameters of a run: filters, concurrency, timeout and event buffering.
 */
public final class RunOptions {

    public static final int DEFAULT_SUBSCRIBER_BUFFER = 1000;

    private Integer concurrency = null; // null = unbounded, or cores in interactive mode
    private boolean interactive = false;
    private Duration globalTimeout = null;
    private int subscriberBufferSize = DEFAULT_SUBSCRIBER_BUFFER;
    private Duration drainTimeout = Duration.ofSeconds(30);
    private Filters filters = Filters.none();
    private String reportPath = null;

    private RunOptions() {}

    public static RunOptions create() {
        return new RunOptions();
    }

    /**
     * Maximum number of units running at the same time.
     */
    public RunOptions concurrency(int concurrency) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("Concurrency must be positive");
        }
        this.concurrency = concurrency;
        return this;
    }

    /**
     * Interactive front ends (TUI) default the concurrency to the number of cores.
     */
    public RunOptions interactive(boolean interactive) {
        this.interactive = interactive;
        return this;
    }

    /**
     * Cancel the run once this much time has passed since it started.
     */
    public RunOptions globalTimeout(Duration globalTimeout) {
        if (globalTimeout != null && (globalTimeout.isNegative() || globalTimeout.isZero())) {
            throw new IllegalArgumentException("Global timeout must be positive");
        }
        this.globalTimeout = globalTimeout;
        return this;
    }

    /**
     * Number of events buffered per subscriber before it is dropped as too slow.
     */
    public RunOptions subscriberBufferSize(int subscriberBufferSize) {
        if (subscriberBufferSize <= 0) {
            throw new IllegalArgumentException("Subscriber buffer size must be positive");
        }
        this.subscriberBufferSize = subscriberBufferSize;
        return this;
    }

    /**
     * How long to wait for subscribers to consume remaining events after the run.
     */
    public RunOptions drainTimeout(Duration drainTimeout) {
        this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout");
        return this;
    }

    public RunOptions filters(Filters filters) {
        this.filters = Objects.requireNonNull(filters, "filters");
        return this;
    }

    public RunOptions projects(String... names) {
        this.filters = filters.withProjects(List.of(names));
        return this;
    }

    public RunOptions modules(String... names) {
        this.filters = filters.withModules(List.of(names));
        return this;
    }

    public RunOptions tests(String... names) {
        this.filters = filters.withTests(List.of(names));
        return this;
    }

    /**
     * Base path of the JSON and CSV reports; no report files are written when unset.
     */
    public RunOptions reportPath(String reportPath) {
        this.reportPath = reportPath;
        return this;
    }

    public boolean interactive() { return interactive; }
    public Duration globalTimeout() { return globalTimeout; }
    public int subscriberBufferSize() { return subscriberBufferSize; }
    public Duration drainTimeout() { return drainTimeout; }
    public Filters filters() { return filters; }
    public String reportPath() { return reportPath; }
    public Integer concurrencyOverride() { return concurrency; }

    /**
     * Resolve the admission bound for this run.
     * Explicit value wins; otherwise interactive runs use the core count and
     * everything else is unbounded ({@link Integer#MAX_VALUE}).
     */
    public int effectiveConcurrency() {
        if (concurrency != null) {
            return concurrency;
        }
        if (interactive) {
            return Runtime.getRuntime().availableProcessors();
        }
        return Integer.MAX_VALUE;
    }
}
