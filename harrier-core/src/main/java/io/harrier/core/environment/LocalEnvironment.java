package io.harrier.core.environment;

import io.harrier.api.environment.RunOptions;
import io.harrier.api.environment.TestEnvironment;
import io.harrier.api.environment.TestRun;
import io.harrier.api.event.EventSubscriber;
import io.harrier.api.project.ProjectConfig;
import io.harrier.api.test.RunUnit;
import io.harrier.api.test.TestRegistry;
import io.harrier.core.bus.EventBus;
import io.harrier.core.config.EnvironmentOverlay;
import io.harrier.core.config.ProjectConfigValidator;
import io.harrier.core.metrics.MicrometerRunMetrics;
import io.harrier.core.plan.ExecutionPlan;
import io.harrier.core.plan.ExecutionPlanBuilder;
import io.harrier.core.report.FileReporter;
import io.harrier.core.runtime.TestRuntime;
import io.harrier.core.selection.Selection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Local environment for running registered tests directly from code.
 * <p>
 * Usage:
 * <pre>{@code
 * var registry = new TestRegistry();
 * registry.test("users", "create_user", ctx -> {
 *     Checks.checkEq(201, client.createUser().status());
 * });
 *
 * var options = RunOptions.create()
 *     .concurrency(4)
 *     .globalTimeout(Duration.ofMinutes(5));
 *
 * var env = new LocalEnvironment(options).subscribe(new TableReporter());
 * TestRun run = env.start(registry, List.of(ProjectConfig.builder("staging").build()));
 *
 * RunSummary summary = run.result().get();
 * System.exit(summary.exitCode());
 * }</pre>
 */
public class LocalEnvironment implements TestEnvironment {

    private static final Logger log = LoggerFactory.getLogger(LocalEnvironment.class);

    private final RunOptions options;
    private final Map<String, String> environment;
    private final MicrometerRunMetrics metrics;
    private final List<EventSubscriber> subscribers = new CopyOnWriteArrayList<>();
    private TestRuntime currentRuntime;

    public LocalEnvironment(RunOptions options) {
        this(options, System.getenv(), new MicrometerRunMetrics());
    }

    /**
     * @param environment variables merged into project settings, see {@link EnvironmentOverlay}
     */
    public LocalEnvironment(RunOptions options, Map<String, String> environment, MicrometerRunMetrics metrics) {
        this.options = options;
        this.environment = Map.copyOf(environment);
        this.metrics = metrics;
    }

    @Override
    public synchronized TestRun start(TestRegistry registry, List<ProjectConfig> projects) {
        if (currentRuntime != null && currentRuntime.isRunning()) {
            throw new IllegalStateException("A run is already in progress in this environment");
        }
        log.info("Starting local test environment");

        List<ProjectConfig> configured = projects.isEmpty()
                ? List.of(ProjectConfig.defaultProject())
                : projects;
        List<ProjectConfig> resolved = EnvironmentOverlay.apply(configured, environment);
        ProjectConfigValidator.validate(resolved);

        List<RunUnit> units = Selection.select(registry.list(), resolved, options.filters());
        if (units.isEmpty()) {
            log.warn("No tests selected: {} registered tests, {} projects, filters {}",
                    registry.size(), resolved.size(), options.filters());
        }
        ExecutionPlan plan = ExecutionPlanBuilder.build(units);

        EventBus bus = new EventBus(options.subscriberBufferSize());
        bus.subscribe(metrics);
        subscribers.forEach(bus::subscribe);
        if (options.reportPath() != null) {
            bus.subscribe(new FileReporter(options.reportPath()));
        }

        List<String> projectNames = resolved.stream().map(ProjectConfig::name).toList();
        currentRuntime = new TestRuntime(plan, projectNames, options, bus);
        currentRuntime.execute();
        return currentRuntime;
    }

    @Override
    public LocalEnvironment subscribe(EventSubscriber subscriber) {
        subscribers.add(subscriber);
        return this;
    }

    @Override
    public RunOptions options() {
        return options;
    }

    public MicrometerRunMetrics metrics() {
        return metrics;
    }

    @Override
    public synchronized void shutdown() {
        if (currentRuntime != null && currentRuntime.isRunning()) {
            currentRuntime.cancel();
        }
        log.info("Local environment shut down");
    }
}
