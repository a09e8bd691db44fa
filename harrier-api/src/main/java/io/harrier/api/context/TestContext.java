package io.harrier.api.context;

import io.harrier.api.project.ProjectConfig;
import io.harrier.api.test.TestInfo;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Ambient data of one executing test: the project it runs against and its identity.
 * <p>
 * The context is bound to the thread running the test body. Work handed to
 * other threads does not see it unless wrapped:
 * <pre>{@code
 * CompletableFuture.runAsync(ctx.wrap(() -> { Checks.check(ok, "ok"); }), pool);
 * CompletableFuture.supplyAsync(ctx.wrapSupplier(() -> client.get("/users")), pool);
 * }</pre>
 */
public final class TestContext {

    private final ProjectConfig project;
    private final TestInfo test;
    private final CheckSink checks;

    public TestContext(ProjectConfig project, TestInfo test, CheckSink checks) {
        this.project = Objects.requireNonNull(project, "project");
        this.test = Objects.requireNonNull(test, "test");
        this.checks = Objects.requireNonNull(checks, "checks");
    }

    public ProjectConfig project() { return project; }
    public TestInfo test() { return test; }
    public CheckSink checks() { return checks; }

    public String unitId() {
        return test.uniqueName(project.name());
    }

    /**
     * Carry this context into a runnable executed elsewhere.
     */
    public Runnable wrap(Runnable task) {
        Objects.requireNonNull(task, "task");
        return () -> {
            try (ContextScope.Binding ignored = ContextScope.bind(this)) {
                task.run();
            }
        };
    }

    public <T> Callable<T> wrap(Callable<T> task) {
        Objects.requireNonNull(task, "task");
        return () -> {
            try (ContextScope.Binding ignored = ContextScope.bind(this)) {
                return task.call();
            }
        };
    }

    public <T> Supplier<T> wrapSupplier(Supplier<T> task) {
        Objects.requireNonNull(task, "task");
        return () -> {
            try (ContextScope.Binding ignored = ContextScope.bind(this)) {
                return task.get();
            }
        };
    }

    @Override
    public String toString() {
        return "TestContext{" + unitId() + '}';
    }
}
