package io.harrier.api.context;

import io.harrier.api.project.ProjectConfig;

import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Thread-bound access to the {@link TestContext} of the executing test.
 * <p>
 * Bindings are not inherited by other threads. Use {@link #propagate(Runnable)}
 * (or {@link TestContext#wrap(Runnable)}) for sub-work.
 */
public final class ContextScope {

    private static final ThreadLocal<TestContext> CURRENT = new ThreadLocal<>();

    private ContextScope() {}

    /**
     * Bind a context to the calling thread until the returned binding is closed.
     * The previous binding, if any, is restored on close.
     */
    public static Binding bind(TestContext context) {
        TestContext previous = CURRENT.get();
        CURRENT.set(context);
        return new Binding(previous);
    }

    /**
     * @throws ContextMissingException if no test context is bound to this thread
     */
    public static TestContext current() {
        TestContext context = CURRENT.get();
        if (context == null) {
            throw new ContextMissingException("No test context bound to thread '" + Thread.currentThread().getName()
                    + "'. Work started from a test body on another thread must be wrapped with "
                    + "TestContext.wrap(...) or ContextScope.propagate(...)");
        }
        return context;
    }

    public static Optional<TestContext> find() {
        return Optional.ofNullable(CURRENT.get());
    }

    /**
     * @return the project config of the executing test
     */
    public static ProjectConfig project() {
        return current().project();
    }

    public static Runnable propagate(Runnable task) {
        return current().wrap(task);
    }

    public static <T> Callable<T> propagate(Callable<T> task) {
        return current().wrap(task);
    }

    public static <T> Supplier<T> propagateSupplier(Supplier<T> task) {
        return current().wrapSupplier(task);
    }

    /**
     * Restores the previous binding when closed.
     */
    public static final class Binding implements AutoCloseable {

        private final TestContext previous;

        private Binding(TestContext previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            if (previous == null) {
                CURRENT.remove();
            } else {
                CURRENT.set(previous);
            }
        }
    }
}
