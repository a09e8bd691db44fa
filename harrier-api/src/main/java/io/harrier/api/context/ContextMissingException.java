package io.harrier.api.context;

/**
 * A context dependent primitive was used on a thread with no test context bound,
 * typically from sub-work that was not wrapped with {@link TestContext#wrap(Runnable)}.
 */
public class ContextMissingException extends IllegalStateException {

    public ContextMissingException(String message) {
        super(message);
    }
}
