package io.harrier.api.context;

/**
 * Thrown when a check is recorded into a test context whose attempt already
 * finished, typically from wrapped sub-work the body did not wait for.
 */
public class ContextClosedException extends IllegalStateException {

    public ContextClosedException(String message) {
        super(message);
    }
}
