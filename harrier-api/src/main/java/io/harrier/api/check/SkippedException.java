package io.harrier.api.check;

/**
 * Thrown by {@link Checks#skip(String)} to end the test body without a verdict.
 */
public class SkippedException extends RuntimeException {

    private final String reason;

    public SkippedException(String reason) {
        super(reason, null, true, false);
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
