package io.harrier.api.check;

/**
 * Thrown by the {@code require*} checks to stop the test body after a failed check.
 * The failure has already been recorded when this is thrown.
 */
public class AssertionFailure extends RuntimeException {

    private final CheckFailure failure;

    public AssertionFailure(CheckFailure failure) {
        super(failure.toString(), null, true, false);
        this.failure = failure;
    }

    public CheckFailure failure() {
        return failure;
    }
}
