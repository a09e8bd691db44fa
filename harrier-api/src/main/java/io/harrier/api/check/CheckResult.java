package io.harrier.api.check;

/**
 * Result of a single check primitive invocation.
 */
public record CheckResult(boolean passed, String expression, String left, String right, String message) {

    public CheckFailure toFailure() {
        return new CheckFailure(expression, left, right, message);
    }
}
