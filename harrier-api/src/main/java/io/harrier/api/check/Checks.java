package io.harrier.api.check;

import io.harrier.api.context.ContextScope;

import java.util.Objects;

/**
 * Check primitives for test bodies.
 * <p>
 * {@code check*} methods record the result and return it; the body keeps
 * running after a failure and every failure ends up in the outcome.
 * {@code require*} methods additionally throw {@link AssertionFailure} so the
 * body stops at the first failure.
 * <p>
 * All of them need a bound test context and throw
 * {@link io.harrier.api.context.ContextMissingException} without one,
 * except {@link #skip(String)}.
 */
public final class Checks {

    private Checks() {}

    public static boolean check(boolean condition, String expression) {
        return check(condition, expression, null);
    }

    public static boolean check(boolean condition, String expression, String message) {
        return record(new CheckResult(condition, expression, null, null, condition ? null : message));
    }

    public static boolean checkEq(Object expected, Object actual) {
        return checkEq(expected, actual, null);
    }

    public static boolean checkEq(Object expected, Object actual, String message) {
        boolean passed = Objects.equals(expected, actual);
        return record(new CheckResult(passed, "left == right", String.valueOf(expected), String.valueOf(actual),
                passed ? null : message));
    }

    public static boolean checkNe(Object unexpected, Object actual) {
        return checkNe(unexpected, actual, null);
    }

    public static boolean checkNe(Object unexpected, Object actual, String message) {
        boolean passed = !Objects.equals(unexpected, actual);
        return record(new CheckResult(passed, "left != right", String.valueOf(unexpected), String.valueOf(actual),
                passed ? null : message));
    }

    public static void require(boolean condition, String expression) {
        require(condition, expression, null);
    }

    public static void require(boolean condition, String expression, String message) {
        CheckResult result = new CheckResult(condition, expression, null, null, condition ? null : message);
        if (!record(result)) {
            throw new AssertionFailure(result.toFailure());
        }
    }

    public static void requireEq(Object expected, Object actual) {
        requireEq(expected, actual, null);
    }

    public static void requireEq(Object expected, Object actual, String message) {
        boolean passed = Objects.equals(expected, actual);
        CheckResult result = new CheckResult(passed, "left == right", String.valueOf(expected), String.valueOf(actual),
                passed ? null : message);
        if (!record(result)) {
            throw new AssertionFailure(result.toFailure());
        }
    }

    /**
     * Stop the body and report the unit as skipped, unless a check already failed.
     */
    public static void skip(String reason) {
        throw new SkippedException(reason);
    }

    private static boolean record(CheckResult result) {
        ContextScope.current().checks().record(result);
        return result.passed();
    }
}
