package io.harrier.api.check;

/**
 * A failed check as it appears in a {@code Failed} outcome.
 * {@code left} and {@code right} are {@code null} for plain boolean checks.
 */
public record CheckFailure(String expression, String left, String right, String message) {

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("check failed: `").append(expression).append('`');
        if (message != null && !message.isEmpty()) {
            sb.append(": ").append(message);
        }
        if (left != null || right != null) {
            sb.append("\n  left: ").append(left).append("\n right: ").append(right);
        }
        return sb.toString();
    }
}
