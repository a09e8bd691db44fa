package io.harrier.api.project;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Backoff policy applied when a test attempt errors or fails.
 * <p>
 * The same policy is handed to HTTP clients so they can space out their own
 * request retries. A count of zero disables retrying.
 */
public final class RetryPolicy {

    public static final int DEFAULT_COUNT = 0;
    public static final double DEFAULT_FACTOR = 2.0;
    public static final Duration DEFAULT_MIN_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);

    private static final RetryPolicy DISABLED = builder().build();

    private final int count;
    private final double factor;
    private final boolean jitter;
    private final Duration minDelay;
    private final Duration maxDelay;
    private final List<Duration> delays;
    private final DoubleSupplier random;

    private RetryPolicy(Builder builder) {
        this.count = builder.count;
        this.factor = builder.factor;
        this.jitter = builder.jitter;
        this.minDelay = builder.minDelay;
        this.maxDelay = builder.maxDelay;
        this.delays = Collections.unmodifiableList(new ArrayList<>(builder.delays));
        this.random = builder.random;
    }

    public static RetryPolicy disabled() {
        return DISABLED;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Compute the delay to wait before the given (zero based) retry attempt.
     * <p>
     * An explicit delay list wins over the exponential sequence; attempts past
     * its end repeat the last entry. The computed sequence is
     * {@code min(maxDelay, minDelay * factor^attempt)}, scaled by a uniform
     * value in {@code [0, 1]} when jitter is enabled.
     *
     * @param attempt retry attempt, starting at 0
     * @return delay before that attempt, never above {@code maxDelay} unless an explicit list says so
     */
    public Duration nextDelay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("Attempt must not be negative: " + attempt);
        }
        if (!delays.isEmpty()) {
            return delays.get(Math.min(attempt, delays.size() - 1));
        }

        double maxNanos = maxDelay.toNanos();
        double nanos = Math.min(maxNanos, minDelay.toNanos() * Math.pow(factor, attempt));
        if (jitter) {
            nanos = nanos * random.getAsDouble();
        }
        return Duration.ofNanos((long) Math.min(maxNanos, nanos));
    }

    public boolean enabled() {
        return count > 0;
    }

    public int count() { return count; }
    public double factor() { return factor; }
    public boolean jitter() { return jitter; }
    public Duration minDelay() { return minDelay; }
    public Duration maxDelay() { return maxDelay; }
    public List<Duration> delays() { return delays; }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .count(count)
                .factor(factor)
                .jitter(jitter)
                .minDelay(minDelay)
                .maxDelay(maxDelay)
                .delays(delays);
        builder.random = random;
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RetryPolicy)) return false;
        RetryPolicy that = (RetryPolicy) o;
        return count == that.count
                && Double.compare(that.factor, factor) == 0
                && jitter == that.jitter
                && minDelay.equals(that.minDelay)
                && maxDelay.equals(that.maxDelay)
                && delays.equals(that.delays);
    }

    @Override
    public int hashCode() {
        return Objects.hash(count, factor, jitter, minDelay, maxDelay, delays);
    }

    @Override
    public String toString() {
        return "RetryPolicy{count=" + count + ", factor=" + factor + ", jitter=" + jitter
                + ", minDelay=" + minDelay + ", maxDelay=" + maxDelay + ", delays=" + delays + '}';
    }

    public static final class Builder {
        private int count = DEFAULT_COUNT;
        private double factor = DEFAULT_FACTOR;
        private boolean jitter = false;
        private Duration minDelay = DEFAULT_MIN_DELAY;
        private Duration maxDelay = DEFAULT_MAX_DELAY;
        private List<Duration> delays = List.of();
        private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();

        private Builder() {}

        public Builder count(int count) {
            this.count = count;
            return this;
        }

        public Builder factor(double factor) {
            this.factor = factor;
            return this;
        }

        public Builder jitter(boolean jitter) {
            this.jitter = jitter;
            return this;
        }

        public Builder minDelay(Duration minDelay) {
            this.minDelay = Objects.requireNonNull(minDelay, "minDelay");
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
            return this;
        }

        /**
         * Explicit per-attempt delays, overriding the exponential sequence.
         */
        public Builder delays(List<Duration> delays) {
            this.delays = List.copyOf(delays);
            return this;
        }

        /**
         * Source of the jitter multiplier, expected to return values in {@code [0, 1]}.
         */
        public Builder random(DoubleSupplier random) {
            this.random = Objects.requireNonNull(random, "random");
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
