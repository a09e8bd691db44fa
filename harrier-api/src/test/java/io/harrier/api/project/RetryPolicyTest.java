package io.harrier.api.project;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void shouldBeDisabledByDefault() {
        var policy = RetryPolicy.builder().build();

        assertThat(policy.enabled()).isFalse();
        assertThat(policy.count()).isZero();
        assertThat(policy.factor()).isEqualTo(2.0);
        assertThat(policy.jitter()).isFalse();
        assertThat(policy.minDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.maxDelay()).isEqualTo(Duration.ofSeconds(60));
        assertThat(RetryPolicy.disabled()).isEqualTo(policy);
    }

    @Test
    void shouldGrowExponentially() {
        var policy = RetryPolicy.builder().count(3).build();

        assertThat(policy.nextDelay(0)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.nextDelay(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.nextDelay(2)).isEqualTo(Duration.ofSeconds(4));
    }

    @Test
    void shouldClampToMaxDelay() {
        var policy = RetryPolicy.builder()
                .count(10)
                .maxDelay(Duration.ofSeconds(10))
                .build();

        assertThat(policy.nextDelay(3)).isEqualTo(Duration.ofSeconds(8));
        assertThat(policy.nextDelay(4)).isEqualTo(Duration.ofSeconds(10));
        assertThat(policy.nextDelay(1000)).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void delaysShouldNeverDecreaseWithoutJitter() {
        var policy = RetryPolicy.builder()
                .count(50)
                .factor(1.5)
                .minDelay(Duration.ofMillis(100))
                .maxDelay(Duration.ofSeconds(30))
                .build();

        Duration previous = Duration.ZERO;
        for (int attempt = 0; attempt < 50; attempt++) {
            Duration delay = policy.nextDelay(attempt);
            assertThat(delay).isGreaterThanOrEqualTo(previous);
            assertThat(delay).isLessThanOrEqualTo(Duration.ofSeconds(30));
            previous = delay;
        }
    }

    @Test
    void shouldScaleByJitter() {
        var policy = RetryPolicy.builder()
                .count(3)
                .jitter(true)
                .random(() -> 0.5)
                .build();

        assertThat(policy.nextDelay(0)).isEqualTo(Duration.ofMillis(500));
        assertThat(policy.nextDelay(2)).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void jitteredDelayShouldStayWithinBounds() {
        var policy = RetryPolicy.builder()
                .count(5)
                .jitter(true)
                .maxDelay(Duration.ofSeconds(5))
                .build();

        for (int attempt = 0; attempt < 20; attempt++) {
            assertThat(policy.nextDelay(attempt))
                    .isGreaterThanOrEqualTo(Duration.ZERO)
                    .isLessThanOrEqualTo(Duration.ofSeconds(5));
        }
    }

    @Test
    void explicitDelaysShouldWinAndRepeatLastEntry() {
        var policy = RetryPolicy.builder()
                .count(5)
                .delays(List.of(Duration.ofMillis(100), Duration.ofMillis(500)))
                .build();

        assertThat(policy.nextDelay(0)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.nextDelay(1)).isEqualTo(Duration.ofMillis(500));
        assertThat(policy.nextDelay(4)).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    void shouldRejectNegativeAttempt() {
        var policy = RetryPolicy.builder().count(1).build();

        assertThatThrownBy(() -> policy.nextDelay(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toBuilderShouldCopyEverySetting() {
        var policy = RetryPolicy.builder()
                .count(2)
                .factor(3.0)
                .minDelay(Duration.ofMillis(10))
                .build();

        assertThat(policy.toBuilder().build()).isEqualTo(policy);
        assertThat(policy.toBuilder().count(4).build().count()).isEqualTo(4);
    }
}
