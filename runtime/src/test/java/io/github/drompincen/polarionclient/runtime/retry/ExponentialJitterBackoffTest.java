package io.github.drompincen.polarionclient.runtime.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class ExponentialJitterBackoffTest {

    private final RetryPolicy policy = RetryPolicy.defaults()
            .withWaits(Duration.ofMillis(1000), Duration.ofMillis(8000));

    @Test
    void growsExponentiallyUpToCap() {
        assertThat(ExponentialJitterBackoff.exponential(1000, 8000, 0)).isEqualTo(1000);
        assertThat(ExponentialJitterBackoff.exponential(1000, 8000, 2)).isEqualTo(4000);
        assertThat(ExponentialJitterBackoff.exponential(1000, 8000, 5)).isEqualTo(8000);
        assertThat(ExponentialJitterBackoff.exponential(1000, 8000, 200)).isEqualTo(8000);
    }

    @Test
    void jitterStaysWithinQuarterAndBounds() {
        ExponentialJitterBackoff backoff = new ExponentialJitterBackoff(new Random(42));

        for (int i = 0; i < 500; i++) {
            Duration wait = backoff.waitAfter(1, policy);
            assertThat(wait.toMillis()).isBetween(1500L, 2500L);
        }
        for (int i = 0; i < 500; i++) {
            Duration first = backoff.waitAfter(0, policy);
            Duration capped = backoff.waitAfter(10, policy);
            assertThat(first.toMillis()).isBetween(1000L, 1250L);
            assertThat(capped.toMillis()).isBetween(6000L, 8000L);
        }
    }

    @Test
    void zeroWaitsStayZero() {
        assertThat(new ExponentialJitterBackoff().waitAfter(3, RetryPolicy.none())).isZero();
    }
}
