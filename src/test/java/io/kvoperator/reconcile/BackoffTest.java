package io.kvoperator.reconcile;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class BackoffTest {

    @Test
    void testDoublesUntilCapped() {
        Backoff backoff = new Backoff(Duration.ofMillis(500), Duration.ofSeconds(3));

        assertThat(backoff.delay(1)).isEqualTo(Duration.ofMillis(500));
        assertThat(backoff.delay(2)).isEqualTo(Duration.ofSeconds(1));
        assertThat(backoff.delay(3)).isEqualTo(Duration.ofSeconds(2));
        assertThat(backoff.delay(4)).isEqualTo(Duration.ofSeconds(3));
        assertThat(backoff.delay(100)).isEqualTo(Duration.ofSeconds(3));
    }

    @Test
    void testZeroFailuresUsesBase() {
        Backoff backoff = new Backoff(Duration.ofMillis(250), Duration.ofSeconds(10));

        assertThat(backoff.delay(0)).isEqualTo(Duration.ofMillis(250));
    }

    @Test
    void testInvalidBounds() {
        assertThatThrownBy(() -> new Backoff(Duration.ZERO, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Backoff(Duration.ofSeconds(2), Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
