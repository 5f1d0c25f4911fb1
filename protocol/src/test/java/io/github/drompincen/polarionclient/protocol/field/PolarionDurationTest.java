package io.github.drompincen.polarionclient.protocol.field;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PolarionDurationTest {

    @Test
    void parsesMixedUnits() {
        assertThat(PolarionDuration.parse("2d 3h 30m"))
                .isEqualTo(Duration.ofDays(2).plusHours(3).plusMinutes(30));
        assertThat(PolarionDuration.parse("45s")).isEqualTo(Duration.ofSeconds(45));
    }

    @Test
    void formatsLargestUnitsFirst() {
        assertThat(PolarionDuration.format(Duration.ofHours(51).plusMinutes(30))).isEqualTo("2d 3h 30m");
        assertThat(PolarionDuration.format(Duration.ofSeconds(90))).isEqualTo("1m 30s");
    }

    @Test
    void zeroFormatsAsZeroSeconds() {
        assertThat(PolarionDuration.format(Duration.ZERO)).isEqualTo("0s");
    }

    @Test
    void rejectsGarbage() {
        assertThatThrownBy(() -> PolarionDuration.parse("two days")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PolarionDuration.parse("3h x")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PolarionDuration.parse(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
