package com.volumesentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link Severity}.
 */
class SeverityTest {

    @Test
    @DisplayName("Boundary values resolve to the higher tier")
    void shouldTreatBoundsAsInclusive() {
        assertThat(Severity.fromDropPercent(70.0)).isEqualTo(Severity.CRITICAL);
        assertThat(Severity.fromDropPercent(50.0)).isEqualTo(Severity.HIGH);
        assertThat(Severity.fromDropPercent(30.0)).isEqualTo(Severity.MEDIUM);
    }

    @Test
    @DisplayName("Values just below a bound fall to the next tier")
    void shouldFallThroughBelowBounds() {
        assertThat(Severity.fromDropPercent(69.9999)).isEqualTo(Severity.HIGH);
        assertThat(Severity.fromDropPercent(49.9999)).isEqualTo(Severity.MEDIUM);
        assertThat(Severity.fromDropPercent(29.9999)).isEqualTo(Severity.LOW);
        assertThat(Severity.fromDropPercent(0.0)).isEqualTo(Severity.LOW);
    }

    @Test
    @DisplayName("Severity never decreases as the drop grows")
    void shouldBeMonotoneInDrop() {
        Severity previous = Severity.LOW;
        for (double drop = 0; drop <= 100; drop += 0.5) {
            Severity current = Severity.fromDropPercent(drop);
            assertThat(current.ordinal()).isLessThanOrEqualTo(previous.ordinal());
            previous = current;
        }
    }
}
