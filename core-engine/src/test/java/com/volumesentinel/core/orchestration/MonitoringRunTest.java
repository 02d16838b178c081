package com.volumesentinel.core.orchestration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MonitoringRun}.
 */
class MonitoringRunTest {

    private final MonitoringRun run = new MonitoringRun(LocalDate.of(2024, 6, 3), "medium");

    @Test
    @DisplayName("Should walk every state in order")
    void shouldAdvanceInOrder() {
        assertThat(run.getState()).isEqualTo(RunState.LOADED);

        run.advance(RunState.PROFILED);
        run.advance(RunState.THRESHOLDED);
        run.advance(RunState.CLASSIFIED);
        run.advance(RunState.DONE);

        assertThat(run.getState()).isEqualTo(RunState.DONE);
    }

    @Test
    @DisplayName("Should reject skipping a state")
    void shouldRejectSkippedState() {
        assertThatThrownBy(() -> run.advance(RunState.THRESHOLDED))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("LOADED -> THRESHOLDED");
        assertThat(run.getState()).isEqualTo(RunState.LOADED);
    }

    @Test
    @DisplayName("Should reject re-entering the current or an earlier state")
    void shouldRejectBackwardTransition() {
        run.advance(RunState.PROFILED);

        assertThatThrownBy(() -> run.advance(RunState.PROFILED))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> run.advance(RunState.LOADED))
                .isInstanceOf(IllegalStateException.class);
    }
}
