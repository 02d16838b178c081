package com.volumesentinel.core.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.Objects;

/**
 * State machine of one run: {@code LOADED -> PROFILED -> THRESHOLDED ->
 * CLASSIFIED -> DONE}. Skipping or repeating a state is a programming error.
 *
 * @since 1.0.0
 */
public final class MonitoringRun {

    private static final Logger LOG = LoggerFactory.getLogger(MonitoringRun.class);

    private final LocalDate checkDate;
    private final String sensitivityLevel;
    private RunState state = RunState.LOADED;

    public MonitoringRun(LocalDate checkDate, String sensitivityLevel) {
        this.checkDate = Objects.requireNonNull(checkDate, "checkDate must not be null");
        this.sensitivityLevel = Objects.requireNonNull(sensitivityLevel, "sensitivityLevel must not be null");
        LOG.info("Run [{} / {}] {}", checkDate, sensitivityLevel, state);
    }

    /**
     * Move to the next state.
     *
     * @param next the state to enter; must directly follow the current one
     * @throws IllegalStateException if {@code next} is out of order
     */
    public void advance(RunState next) {
        Objects.requireNonNull(next, "next must not be null");
        if (next.ordinal() != state.ordinal() + 1) {
            throw new IllegalStateException("Illegal run transition " + state + " -> " + next);
        }
        LOG.info("Run [{} / {}] {} -> {}", checkDate, sensitivityLevel, state, next);
        state = next;
    }

    public RunState getState() {
        return state;
    }

    public LocalDate getCheckDate() {
        return checkDate;
    }

    public String getSensitivityLevel() {
        return sensitivityLevel;
    }
}
