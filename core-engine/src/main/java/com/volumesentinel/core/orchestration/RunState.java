package com.volumesentinel.core.orchestration;

/**
 * Lifecycle of a single monitoring run. States are entered strictly in
 * declaration order.
 */
public enum RunState {
    LOADED,
    PROFILED,
    THRESHOLDED,
    CLASSIFIED,
    DONE
}
