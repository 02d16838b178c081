package com.volumesentinel.core.model;

/**
 * Why an alert was raised.
 */
public enum AlertType {
    /** No row at all for the check week. */
    NO_DATA,
    /** Observed volume fell below the combination's threshold. */
    VOLUME_DROP
}
