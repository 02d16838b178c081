package com.volumesentinel.core.orchestration;

/**
 * Run-level failure: the input as a whole cannot be monitored, for example
 * because it holds no observations or none before the check date.
 *
 * <p>
 * Problems confined to one combination never surface as this exception;
 * they degrade to an insufficient or irregular record instead.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitoringException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public MonitoringException(String message) {
        super(message);
    }

    public MonitoringException(String message, Throwable cause) {
        super(message, cause);
    }
}
