package com.seasonalesd.core.exception;

/**
 * A detection parameter is out of range, or the parameters leave nothing to
 * test (the anomaly budget rounds down to zero).
 *
 * @since 1.0.0
 */
public class InvalidConfigurationException extends AnomalyDetectionException {

    private static final long serialVersionUID = 1L;

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
