package com.seasonalesd.core.exception;

/**
 * Base class of every failure a detection call can end with.
 *
 * <p>
 * All subclasses are raised during up-front validation, before any
 * decomposition or test iteration runs.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetectionException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public AnomalyDetectionException(String message) {
        super(message);
    }

    public AnomalyDetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
