package com.seasonalesd.core.exception;

/**
 * The series covers fewer than two seasonal periods.
 *
 * @since 1.0.0
 */
public class InsufficientDataException extends AnomalyDetectionException {

    private static final long serialVersionUID = 1L;

    public InsufficientDataException(String message) {
        super(message);
    }
}
