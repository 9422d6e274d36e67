package com.seasonalesd.core.exception;

/**
 * The series contains a value the detector cannot work with (NaN or
 * infinite).
 *
 * @since 1.0.0
 */
public class InvalidInputException extends AnomalyDetectionException {

    private static final long serialVersionUID = 1L;

    public InvalidInputException(String message) {
        super(message);
    }
}
