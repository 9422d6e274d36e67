/**
 * Failures raised by the detection engine.
 *
 * <p>
 * All types extend
 * {@link com.seasonalesd.core.exception.AnomalyDetectionException}, itself an
 * {@link java.lang.IllegalArgumentException}. Cancellation is not a failure and
 * has no exception type here; see
 * {@link com.seasonalesd.core.model.DetectionResult.Status#CANCELED}.
 * </p>
 *
 * @since 1.0.0
 */
package com.seasonalesd.core.exception;
