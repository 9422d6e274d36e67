package com.seasonalesd.core.model;

/**
 * Cooperative cancellation hook, polled once per detection iteration.
 *
 * <p>
 * Implementations must be cheap and must not throw. A detection run that
 * observes a request stops before touching its working state for that
 * iteration and reports {@link DetectionResult.Status#CANCELED}.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface CancellationToken {

    /** Token that never requests cancellation. */
    CancellationToken NONE = () -> false;

    /**
     * @return {@code true} once the caller wants the run to stop
     */
    boolean isCancellationRequested();
}
