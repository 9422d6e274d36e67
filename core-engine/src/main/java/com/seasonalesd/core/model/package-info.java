/**
 * Parameter and result types shared by the detection engine and its callers.
 *
 * <ul>
 * <li>{@link com.seasonalesd.core.model.DetectionParams}: immutable run
 * parameters</li>
 * <li>{@link com.seasonalesd.core.model.DetectionResult}: status plus sorted
 * anomaly positions</li>
 * <li>{@link com.seasonalesd.core.model.Direction}: tested tail(s)</li>
 * <li>{@link com.seasonalesd.core.model.CancellationToken}: cooperative
 * cancellation hook</li>
 * <li>{@link com.seasonalesd.core.model.DetectionProfile}: named settings
 * POJO bound from YAML</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.seasonalesd.core.model;
