/**
 * Seasonal Hybrid ESD anomaly detection.
 *
 * <p>
 * {@link com.seasonalesd.core.detection.EsdDetector} runs the test;
 * {@link com.seasonalesd.core.detection.AnomalyDetection} offers static entry
 * points for arrays and keyed series;
 * {@link com.seasonalesd.core.detection.ProfiledDetector} looks up the period
 * and parameters by configured profile name.
 * </p>
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   series
 *     → seasonal decomposition (skipped when period = 1)
 *     → residual = value − seasonal − median
 *     → iterative ESD test against Student's t critical values
 *     → ascending anomaly positions
 * </pre>
 *
 * @since 1.0.0
 */
package com.seasonalesd.core.detection;
