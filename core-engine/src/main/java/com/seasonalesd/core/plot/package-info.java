/**
 * Vega-Lite chart output for detection results.
 *
 * @since 1.0.0
 */
package com.seasonalesd.core.plot;
