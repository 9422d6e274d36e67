/**
 * Seasonal-trend decomposition.
 *
 * <p>
 * {@link com.seasonalesd.core.decomposition.SeasonalDecomposer} is the seam
 * the ESD detector calls through;
 * {@link com.seasonalesd.core.decomposition.StlDecomposer} implements it with
 * STL, configured by
 * {@link com.seasonalesd.core.decomposition.StlParams}.
 * </p>
 *
 * @since 1.0.0
 */
package com.seasonalesd.core.decomposition;
