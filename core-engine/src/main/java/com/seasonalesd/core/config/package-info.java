/**
 * Configuration loading and validation for detection profiles.
 *
 * <p>
 * Profiles are defined in YAML and loaded by
 * {@link com.seasonalesd.core.config.DetectionConfigLoader} into a
 * {@link com.seasonalesd.core.config.DetectionConfig} instance. Validation
 * is performed automatically after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.seasonalesd.core.config;
