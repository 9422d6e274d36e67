package com.seasonalesd.core.detection;

import com.seasonalesd.core.config.DetectionConfig;
import com.seasonalesd.core.config.DetectionConfigLoader;
import com.seasonalesd.core.exception.InvalidConfigurationException;
import com.seasonalesd.core.model.CancellationToken;
import com.seasonalesd.core.model.DetectionProfile;
import com.seasonalesd.core.model.DetectionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;

/**
 * Runs detection by profile name against a loaded {@link DetectionConfig}.
 *
 * <p>
 * Thread-safe once constructed: the configuration is only read and
 * {@link EsdDetector} keeps no per-run state.
 * </p>
 *
 * <pre>
 * ProfiledDetector detector = ProfiledDetector.fromDefaultConfig();
 * DetectionResult result = detector.detect("daily_orders", orders);
 * </pre>
 *
 * @since 1.0.0
 */
public class ProfiledDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ProfiledDetector.class);

    private final DetectionConfig config;
    private final EsdDetector detector;

    /**
     * @param config validated profiles; must not be {@code null}
     */
    public ProfiledDetector(DetectionConfig config) {
        this(config, new EsdDetector());
    }

    public ProfiledDetector(DetectionConfig config, EsdDetector detector) {
        this.config = Objects.requireNonNull(config, "DetectionConfig must not be null");
        this.detector = Objects.requireNonNull(detector, "EsdDetector must not be null");
    }

    /**
     * @return a detector over the profiles found by {@link DetectionConfigLoader#load()}
     */
    public static ProfiledDetector fromDefaultConfig() {
        return new ProfiledDetector(DetectionConfigLoader.load());
    }

    /**
     * @see #detect(String, double[], CancellationToken)
     */
    public DetectionResult detect(String profileName, double[] series) {
        return detect(profileName, series, CancellationToken.NONE);
    }

    /**
     * Detect with the period and parameters of the named profile.
     *
     * @param profileName       configured profile name
     * @param series            observations in time order
     * @param cancellationToken token for the run; {@code null} for none
     * @return the detection outcome
     * @throws InvalidConfigurationException if no profile has that name
     */
    public DetectionResult detect(String profileName, double[] series, CancellationToken cancellationToken) {
        DetectionProfile profile = config.requireProfile(profileName);
        LOG.debug("Running profile '{}' (period={}, maxAnoms={}, alpha={}, direction={})",
                profile.getName(), profile.getPeriod(), profile.getMaxAnoms(),
                profile.getAlpha(), profile.getDirection());

        DetectionResult result = detector.detect(series, profile.getPeriod(), profile.toParams(cancellationToken));
        if (!result.isCanceled()) {
            LOG.info("Profile '{}': {} anomalies in {} observations",
                    profile.getName(), result.getAnomalies().size(), series.length);
        }
        return result;
    }

    /**
     * @return names of the configured profiles
     */
    public Set<String> getProfileNames() {
        return config.getProfileNames();
    }
}
