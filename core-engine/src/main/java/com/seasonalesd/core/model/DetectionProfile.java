package com.seasonalesd.core.model;

import com.seasonalesd.core.exception.InvalidConfigurationException;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Named set of detection settings loaded from configuration.
 *
 * <p>
 * A profile binds a series family (for example "daily_orders") to its
 * seasonal period and test parameters. Call {@link #validate()} after
 * construction / deserialization, then {@link #toParams(CancellationToken)}
 * to obtain the runtime {@link DetectionParams}.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionProfile implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Unique profile name. */
    private String name;

    /** Observations per seasonal cycle; 1 disables decomposition. */
    private int period;

    /** Maximum fraction of the series reported as anomalous. */
    private double maxAnoms = DetectionParams.DEFAULT_MAX_ANOMS;

    /** Significance level. */
    private double alpha = DetectionParams.DEFAULT_ALPHA;

    /** "pos", "neg" or "both". */
    private String direction = Direction.BOTH.getCode();

    /** Log per-iteration progress at INFO. */
    private boolean verbose;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * List every problem with this profile's values.
     *
     * @return problem descriptions; empty when the profile is usable
     */
    public List<String> problems() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Profile 'name' is required");
        }
        if (period < 1) {
            errors.add("Profile '" + name + "' requires 'period' >= 1");
        }
        if (!(maxAnoms > 0 && maxAnoms <= 1)) {
            errors.add("Profile '" + name + "' requires 'maxAnoms' in (0, 1]");
        }
        if (!(alpha > 0 && alpha <= 1)) {
            errors.add("Profile '" + name + "' requires 'alpha' in (0, 1]");
        }
        try {
            Direction.parse(direction);
        } catch (InvalidConfigurationException e) {
            errors.add("Profile '" + name + "': " + e.getMessage());
        }
        return errors;
    }

    /**
     * Validate that all fields are present and contain legal values.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = problems();
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid DetectionProfile: " + String.join("; ", errors));
        }
    }

    /**
     * Build runtime parameters from this profile.
     *
     * @param cancellationToken token for the run; {@code null} for none
     * @return validated parameters
     * @throws InvalidConfigurationException if a value is out of range
     */
    public DetectionParams toParams(CancellationToken cancellationToken) {
        return DetectionParams.builder()
                .alpha(alpha)
                .maxAnoms(maxAnoms)
                .direction(Direction.parse(direction))
                .verbose(verbose)
                .cancellationToken(cancellationToken)
                .build();
    }

    /**
     * @return runtime parameters that are never cancelled
     */
    public DetectionParams toParams() {
        return toParams(CancellationToken.NONE);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public int getPeriod() {
        return period;
    }

    public void setPeriod(int period) {
        this.period = period;
    }

    public double getMaxAnoms() {
        return maxAnoms;
    }

    public void setMaxAnoms(double maxAnoms) {
        this.maxAnoms = maxAnoms;
    }

    public double getAlpha() {
        return alpha;
    }

    public void setAlpha(double alpha) {
        this.alpha = alpha;
    }

    public String getDirection() {
        return direction;
    }

    public void setDirection(String direction) {
        this.direction = direction;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionProfile that))
            return false;
        return Objects.equals(name, that.name) && period == that.period;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, period);
    }

    @Override
    public String toString() {
        return "DetectionProfile{" +
                "name='" + name + '\'' +
                ", period=" + period +
                ", maxAnoms=" + maxAnoms +
                ", alpha=" + alpha +
                ", direction='" + direction + '\'' +
                ", verbose=" + verbose +
                '}';
    }
}
