package com.seasonalesd.core.model;

import com.seasonalesd.core.exception.InvalidConfigurationException;

import java.util.Locale;

/**
 * Which side of the residual distribution is tested.
 *
 * <ul>
 * <li>{@link #POSITIVE}: one-tailed, upper: statistic {@code value - median}</li>
 * <li>{@link #NEGATIVE}: one-tailed, lower: statistic {@code median - value}</li>
 * <li>{@link #BOTH}: two-tailed: statistic {@code |value - median|}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public enum Direction {

    POSITIVE("pos"),
    NEGATIVE("neg"),
    BOTH("both");

    private final String code;

    Direction(String code) {
        this.code = code;
    }

    /**
     * @return the short configuration code ({@code pos}, {@code neg} or
     *         {@code both})
     */
    public String getCode() {
        return code;
    }

    /**
     * @return {@code true} unless this is {@link #BOTH}
     */
    public boolean isOneTailed() {
        return this != BOTH;
    }

    /**
     * Test statistic of {@code value} relative to {@code center}.
     *
     * @param value  residual under test
     * @param center median of the current sample
     * @return the signed or absolute deviation for this direction
     */
    public double deviation(double value, double center) {
        return switch (this) {
            case POSITIVE -> value - center;
            case NEGATIVE -> center - value;
            case BOTH -> Math.abs(value - center);
        };
    }

    /**
     * Parse a direction code, case-insensitively. Enum constant names are
     * accepted as well.
     *
     * @param text {@code pos}, {@code neg} or {@code both}
     * @return the direction
     * @throws InvalidConfigurationException if {@code text} is {@code null} or
     *                                       unknown
     */
    public static Direction parse(String text) {
        if (text != null) {
            String normalized = text.trim().toLowerCase(Locale.ROOT);
            for (Direction d : values()) {
                if (d.code.equals(normalized) || d.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                    return d;
                }
            }
        }
        throw new InvalidConfigurationException("direction must be pos, neg, or both");
    }
}
