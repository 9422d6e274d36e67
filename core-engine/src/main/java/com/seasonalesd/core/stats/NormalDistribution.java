package com.seasonalesd.core.stats;

/**
 * Normal distribution density, cumulative distribution and quantile
 * functions.
 *
 * <p>
 * Every method is pure. Arguments outside the valid domain yield
 * {@link Double#NaN}; nothing here throws.
 * </p>
 *
 * @since 1.0.0
 */
public final class NormalDistribution {

    private static final double SQRT_2 = Math.sqrt(2.0);
    private static final double SQRT_2PI = Math.sqrt(2.0 * Math.PI);

    // AS241 region boundaries
    private static final double SPLIT1 = 0.425;
    private static final double SPLIT2 = 5.0;
    private static final double CONST1 = 0.180625;
    private static final double CONST2 = 1.6;

    private NormalDistribution() {
        // utility class, not instantiable
    }

    /**
     * @return the density at {@code x}, or NaN when {@code stdDev <= 0}
     */
    public static double pdf(double x, double mean, double stdDev) {
        if (!(stdDev > 0)) {
            return Double.NaN;
        }
        double z = (x - mean) / stdDev;
        return Math.exp(-0.5 * z * z) / (stdDev * SQRT_2PI);
    }

    /**
     * @return P(X &le; x), or NaN when {@code stdDev <= 0}
     */
    public static double cdf(double x, double mean, double stdDev) {
        if (!(stdDev > 0)) {
            return Double.NaN;
        }
        return 0.5 * (1.0 + SpecialFunctions.erf((x - mean) / (stdDev * SQRT_2)));
    }

    /**
     * Quantile function, Wichura (1988) Algorithm AS241 (PPND16).
     *
     * @param p      probability in {@code [0, 1]}
     * @param mean   finite mean
     * @param stdDev finite, strictly positive standard deviation
     * @return the quantile; {@code -Infinity} for {@code p == 0},
     *         {@code +Infinity} for {@code p == 1}, NaN outside the domain
     */
    public static double ppf(double p, double mean, double stdDev) {
        if (Double.isNaN(p) || p < 0 || p > 1
                || !Double.isFinite(mean) || !Double.isFinite(stdDev) || stdDev <= 0) {
            return Double.NaN;
        }
        if (p == 0) {
            return Double.NEGATIVE_INFINITY;
        }
        if (p == 1) {
            return Double.POSITIVE_INFINITY;
        }

        double q = p - 0.5;
        if (Math.abs(q) < SPLIT1) {
            double r = CONST1 - q * q;
            return mean + stdDev * q * centralNumerator(r) / centralDenominator(r);
        }

        double r = q < 0 ? p : 1.0 - p;
        r = Math.sqrt(-Math.log(r));
        double sign = q < 0 ? -1.0 : 1.0;
        double z;
        if (r < SPLIT2) {
            r -= CONST2;
            z = intermediateNumerator(r) / intermediateDenominator(r);
        } else {
            r -= SPLIT2;
            z = farTailNumerator(r) / farTailDenominator(r);
        }
        return mean + stdDev * sign * z;
    }

    private static double centralNumerator(double r) {
        return ((((((2509.0809287301226727 * r
                + 33430.575583588128105) * r
                + 67265.770927008700853) * r
                + 45921.953931549871457) * r
                + 13731.693765509461125) * r
                + 1971.5909503065514427) * r
                + 133.14166789178437745) * r
                + 3.387132872796366608;
    }

    private static double centralDenominator(double r) {
        return ((((((5226.4952788528545610 * r
                + 28729.085735721942674) * r
                + 39307.89580009271061) * r
                + 21213.794301586595867) * r
                + 5394.1960214247511077) * r
                + 687.1870074920579083) * r
                + 42.313330701600911252) * r
                + 1.0;
    }

    private static double intermediateNumerator(double r) {
        return ((((((7.7454501427834140764e-4 * r
                + 0.0227238449892691845833) * r
                + 0.24178072517745061177) * r
                + 1.27045825245236838258) * r
                + 3.64784832476320460504) * r
                + 5.7694972214606914055) * r
                + 4.6303378461565452959) * r
                + 1.42343711074968357734;
    }

    private static double intermediateDenominator(double r) {
        return ((((((1.05075007164441684324e-9 * r
                + 5.475938084995344946e-4) * r
                + 0.0151986665636164571966) * r
                + 0.14810397642748007459) * r
                + 0.68976733498510000455) * r
                + 1.6763848301838038494) * r
                + 2.05319162663775882187) * r
                + 1.0;
    }

    private static double farTailNumerator(double r) {
        return ((((((2.01033439929228813265e-7 * r
                + 2.71155556874348757815e-5) * r
                + 0.0012426609473880784386) * r
                + 0.026532189526576123093) * r
                + 0.29656057182850489123) * r
                + 1.7848265399172913358) * r
                + 5.4637849111641143699) * r
                + 6.6579046435011037772;
    }

    private static double farTailDenominator(double r) {
        return ((((((2.04426310338993978564e-15 * r
                + 1.4215117583164458887e-7) * r
                + 1.8463183175100546818e-5) * r
                + 7.868691311456132591e-4) * r
                + 0.0148753612908506148525) * r
                + 0.13692988092273580531) * r
                + 0.59983220655588793769) * r
                + 1.0;
    }
}
