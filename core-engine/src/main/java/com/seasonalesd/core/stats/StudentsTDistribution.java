package com.seasonalesd.core.stats;

/**
 * Student's t-distribution with real-valued degrees of freedom.
 *
 * <p>
 * The CDF follows Hill (1970), Algorithm 395, and the quantile function
 * Hill (1970), Algorithm 396, both in Communications of the ACM 13(10).
 * {@code df == +Infinity} degenerates to the standard normal distribution.
 * Domain violations yield {@link Double#NaN}.
 * </p>
 *
 * @since 1.0.0
 */
public final class StudentsTDistribution {

    private static final double HALF_PI = Math.PI / 2.0;

    private StudentsTDistribution() {
        // utility class, not instantiable
    }

    /**
     * @param x  point of evaluation
     * @param df degrees of freedom, strictly positive
     * @return the density, or NaN when {@code df <= 0}
     */
    public static double pdf(double x, double df) {
        if (!(df > 0)) {
            return Double.NaN;
        }
        if (df == Double.POSITIVE_INFINITY) {
            return NormalDistribution.pdf(x, 0.0, 1.0);
        }
        double logRatio = SpecialFunctions.logGamma((df + 1.0) / 2.0)
                - SpecialFunctions.logGamma(df / 2.0);
        return Math.exp(logRatio) / Math.sqrt(df * Math.PI)
                * Math.pow(1.0 + x * x / df, -(df + 1.0) / 2.0);
    }

    /**
     * Cumulative distribution function (Hill's Algorithm 395).
     *
     * <p>
     * Non-integer degrees of freedom, {@code df >= 20} with {@code x² < df}, and
     * {@code df > 200} use the asymptotic normal-based series. Otherwise
     * {@code df < 20} with {@code x² < 4} sums the cosine series and everything
     * else uses the tail series.
     * </p>
     *
     * @param x  point of evaluation
     * @param df degrees of freedom, {@code >= 1}
     * @return P(T &le; x), or NaN when {@code df < 1} or an argument is NaN
     */
    public static double cdf(double x, double df) {
        if (Double.isNaN(x) || Double.isNaN(df) || df < 1) {
            return Double.NaN;
        }
        if (Double.isInfinite(x)) {
            return x < 0 ? 0.0 : 1.0;
        }
        if (df == Double.POSITIVE_INFINITY) {
            return NormalDistribution.cdf(x, 0.0, 1.0);
        }

        double start = x < 0 ? 0.0 : 1.0;
        double sign = x < 0 ? 1.0 : -1.0;

        double z = 1.0;
        double t = x * x;
        double y = t / df;
        double b = 1.0 + y;

        if (df > Math.floor(df) || (df >= 20 && t < df) || df > 200) {
            if (y > 10e-6) {
                y = Math.log(b);
            }
            double a = df - 0.5;
            b = 48.0 * a * a;
            y = a * y;
            y = (((((-0.4 * y - 3.3) * y - 24.0) * y - 85.5)
                    / (0.8 * y * y + 100.0 + b) + y + 3.0) / b + 1.0) * Math.sqrt(y);
            return start + sign * NormalDistribution.cdf(-y, 0.0, 1.0);
        }

        // df is integral and at most 200 from here on
        int n = (int) df;
        double a;

        if (n < 20 && t < 4.0) {
            y = Math.sqrt(y);
            a = y;
            if (n == 1) {
                a = 0.0;
            }
            if (n > 1) {
                n -= 2;
                while (n > 1) {
                    a = (n - 1) / (b * n) * a + y;
                    n -= 2;
                }
            }
        } else {
            // tail series for large t
            a = Math.sqrt(b);
            y = a * n;
            int j = 0;
            while (a != z) {
                j += 2;
                z = a;
                y = y * (j - 1) / (b * j);
                a = a + y / (n + j);
            }
            z = 0.0;
            y = 0.0;
            a = -a;
            while (n > 1) {
                a = (n - 1) / (b * n) * a + y;
                n -= 2;
            }
        }

        a = n == 0 ? a / Math.sqrt(b) : (Math.atan(y) + a / b) * (2.0 / Math.PI);
        return start + sign * (z - a) / 2.0;
    }

    /**
     * Quantile function (Hill's Algorithm 396).
     *
     * @param p  probability in {@code [0, 1]}
     * @param df degrees of freedom, {@code >= 1}
     * @return the quantile, or NaN outside the domain
     */
    public static double ppf(double p, double df) {
        if (Double.isNaN(p) || Double.isNaN(df) || p < 0 || p > 1 || df < 1) {
            return Double.NaN;
        }
        if (df == Double.POSITIVE_INFINITY) {
            return NormalDistribution.ppf(p, 0.0, 1.0);
        }

        // symmetric: work in the upper half
        double sign = p < 0.5 ? -1.0 : 1.0;
        double upper = p < 0.5 ? 1.0 - p : p;

        // two-tailed probability
        double q = 2.0 * (1.0 - upper);

        if (df == 2) {
            return sign * Math.sqrt(2.0 / (q * (2.0 - q)) - 2.0);
        }
        if (df == 1) {
            double angle = q * HALF_PI;
            return sign * Math.cos(angle) / Math.sin(angle);
        }

        double a = 1.0 / (df - 0.5);
        double b = 48.0 / (a * a);
        double c = ((20700.0 * a / b - 98.0) * a - 16.0) * a + 96.36;
        double d = ((94.5 / (b + c) - 3.0) / b + 1.0) * Math.sqrt(a * HALF_PI) * df;
        double x = d * q;
        double y = Math.pow(x, 2.0 / df);

        if (y > 0.05 + a) {
            // asymptotic inverse expansion about the normal
            x = NormalDistribution.ppf(q * 0.5, 0.0, 1.0);
            y = x * x;
            if (df < 5) {
                c += 0.3 * (df - 4.5) * (x + 0.6);
            }
            c = (((0.05 * d * x - 5.0) * x - 7.0) * x - 2.0) * x + b + c;
            y = (((((0.4 * y + 6.3) * y + 36.0) * y + 94.5) / c - y - 3.0) / b + 1.0) * x;
            y = a * y * y;
            y = y > 0.002 ? Math.exp(y) - 1.0 : 0.5 * y * y + y;
        } else {
            y = ((1.0 / (((df + 6.0) / (df * y) - 0.089 * d - 0.822) * (df + 2.0) * 3.0)
                    + 0.5 / (df + 4.0)) * y - 1.0) * (df + 1.0) / (df + 2.0) + 1.0 / y;
        }
        return sign * Math.sqrt(df * y);
    }
}
