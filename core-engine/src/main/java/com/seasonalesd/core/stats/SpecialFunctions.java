package com.seasonalesd.core.stats;

/**
 * Closed-form approximations of the special functions the distributions need.
 *
 * @since 1.0.0
 */
public final class SpecialFunctions {

    private static final double WINITZKI_A = 0.14;

    private static final double[] GAMMA_COEFFICIENTS = {
            76.18009172947146, -86.50532032941677, 24.01409824083091,
            -1.231739572450155, 0.1208650973866179e-2, -0.5395239384953e-5
    };

    private SpecialFunctions() {
        // utility class, not instantiable
    }

    /**
     * Error function, after Winitzki (2008), "A handy approximation for the
     * error function and its inverse".
     *
     * @param x argument
     * @return approximation of erf(x), odd in {@code x}
     */
    public static double erf(double x) {
        double sign = x < 0 ? -1.0 : 1.0;
        double ax = Math.abs(x);
        double x2 = ax * ax;
        return sign * Math.sqrt(1.0 - Math.exp(
                -x2 * (4.0 / Math.PI + WINITZKI_A * x2) / (1.0 + WINITZKI_A * x2)));
    }

    /**
     * Natural logarithm of the gamma function for {@code x > 0}
     * (Lanczos series, six terms).
     *
     * @param x argument, strictly positive
     * @return ln Γ(x), or NaN when {@code x <= 0}
     */
    public static double logGamma(double x) {
        if (!(x > 0)) {
            return Double.NaN;
        }
        double y = x;
        double tmp = x + 5.5;
        tmp -= (x + 0.5) * Math.log(tmp);
        double ser = 1.000000000190015;
        for (double c : GAMMA_COEFFICIENTS) {
            ser += c / ++y;
        }
        return -tmp + Math.log(2.5066282746310005 * ser / x);
    }
}
