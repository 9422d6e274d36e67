package com.seasonalesd.core.decomposition;

import java.util.Arrays;

/**
 * Numerical routines of STL, the Seasonal-Trend decomposition procedure based
 * on Loess.
 *
 * <p>
 * R. B. Cleveland, W. S. Cleveland, J. E. McRae and I. Terpenning (1990).
 * STL: A Seasonal-Trend Decomposition Procedure Based on Loess. Journal of
 * Official Statistics, 6, 3-73.
 * </p>
 *
 * <p>
 * Loops use the 1-based positions of the published procedure; array accesses
 * subtract one. Work arrays are sized {@code n + 2 * np}.
 * </p>
 */
final class StlKernel {

    private StlKernel() {
        // utility class, not instantiable
    }

    /**
     * Run the full decomposition. {@code season} and {@code trend} must have
     * room for {@code n + 2 * np} and {@code n} values respectively.
     */
    static void stl(double[] y, int n, int np, int ns, int nt, int nl,
                    int isdeg, int itdeg, int ildeg,
                    int nsjump, int ntjump, int nljump,
                    int ni, int no,
                    double[] rw, double[] season, double[] trend) {
        int workSize = n + 2 * np;
        double[] work1 = new double[workSize];
        double[] work2 = new double[workSize];
        double[] work3 = new double[workSize];
        double[] work4 = new double[workSize];
        double[] work5 = new double[workSize];

        Arrays.fill(trend, 0, n, 0.0);
        boolean userw = false;

        // outer loop -- robustness iterations
        int k = 0;
        while (true) {
            innerLoop(y, n, np, ns, nt, nl, isdeg, itdeg, ildeg, nsjump, ntjump, nljump,
                    ni, userw, rw, season, trend, work1, work2, work3, work4, work5);
            k++;
            if (k > no) {
                break;
            }
            for (int i = 0; i < n; i++) {
                work1[i] = trend[i] + season[i];
            }
            robustnessWeights(y, n, work1, rw);
            userw = true;
        }

        if (no <= 0) {
            Arrays.fill(rw, 0, n, 1.0);
        }
    }

    private static void innerLoop(double[] y, int n, int np, int ns, int nt, int nl,
                                  int isdeg, int itdeg, int ildeg,
                                  int nsjump, int ntjump, int nljump,
                                  int ni, boolean userw, double[] rw,
                                  double[] season, double[] trend,
                                  double[] work1, double[] work2, double[] work3,
                                  double[] work4, double[] work5) {
        for (int j = 0; j < ni; j++) {
            for (int i = 0; i < n; i++) {
                work1[i] = y[i] - trend[i];
            }
            smoothCycleSubseries(work1, n, np, ns, isdeg, nsjump, userw, rw,
                    work2, work3, work4, work5, season);
            lowPassFilter(work2, n + 2 * np, np, work3, work1);
            loess(work3, n, nl, ildeg, nljump, false, work4, work1, 0, work5);
            for (int i = 0; i < n; i++) {
                season[i] = work2[np + i] - work1[i];
            }
            for (int i = 0; i < n; i++) {
                work1[i] = y[i] - season[i];
            }
            loess(work1, n, nt, itdeg, ntjump, userw, rw, trend, 0, work3);
        }
    }

    /**
     * Smooths each cycle-subseries and extrapolates it by one value at each
     * end, so {@code season} receives {@code n + 2 * np} values.
     */
    private static void smoothCycleSubseries(double[] y, int n, int np, int ns, int isdeg,
                                             int nsjump, boolean userw, double[] rw,
                                             double[] season, double[] work1, double[] work2,
                                             double[] work3, double[] work4) {
        for (int j = 1; j <= np; j++) {
            int k = (n - j) / np + 1;

            for (int i = 1; i <= k; i++) {
                work1[i - 1] = y[(i - 1) * np + j - 1];
            }
            if (userw) {
                for (int i = 1; i <= k; i++) {
                    work3[i - 1] = rw[(i - 1) * np + j - 1];
                }
            }

            loess(work1, k, ns, isdeg, nsjump, userw, work3, work2, 1, work4);

            int nright = Math.min(ns, k);
            if (!estimate(work1, k, ns, isdeg, 0.0, work2, 0, 1, nright, work4, userw, work3)) {
                work2[0] = work2[1];
            }

            int nleft = Math.max(1, k - ns + 1);
            if (!estimate(work1, k, ns, isdeg, k + 1, work2, k + 1, nleft, k, work4, userw, work3)) {
                work2[k + 1] = work2[k];
            }

            for (int m = 1; m <= k + 2; m++) {
                season[(m - 1) * np + j - 1] = work2[m - 1];
            }
        }
    }

    /**
     * Loess smoothing of {@code y[0..n)} into {@code ys[offset..offset+n)},
     * fitting every {@code njump}-th point and interpolating linearly between.
     */
    private static void loess(double[] y, int n, int len, int ideg, int njump,
                              boolean userw, double[] rw, double[] ys, int offset,
                              double[] res) {
        if (n < 2) {
            ys[offset] = y[0];
            return;
        }

        int newnj = Math.min(njump, n - 1);
        int nleft = 0;
        int nright = 0;

        if (len >= n) {
            nleft = 1;
            nright = n;
            for (int i = 1; i <= n; i += newnj) {
                fitAt(y, n, len, ideg, i, ys, offset, nleft, nright, res, userw, rw);
            }
        } else if (newnj == 1) {
            int nsh = (len + 1) / 2;
            nleft = 1;
            nright = len;
            for (int i = 1; i <= n; i++) {
                if (i > nsh && nright != n) {
                    nleft++;
                    nright++;
                }
                fitAt(y, n, len, ideg, i, ys, offset, nleft, nright, res, userw, rw);
            }
        } else {
            int nsh = (len + 1) / 2;
            for (int i = 1; i <= n; i += newnj) {
                if (i < nsh) {
                    nleft = 1;
                    nright = len;
                } else if (i >= n - nsh + 1) {
                    nleft = n - len + 1;
                    nright = n;
                } else {
                    nleft = i - nsh + 1;
                    nright = len + i - nsh;
                }
                fitAt(y, n, len, ideg, i, ys, offset, nleft, nright, res, userw, rw);
            }
        }

        if (newnj != 1) {
            for (int i = 1; i <= n - newnj; i += newnj) {
                double delta = (ys[offset + i + newnj - 1] - ys[offset + i - 1]) / newnj;
                for (int j = i + 1; j <= i + newnj - 1; j++) {
                    ys[offset + j - 1] = ys[offset + i - 1] + delta * (j - i);
                }
            }
            int k = ((n - 1) / newnj) * newnj + 1;
            if (k != n) {
                fitAt(y, n, len, ideg, n, ys, offset, nleft, nright, res, userw, rw);
                if (k != n - 1) {
                    double delta = (ys[offset + n - 1] - ys[offset + k - 1]) / (n - k);
                    for (int j = k + 1; j <= n - 1; j++) {
                        ys[offset + j - 1] = ys[offset + k - 1] + delta * (j - k);
                    }
                }
            }
        }
    }

    private static void fitAt(double[] y, int n, int len, int ideg, int i,
                              double[] ys, int offset, int nleft, int nright,
                              double[] res, boolean userw, double[] rw) {
        if (!estimate(y, n, len, ideg, i, ys, offset + i - 1, nleft, nright, res, userw, rw)) {
            ys[offset + i - 1] = y[i - 1];
        }
    }

    /**
     * Local (degree 0 or 1) weighted fit at abscissa {@code xs} over positions
     * {@code nleft..nright} with tricube weights.
     *
     * @return {@code false} when every weight is zero and no fit exists
     */
    private static boolean estimate(double[] y, int n, int len, int ideg, double xs,
                                    double[] ys, int ysIndex, int nleft, int nright,
                                    double[] w, boolean userw, double[] rw) {
        double range = n - 1.0;
        double h = Math.max(xs - nleft, nright - xs);
        if (len > n) {
            h += (len - n) / 2;
        }
        double h9 = 0.999 * h;
        double h1 = 0.001 * h;

        double a = 0.0;
        for (int j = nleft; j <= nright; j++) {
            w[j - 1] = 0.0;
            double r = Math.abs(j - xs);
            if (r <= h9) {
                if (r <= h1) {
                    w[j - 1] = 1.0;
                } else {
                    double ratio = r / h;
                    double cube = 1.0 - ratio * ratio * ratio;
                    w[j - 1] = cube * cube * cube;
                }
                if (userw) {
                    w[j - 1] *= rw[j - 1];
                }
                a += w[j - 1];
            }
        }

        if (a <= 0.0) {
            return false;
        }

        for (int j = nleft; j <= nright; j++) {
            w[j - 1] /= a;
        }

        if (h > 0.0 && ideg > 0) {
            double center = 0.0;
            for (int j = nleft; j <= nright; j++) {
                center += w[j - 1] * j;
            }
            double b = xs - center;
            double c = 0.0;
            for (int j = nleft; j <= nright; j++) {
                c += w[j - 1] * (j - center) * (j - center);
            }
            if (Math.sqrt(c) > 0.001 * range) {
                b /= c;
                for (int j = nleft; j <= nright; j++) {
                    w[j - 1] *= b * (j - center) + 1.0;
                }
            }
        }

        double fit = 0.0;
        for (int j = nleft; j <= nright; j++) {
            fit += w[j - 1] * y[j - 1];
        }
        ys[ysIndex] = fit;
        return true;
    }

    /** Moving averages of length np, np and 3 applied in turn. */
    private static void lowPassFilter(double[] x, int n, int np, double[] trend, double[] work) {
        movingAverage(x, n, np, trend);
        movingAverage(trend, n - np + 1, np, work);
        movingAverage(work, n - 2 * np + 2, 3, trend);
    }

    private static void movingAverage(double[] x, int n, int len, double[] ave) {
        int newn = n - len + 1;
        double v = 0.0;
        for (int i = 0; i < len; i++) {
            v += x[i];
        }
        ave[0] = v / len;
        int k = len;
        int m = 0;
        for (int j = 1; j < newn; j++) {
            v = v - x[m] + x[k];
            ave[j] = v / len;
            k++;
            m++;
        }
    }

    /** Bisquare weights from residuals scaled by six times their median. */
    private static void robustnessWeights(double[] y, int n, double[] fit, double[] rw) {
        double[] residuals = new double[n];
        for (int i = 0; i < n; i++) {
            residuals[i] = Math.abs(y[i] - fit[i]);
        }
        Arrays.sort(residuals);
        double cmad = 3.0 * (residuals[(n - 1) / 2] + residuals[n / 2]);
        double c9 = 0.999 * cmad;
        double c1 = 0.001 * cmad;

        for (int i = 0; i < n; i++) {
            double r = Math.abs(y[i] - fit[i]);
            if (r <= c1) {
                rw[i] = 1.0;
            } else if (r <= c9) {
                double u = r / cmad;
                double v = 1.0 - u * u;
                rw[i] = v * v;
            } else {
                rw[i] = 0.0;
            }
        }
    }
}
