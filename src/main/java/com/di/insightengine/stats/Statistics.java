package com.di.insightengine.stats;

import java.util.Arrays;

/**
 * Numeric primitives shared by the analyzers. Pure functions; no I/O and no error states
 * beyond the zero-variance and short-input guards documented per method.
 */
public final class Statistics {

    private Statistics() {
    }

    /** Arithmetic mean; 0 for an empty array. */
    public static double mean(double[] values) {
        if (values == null || values.length == 0) return 0.0;
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    /** Population variance (divides by n); 0 for fewer than 2 values. */
    public static double variance(double[] values) {
        if (values == null || values.length < 2) return 0.0;
        double m = mean(values);
        double ss = 0.0;
        for (double v : values) {
            double d = v - m;
            ss += d * d;
        }
        return ss / values.length;
    }

    public static double stddev(double[] values) {
        return Math.sqrt(variance(values));
    }

    /**
     * OLS regression of {@code y} on {@code x} over the common prefix of both arrays.
     * A constant {@code y} (SStotal = 0) yields slope 0 and rSquared 1.
     */
    public static RegressionResult linearRegression(double[] x, double[] y) {
        int n = Math.min(x != null ? x.length : 0, y != null ? y.length : 0);
        if (n == 0) return new RegressionResult(0.0, 0.0, 0.0);
        double sumX = 0, sumY = 0;
        for (int i = 0; i < n; i++) {
            sumX += x[i];
            sumY += y[i];
        }
        double meanX = sumX / n;
        double meanY = sumY / n;
        double sxx = 0, sxy = 0, ssTotal = 0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - meanX;
            double dy = y[i] - meanY;
            sxx += dx * dx;
            sxy += dx * dy;
            ssTotal += dy * dy;
        }
        if (ssTotal == 0.0) {
            return new RegressionResult(0.0, meanY, 1.0);
        }
        if (sxx == 0.0) {
            return new RegressionResult(0.0, meanY, 0.0);
        }
        double slope = sxy / sxx;
        double intercept = meanY - slope * meanX;
        double ssRes = 0;
        for (int i = 0; i < n; i++) {
            double r = y[i] - (slope * x[i] + intercept);
            ssRes += r * r;
        }
        return new RegressionResult(slope, intercept, 1.0 - ssRes / ssTotal);
    }

    /** Regression of {@code y} against its own index 0..n-1. */
    public static RegressionResult linearRegression(double[] y) {
        return linearRegression(indices(y != null ? y.length : 0), y);
    }

    /**
     * Pearson correlation over the common prefix of both arrays, in [-1, 1].
     * Returns 0 when fewer than 2 points or when either side has zero variance.
     */
    public static double pearson(double[] x, double[] y) {
        int n = Math.min(x != null ? x.length : 0, y != null ? y.length : 0);
        return pearson(x, 0, y, 0, n);
    }

    /**
     * Pearson correlation of {@code x[xFrom..xFrom+n)} against {@code y[yFrom..yFrom+n)}.
     */
    public static double pearson(double[] x, int xFrom, double[] y, int yFrom, int n) {
        if (n < 2) return 0.0;
        double sumX = 0, sumY = 0;
        for (int i = 0; i < n; i++) {
            sumX += x[xFrom + i];
            sumY += y[yFrom + i];
        }
        double meanX = sumX / n;
        double meanY = sumY / n;
        double sxx = 0, syy = 0, sxy = 0;
        for (int i = 0; i < n; i++) {
            double dx = x[xFrom + i] - meanX;
            double dy = y[yFrom + i] - meanY;
            sxx += dx * dx;
            syy += dy * dy;
            sxy += dx * dy;
        }
        if (sxx == 0.0 || syy == 0.0) return 0.0;
        double r = sxy / Math.sqrt(sxx * syy);
        return Math.max(-1.0, Math.min(1.0, r));
    }

    /**
     * Percentile by linear interpolation between closest ranks; {@code p} in [0, 100].
     * Returns 0 for an empty array.
     */
    public static double percentile(double[] values, double p) {
        if (values == null || values.length == 0) return 0.0;
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        double clamped = Math.max(0.0, Math.min(100.0, p));
        double rank = clamped / 100.0 * (sorted.length - 1);
        int lo = (int) Math.floor(rank);
        int hi = (int) Math.ceil(rank);
        if (lo == hi) return sorted[lo];
        return sorted[lo] + (rank - lo) * (sorted[hi] - sorted[lo]);
    }

    public static double median(double[] values) {
        return percentile(values, 50.0);
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public static double[] indices(int n) {
        double[] out = new double[n];
        for (int i = 0; i < n; i++) out[i] = i;
        return out;
    }
}
