package com.github.trinity.elasticalign.math;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Median;

/**
 * Numerical primitives shared by the alignment pipeline: finite differences,
 * trapezoidal integration, piecewise-linear resampling and cross-sectional statistics.
 * <p>
 * Sample sets are laid out one row per function, so a table {@code data[M][N]} holds
 * M functions of N samples each and the cross-sectional statistics reduce over rows.
 * </p>
 *
 * @author trinity-xai
 */
public final class Numerics {

    /** Machine epsilon for doubles. */
    public static final double EPS = Math.ulp(1.0);

    private Numerics() {
    }

    /**
     * Mean spacing of a sample grid.
     *
     * @param time sample points, at least two
     * @return mean of consecutive differences
     */
    public static double meanSpacing(double[] time) {
        return (time[time.length - 1] - time[0]) / (time.length - 1);
    }

    /**
     * Numerical derivative with a fixed step: central differences in the interior and
     * one-sided differences at both ends.
     *
     * @param values samples
     * @param step   grid spacing
     * @return derivative estimate, same length as {@code values}
     */
    public static double[] gradient(double[] values, double step) {
        int n = values.length;
        double[] g = new double[n];
        if (n < 2) {
            return g;
        }
        g[0] = (values[1] - values[0]) / step;
        g[n - 1] = (values[n - 1] - values[n - 2]) / step;
        for (int i = 1; i < n - 1; i++) {
            g[i] = (values[i + 1] - values[i - 1]) / (2.0 * step);
        }
        return g;
    }

    /**
     * Trapezoidal rule.
     */
    public static double trapz(double[] x, double[] y) {
        double sum = 0.0;
        for (int i = 1; i < x.length; i++) {
            sum += 0.5 * (x[i] - x[i - 1]) * (y[i] + y[i - 1]);
        }
        return sum;
    }

    /**
     * Cumulative trapezoidal rule, starting at zero.
     */
    public static double[] cumtrapz(double[] x, double[] y) {
        double[] out = new double[x.length];
        for (int i = 1; i < x.length; i++) {
            out[i] = out[i - 1] + 0.5 * (x[i] - x[i - 1]) * (y[i] + y[i - 1]);
        }
        return out;
    }

    /**
     * Euclidean norm of a vector.
     */
    public static double l2Norm(double[] v) {
        double sum = 0.0;
        for (double value : v) {
            sum += value * value;
        }
        return Math.sqrt(sum);
    }

    public static double euclideanDistance(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double diff = a[i] - b[i];
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }

    /**
     * Magnitude of the square root of a value that should be non-negative but may have
     * drifted below zero through rounding. For {@code x < 0} this is {@code |sqrt(x)|}
     * taken over the complex numbers, i.e. {@code sqrt(|x|)}.
     */
    public static double sqrtMagnitude(double x) {
        return Math.sqrt(Math.abs(x));
    }

    /**
     * Piecewise-linear interpolation of {@code (x, y)} at a single point.
     * <p>
     * Knots must be non-decreasing. Queries outside {@code [x[0], x[n-1]]} are clamped to
     * the boundary value, and a query landing on a run of tied knots takes the value of
     * the first knot in the run.
     * </p>
     */
    public static double interpolate(double[] x, double[] y, double xq) {
        int n = x.length;
        if (xq <= x[0]) {
            return y[0];
        }
        if (xq > x[n - 1]) {
            return y[n - 1];
        }
        int lo = 0;
        int hi = n - 1;
        // first index with x[i] >= xq
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (x[mid] < xq) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        if (x[lo] == xq) {
            return y[lo];
        }
        double x0 = x[lo - 1];
        double x1 = x[lo];
        double w = (xq - x0) / (x1 - x0);
        return y[lo - 1] + w * (y[lo] - y[lo - 1]);
    }

    /**
     * Piecewise-linear interpolation of {@code (x, y)} at every query point, with the
     * boundary policy of {@link #interpolate(double[], double[], double)}.
     */
    public static double[] interpolate(double[] x, double[] y, double[] xq) {
        double[] out = new double[xq.length];
        for (int i = 0; i < xq.length; i++) {
            out[i] = interpolate(x, y, xq[i]);
        }
        return out;
    }

    /**
     * Mean across rows at each column.
     *
     * @param data table of shape [rows][cols]
     * @return vector of length cols
     */
    public static double[] columnMeans(double[][] data) {
        int rows = data.length;
        int cols = data[0].length;
        double[] means = new double[cols];
        for (double[] row : data) {
            for (int j = 0; j < cols; j++) {
                means[j] += row[j];
            }
        }
        for (int j = 0; j < cols; j++) {
            means[j] /= rows;
        }
        return means;
    }

    /**
     * Unbiased (n - 1) variance across rows at each column.
     */
    public static double[] columnVariances(double[][] data) {
        int cols = data[0].length;
        double[] variances = new double[cols];
        double[] column = new double[data.length];
        for (int j = 0; j < cols; j++) {
            for (int i = 0; i < data.length; i++) {
                column[i] = data[i][j];
            }
            variances[j] = StatUtils.variance(column);
        }
        return variances;
    }

    /**
     * Values of one column, e.g. the first sample of every function.
     */
    public static double[] column(double[][] data, int col) {
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = data[i][col];
        }
        return out;
    }

    public static double mean(double[] values) {
        return StatUtils.mean(values);
    }

    public static double median(double[] values) {
        return new Median().evaluate(values);
    }

    public static double[][] deepCopy(double[][] original) {
        double[][] copy = new double[original.length][];
        for (int i = 0; i < original.length; i++) {
            copy[i] = original[i].clone();
        }
        return copy;
    }
}
