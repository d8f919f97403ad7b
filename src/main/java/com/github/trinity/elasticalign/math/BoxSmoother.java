package com.github.trinity.elasticalign.math;

/**
 * Repeated 3-point box filter {@code (1, 2, 1) / 4}.
 * <p>
 * Every pass reads the values left by the previous pass, so the filter is applied to
 * all interior points simultaneously. End points are never modified.
 * </p>
 *
 * @author trinity-xai
 */
public final class BoxSmoother {

    private BoxSmoother() {
    }

    /**
     * Smooths each row of {@code data} {@code passes} times. The input is not modified.
     *
     * @param data   functions, one per row
     * @param passes number of filter passes, non-negative
     * @return smoothed copy
     */
    public static double[][] smooth(double[][] data, int passes) {
        double[][] out = Numerics.deepCopy(data);
        for (double[] row : out) {
            smoothInPlace(row, passes);
        }
        return out;
    }

    public static void smoothInPlace(double[] f, int passes) {
        int n = f.length;
        if (n < 3) {
            return;
        }
        double[] prev = new double[n];
        for (int p = 0; p < passes; p++) {
            System.arraycopy(f, 0, prev, 0, n);
            for (int i = 1; i < n - 1; i++) {
                f[i] = (prev[i - 1] + 2.0 * prev[i] + prev[i + 1]) / 4.0;
            }
        }
    }
}
