package com.github.trinity.elasticalign.demo;

import java.util.Random;

/**
 * Synthetic functional data: families of Gaussian bumps with timing and amplitude
 * variation on a uniform grid.
 *
 * @author trinity-xai
 */
public final class SimulatedData {

    private SimulatedData() {
    }

    /**
     * Uniform grid of {@code n} points on {@code [a, b]}, end points included exactly.
     */
    public static double[] uniformGrid(int n, double a, double b) {
        double[] t = new double[n];
        for (int i = 0; i < n; i++) {
            t[i] = a + (b - a) * i / (n - 1);
        }
        t[n - 1] = b;
        return t;
    }

    /**
     * {@code height * exp(-(t - center)^2 / (2 width^2))} sampled on {@code time}.
     */
    public static double[] bump(double[] time, double center, double width, double height) {
        double[] f = new double[time.length];
        for (int i = 0; i < time.length; i++) {
            double z = (time[i] - center) / width;
            f[i] = height * Math.exp(-0.5 * z * z);
        }
        return f;
    }

    /**
     * Unit-height bumps centred at {@code center + shifts[k]}, one row per shift.
     */
    public static double[][] shiftedBumps(double[] time, double center, double width, double... shifts) {
        double[][] f = new double[shifts.length][];
        for (int k = 0; k < shifts.length; k++) {
            f[k] = bump(time, center + shifts[k], width, 1.0);
        }
        return f;
    }

    /**
     * Random bump family: centres uniform in {@code 0.5 +/- maxShift} of the grid span,
     * heights {@code 1 + heightSd * N(0,1)}.
     *
     * @param time     sample grid
     * @param count    number of functions
     * @param maxShift largest timing shift as a fraction of the grid span
     * @param heightSd standard deviation of the heights
     * @param seed     random seed for reproducibility
     * @return functions, one per row
     */
    public static double[][] randomBumps(double[] time, int count, double maxShift, double heightSd, long seed) {
        Random rand = new Random(seed);
        double t0 = time[0];
        double span = time[time.length - 1] - t0;
        double[][] f = new double[count][];
        for (int k = 0; k < count; k++) {
            double shift = (2.0 * rand.nextDouble() - 1.0) * maxShift;
            double height = 1.0 + heightSd * rand.nextGaussian();
            f[k] = bump(time, t0 + span * (0.5 + shift), 0.1 * span, height);
        }
        return f;
    }
}
