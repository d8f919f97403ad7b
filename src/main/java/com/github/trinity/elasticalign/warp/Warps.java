package com.github.trinity.elasticalign.warp;

import com.github.trinity.elasticalign.math.Numerics;

/**
 * Operations on warping functions.
 * <p>
 * A warp is stored as N samples of a non-decreasing map of [0,1] onto itself with
 * {@code gam[0] = 0} and {@code gam[N-1] = 1}. It acts on a sample grid
 * {@code time} through {@code (tN - t0) * gam + t0}.
 * </p>
 *
 * @author trinity-xai
 */
public final class Warps {

    private Warps() {
    }

    /**
     * Identity warp for a sample grid: the grid rescaled to [0,1].
     */
    public static double[] identity(double[] time) {
        int n = time.length;
        double t0 = time[0];
        double span = time[n - 1] - t0;
        double[] gam = new double[n];
        for (int i = 0; i < n; i++) {
            gam[i] = (time[i] - t0) / span;
        }
        gam[n - 1] = 1.0;
        return gam;
    }

    /**
     * Maps warp values onto the time domain of {@code time}.
     */
    public static double[] toTime(double[] gam, double[] time) {
        double t0 = time[0];
        double tN = time[time.length - 1];
        double span = tN - t0;
        double[] out = new double[gam.length];
        for (int i = 0; i < gam.length; i++) {
            if (gam[i] <= 0.0) {
                out[i] = t0;
            } else if (gam[i] >= 1.0) {
                out[i] = tN;
            } else {
                out[i] = span * gam[i] + t0;
            }
        }
        return out;
    }

    /**
     * Resamples {@code curve}, sampled on {@code time}, at the warped times
     * {@code gam(t)}. For a function f this is the composition {@code f o gam}; for a
     * warp it is the composition of two warps.
     */
    public static double[] resample(double[] curve, double[] time, double[] gam) {
        return Numerics.interpolate(time, curve, toTime(gam, time));
    }

    /**
     * Derivative of a warp on the uniform grid of [0,1] with {@code gam.length} points.
     */
    public static double[] derivative(double[] gam) {
        return Numerics.gradient(gam, 1.0 / (gam.length - 1));
    }

    /**
     * Group inverse of a warp sampled on the uniform grid of [0,1].
     */
    public static double[] invert(double[] gam) {
        int n = gam.length;
        double[] x = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = (double) i / (n - 1);
        }
        double[] gamI = Numerics.interpolate(gam, x, x);
        gamI[0] = 0.0;
        gamI[n - 1] = 1.0;
        return gamI;
    }
}
