package com.github.trinity.elasticalign.warp;

import com.github.trinity.elasticalign.math.Numerics;

import java.util.Arrays;

/**
 * Inverse of the Karcher mean of a set of warping functions.
 * <p>
 * Each warp {@code gam} is mapped to {@code psi = sqrt(gam')}, a point on the unit
 * Hilbert sphere. The Karcher mean of the {@code psi} is computed intrinsically on the
 * sphere (shooting vectors, averaging them in the tangent space at the current estimate,
 * then moving along the geodesic), integrated back to a warp and inverted. Composing
 * every warp of the set with the result centres the set at the identity.
 * </p>
 *
 * @author trinity-xai
 */
public final class KarcherWarpInverse {

    public static final int MAX_ITERATIONS = 20;
    public static final double TOLERANCE = 1e-6;
    private static final double MIN_ARC = 1e-4;

    /** Centring warp and its derivative on the uniform grid of [0,1]. */
    public record InverseWarp(double[] gamI, double[] derivative) {
    }

    private KarcherWarpInverse() {
    }

    /**
     * @param warps K warps of equal length N, one per row
     * @return the inverse of their Karcher mean, with its derivative
     */
    public static InverseWarp compute(double[][] warps) {
        int k = warps.length;
        int n = warps[0].length;
        double[] grid = new double[n];
        for (int i = 0; i < n; i++) {
            grid[i] = (double) i / (n - 1);
        }
        double binsize = Numerics.meanSpacing(grid);

        double[][] psi = new double[k][];
        for (int j = 0; j < k; j++) {
            double[] dev = Numerics.gradient(warps[j], binsize);
            psi[j] = new double[n];
            for (int i = 0; i < n; i++) {
                psi[j][i] = Numerics.sqrtMagnitude(dev[i]);
            }
        }

        // start from the psi closest to the extrinsic average
        double[] mnpsi = Numerics.columnMeans(psi);
        int minIndex = 0;
        double minDist = Double.MAX_VALUE;
        for (int j = 0; j < k; j++) {
            double dist = Numerics.euclideanDistance(psi[j], mnpsi);
            if (dist < minDist) {
                minDist = dist;
                minIndex = j;
            }
        }
        double[] mu = psi[minIndex].clone();

        double[][] shooting = new double[k][n];
        double[] product = new double[n];
        for (int iter = 0; iter < MAX_ITERATIONS; iter++) {
            for (int j = 0; j < k; j++) {
                for (int i = 0; i < n; i++) {
                    product[i] = mu[i] * psi[j][i];
                }
                double dot = Math.max(-1.0, Math.min(1.0, Numerics.trapz(grid, product)));
                double len = Math.acos(dot);
                if (len > MIN_ARC) {
                    double scale = len / Math.sin(len);
                    double cos = Math.cos(len);
                    for (int i = 0; i < n; i++) {
                        shooting[j][i] = scale * (psi[j][i] - cos * mu[i]);
                    }
                } else {
                    Arrays.fill(shooting[j], 0.0);
                }
            }
            double[] vm = Numerics.columnMeans(shooting);
            double sq = 0.0;
            for (double v : vm) {
                sq += v * v;
            }
            double lvm = Math.sqrt(sq * binsize);
            if (lvm < TOLERANCE) {
                break;
            }
            double cos = Math.cos(lvm);
            double sinOverLen = Math.sin(lvm) / lvm;
            for (int i = 0; i < n; i++) {
                mu[i] = cos * mu[i] + sinOverLen * vm[i];
            }
        }

        double[] muSq = new double[n];
        for (int i = 0; i < n; i++) {
            muSq[i] = mu[i] * mu[i];
        }
        double[] gamMu = Numerics.cumtrapz(grid, muSq);
        double min = gamMu[0];
        double max = gamMu[n - 1];
        for (int i = 0; i < n; i++) {
            gamMu[i] = (gamMu[i] - min) / (max - min);
        }
        double[] gamI = Warps.invert(gamMu);
        return new InverseWarp(gamI, Warps.derivative(gamI));
    }
}
