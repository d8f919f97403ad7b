package com.github.trinity.elasticalign.warp;

import com.github.trinity.elasticalign.math.Numerics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Dynamic-programming warp solver on the sample grid.
 * <p>
 * Both grids are rescaled to [0,1]. Nodes are pairs {@code (i, j)} meaning template
 * sample i is matched to target sample j; a path runs from {@code (0, 0)} to
 * {@code (n1-1, n2-1)} through steps {@code (di, dj)} with {@code 1 <= di, dj <= nbhd}
 * and {@code gcd(di, dj) = 1}. The cost of a step is the integral over the template
 * segment of {@code (q1(t) - sqrt(s) q2(c + s (t - a)))^2} plus
 * {@code lambda (1 - sqrt(s))^2} times the segment length, where s is the step slope.
 * </p>
 * <p>
 * The unit diagonal step is tried first and a predecessor is only replaced by a strictly
 * cheaper one, so equal inputs produce the identity warp.
 * </p>
 *
 * @author trinity-xai
 */
public class DynamicProgrammingWarpSolver implements WarpSolver {

    private final int[][] steps;

    /**
     * @param neighbourhood largest step in either grid direction, at least 1
     */
    public DynamicProgrammingWarpSolver(int neighbourhood) {
        if (neighbourhood < 1) {
            throw new IllegalArgumentException("neighbourhood must be >= 1: " + neighbourhood);
        }
        this.steps = buildSteps(neighbourhood);
    }

    static int[][] buildSteps(int nbhd) {
        List<int[]> list = new ArrayList<>();
        list.add(new int[]{1, 1});
        for (int di = 1; di <= nbhd; di++) {
            for (int dj = 1; dj <= nbhd; dj++) {
                if ((di != 1 || dj != 1) && gcd(di, dj) == 1) {
                    list.add(new int[]{di, dj});
                }
            }
        }
        return list.toArray(new int[0][]);
    }

    private static int gcd(int a, int b) {
        while (b != 0) {
            int t = a % b;
            a = b;
            b = t;
        }
        return a;
    }

    @Override
    public double[] solve(double[] templateSrsf, double[] templateTime,
                          double[] targetSrsf, double[] targetTime, double lambda) {
        double[] u1 = Warps.identity(templateTime);
        double[] u2 = Warps.identity(targetTime);
        int n1 = u1.length;
        int n2 = u2.length;

        double[][] energy = new double[n1][n2];
        int[][] predecessor = new int[n1][n2];
        for (int i = 0; i < n1; i++) {
            Arrays.fill(energy[i], Double.POSITIVE_INFINITY);
            Arrays.fill(predecessor[i], -1);
        }
        energy[0][0] = 0.0;

        for (int i = 1; i < n1; i++) {
            for (int j = 1; j < n2; j++) {
                double best = Double.POSITIVE_INFINITY;
                int bestStep = -1;
                for (int s = 0; s < steps.length; s++) {
                    int k = i - steps[s][0];
                    int l = j - steps[s][1];
                    if (k < 0 || l < 0 || energy[k][l] == Double.POSITIVE_INFINITY) {
                        continue;
                    }
                    double cost = energy[k][l]
                            + edgeCost(templateSrsf, u1, targetSrsf, u2, k, i, l, j, lambda);
                    if (cost < best) {
                        best = cost;
                        bestStep = s;
                    }
                }
                energy[i][j] = best;
                predecessor[i][j] = bestStep;
            }
        }

        // walk back from the end point
        List<int[]> path = new ArrayList<>();
        int i = n1 - 1;
        int j = n2 - 1;
        path.add(new int[]{i, j});
        while (i > 0 || j > 0) {
            int s = predecessor[i][j];
            if (s < 0) {
                throw new IllegalStateException("No admissible warping path for grids of size "
                        + n1 + " and " + n2);
            }
            i -= steps[s][0];
            j -= steps[s][1];
            path.add(new int[]{i, j});
        }

        int m = path.size();
        double[] pathX = new double[m];
        double[] pathY = new double[m];
        for (int p = 0; p < m; p++) {
            int[] node = path.get(m - 1 - p);
            pathX[p] = u1[node[0]];
            pathY[p] = u2[node[1]];
        }
        double[] gam = Numerics.interpolate(pathX, pathY, u1);
        double g0 = gam[0];
        double span = gam[n1 - 1] - g0;
        for (int p = 0; p < n1; p++) {
            gam[p] = (gam[p] - g0) / span;
        }
        gam[0] = 0.0;
        gam[n1 - 1] = 1.0;
        return gam;
    }

    /**
     * Cost of the straight segment from node {@code (k, l)} to node {@code (i, j)}.
     */
    static double edgeCost(double[] q1, double[] u1, double[] q2, double[] u2,
                           int k, int i, int l, int j, double lambda) {
        double a = u1[k];
        double b = u1[i];
        double c = u2[l];
        double d = u2[j];
        double slope = (d - c) / (b - a);
        double rootSlope = Math.sqrt(slope);
        int samples = Math.max(i - k, j - l);
        double dt = (b - a) / samples;

        double sum = 0.0;
        double previous = 0.0;
        for (int m = 0; m <= samples; m++) {
            double y1;
            double y2;
            if (m == 0) {
                y1 = q1[k];
                y2 = q2[l];
            } else if (m == samples) {
                y1 = q1[i];
                y2 = q2[j];
            } else {
                double frac = (double) m / samples;
                y1 = segmentValue(u1, q1, k, i, a + frac * (b - a));
                y2 = segmentValue(u2, q2, l, j, c + frac * (d - c));
            }
            double diff = y1 - rootSlope * y2;
            double e = diff * diff;
            if (m > 0) {
                sum += 0.5 * dt * (e + previous);
            }
            previous = e;
        }
        double bend = 1.0 - rootSlope;
        return sum + lambda * bend * bend * (b - a);
    }

    private static double segmentValue(double[] u, double[] q, int from, int to, double t) {
        int p = from;
        while (p < to - 1 && u[p + 1] < t) {
            p++;
        }
        double w = (t - u[p]) / (u[p + 1] - u[p]);
        return q[p] + w * (q[p + 1] - q[p]);
    }
}
