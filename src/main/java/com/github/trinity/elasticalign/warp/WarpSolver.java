package com.github.trinity.elasticalign.warp;

/**
 * Finds the warp that best aligns a target SRSF to a template SRSF.
 * <p>
 * The returned warp {@code gam} minimises
 * {@code ||q1 - (q2 o gam) sqrt(gam')||^2 + lambda * integral (1 - sqrt(gam'))^2}
 * over the sampled warps. Implementations must be deterministic for fixed inputs and
 * must return a non-decreasing warp of length {@code templateTime.length} with
 * {@code gam[0] = 0} and {@code gam[N-1] = 1}. Implementations are called concurrently
 * from the matching step and must not keep mutable per-call state in fields.
 * </p>
 *
 * @author trinity-xai
 */
public interface WarpSolver {

    /**
     * @param templateSrsf SRSF of the template, sampled on {@code templateTime}
     * @param templateTime template sample grid
     * @param targetSrsf   SRSF of the function to be warped, sampled on {@code targetTime}
     * @param targetTime   target sample grid
     * @param lambda       elasticity weight, non-negative
     * @return optimal warp sampled on the template grid, with values in [0,1]
     */
    double[] solve(double[] templateSrsf, double[] templateTime,
                   double[] targetSrsf, double[] targetTime, double lambda);
}
