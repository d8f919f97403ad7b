package com.github.trinity.elasticalign;

import com.github.trinity.elasticalign.warp.WarpSolverVariant;

/**
 * Configuration for a group-wise elastic alignment run.
 *
 * <ul>
 *   <li><b>lambda</b>: elasticity weight of the warp roughness penalty. Zero reduces the
 *       matching cost to the pure SRSF distance.</li>
 *   <li><b>method</b>: whether the template is the Karcher mean or the Karcher median.</li>
 *   <li><b>smoothData</b>: apply the box filter to the input before encoding.</li>
 *   <li><b>smoothingPasses</b>: number of box filter passes.</li>
 *   <li><b>parallel</b>: run the per-function matching step on a worker pool.</li>
 *   <li><b>solverVariant</b>: which warp optimizer backend to use.</li>
 *   <li><b>maxIterations</b>: cap on template update rounds; the only bound on runtime.</li>
 * </ul>
 *
 * @author trinity-xai
 */
public class AlignmentConfig {
    /**
     * Elasticity weight, non-negative
     */
    public double lambda = 0.0;

    public Method method = Method.MEAN;

    public boolean smoothData = false;

    /**
     * Passes of the box filter when smoothing is enabled
     */
    public int smoothingPasses = 25;

    public boolean parallel = false;

    public WarpSolverVariant solverVariant = WarpSolverVariant.DP;

    /**
     * Maximum number of template update rounds
     */
    public int maxIterations = 20;

    // Constructor with defaults
    public AlignmentConfig() {
    }

    // Constructor for convenience
    public AlignmentConfig(double lambda, Method method, int maxIterations) {
        this.lambda = lambda;
        this.method = method;
        this.maxIterations = maxIterations;
    }

    /**
     * Convenience constructor taking the method by name, e.g. {@code "mean"} or
     * {@code "median"}.
     *
     * @throws IllegalArgumentException if the name selects no method
     */
    public AlignmentConfig(double lambda, String method, int maxIterations) {
        this(lambda, Method.fromName(method), maxIterations);
    }

    /**
     * Checks every option. Called before any computation starts.
     *
     * @throws IllegalArgumentException on the first invalid option
     */
    public void validate() {
        if (method == null) {
            throw new IllegalArgumentException("invalid method selection: null");
        }
        if (solverVariant == null) {
            throw new IllegalArgumentException("solver variant must not be null");
        }
        if (!(lambda >= 0.0) || Double.isInfinite(lambda)) {
            throw new IllegalArgumentException("lambda must be finite and >= 0: " + lambda);
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be >= 1: " + maxIterations);
        }
        if (smoothingPasses < 0) {
            throw new IllegalArgumentException("smoothingPasses must be >= 0: " + smoothingPasses);
        }
    }

    @Override
    public String toString() {
        return String.format("lambda=%.3f method=%s smoothData=%b smoothingPasses=%d parallel=%b solver=%s maxIterations=%d",
            lambda, method, smoothData, smoothingPasses, parallel, solverVariant, maxIterations);
    }
}
