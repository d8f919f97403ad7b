package com.github.trinity.elasticalign;

/**
 * Result of a group-wise alignment run. All function tables hold one row per function.
 *
 * @author trinity-xai
 */
public class AlignmentResult {

    /**
     * Variance decomposition of the function set, each term the time integral of a
     * pointwise variance curve.
     */
    public static class VarianceDecomposition {
        public final double original;
        public final double amplitude;
        public final double phase;

        public VarianceDecomposition(double original, double amplitude, double phase) {
            this.original = original;
            this.amplitude = amplitude;
            this.phase = phase;
        }

        @Override
        public String toString() {
            return String.format(
                "Original variance: %.6f\n" +
                    "Amplitude variance: %.6f\n" +
                    "Phase variance: %.6f",
                original, amplitude, phase
            );
        }
    }

    /** Sample grid. */
    public final double[] time;
    /** Input functions as given, before any smoothing. */
    public final double[][] f0;
    /** Aligned functions. */
    public final double[][] fn;
    /** SRSFs of the (possibly smoothed) input functions. */
    public final double[][] q0;
    /** Aligned SRSFs. */
    public final double[][] qn;
    /** Template function (Karcher mean or median). */
    public final double[] fmean;
    /** Template SRSF. */
    public final double[] mqn;
    /** Warping functions, values in [0,1]. */
    public final double[][] gam;
    /** Centring warp applied after the loop. */
    public final double[] gamI;
    /** Relative template change per recorded round; entry 0 is the initialization. */
    public final double[] qun;
    /** Matching cost per update round. */
    public final double[] costs;
    public final VarianceDecomposition variance;
    public final double lambda;
    public final Method method;
    /** Name of the warp optimizer that produced the warps. */
    public final String solver;
    public final AlignmentState state;

    public AlignmentResult(double[] time, double[][] f0, double[][] fn, double[][] q0, double[][] qn,
                           double[] fmean, double[] mqn, double[][] gam, double[] gamI,
                           double[] qun, double[] costs, VarianceDecomposition variance,
                           double lambda, Method method, String solver, AlignmentState state) {
        this.time = time;
        this.f0 = f0;
        this.fn = fn;
        this.q0 = q0;
        this.qn = qn;
        this.fmean = fmean;
        this.mqn = mqn;
        this.gam = gam;
        this.gamI = gamI;
        this.qun = qun;
        this.costs = costs;
        this.variance = variance;
        this.lambda = lambda;
        this.method = method;
        this.solver = solver;
        this.state = state;
    }

    public double getOriginalVariance() {
        return variance.original;
    }

    public double getAmplitudeVariance() {
        return variance.amplitude;
    }

    public double getPhaseVariance() {
        return variance.phase;
    }

    /** Number of update rounds that ran. */
    public int getRounds() {
        return costs.length;
    }

    public boolean isConverged() {
        return state == AlignmentState.CONVERGED;
    }
}
