package com.github.trinity.elasticalign;

/**
 * Output of one matching pass over all functions. Every array is indexed by function
 * first; row k is written only by the task that matched function k.
 *
 * @author trinity-xai
 */
public class MatchResult {
    /** Optimal warps, [M][N], values in [0,1]. */
    public final double[][] warps;
    /** Derivatives of the warps on the uniform grid. */
    public final double[][] warpDerivatives;
    /** Functions resampled through their warps. */
    public final double[][] warpedFunctions;
    /** SRSFs re-encoded from the warped functions. */
    public final double[][] warpedSrsfs;
    /**
     * Unit tangent directions {@code v / ||v||}, v = warped SRSF - template SRSF.
     * Null unless the pass was run with tangents.
     */
    public final double[][] unitTangents;
    /** Reciprocal tangent norms {@code 1 / ||v||}; null unless run with tangents. */
    public final double[] inverseNorms;

    /**
     * @param m            number of functions
     * @param n            samples per function
     * @param withTangents allocate the tangent rows, zero-filled
     */
    public MatchResult(int m, int n, boolean withTangents) {
        warps = new double[m][];
        warpDerivatives = new double[m][];
        warpedFunctions = new double[m][];
        warpedSrsfs = new double[m][];
        unitTangents = withTangents ? new double[m][n] : null;
        inverseNorms = withTangents ? new double[m] : null;
    }

    public boolean hasTangents() {
        return unitTangents != null;
    }

    public int size() {
        return warps.length;
    }
}
