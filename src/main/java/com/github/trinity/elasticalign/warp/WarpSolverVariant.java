package com.github.trinity.elasticalign.warp;

/**
 * Built-in warp optimizer backends.
 *
 * @author trinity-xai
 */
public enum WarpSolverVariant {
    /** Dynamic programming over a 7-step neighbourhood of slopes. */
    DP(7),
    /** Dynamic programming over a 4-step neighbourhood; faster, coarser slope set. */
    DP2(4);

    private final int neighbourhood;

    WarpSolverVariant(int neighbourhood) {
        this.neighbourhood = neighbourhood;
    }

    public WarpSolver create() {
        return new DynamicProgrammingWarpSolver(neighbourhood);
    }
}
