package com.github.trinity.elasticalign;

/**
 * States of the alignment loop. {@code RUNNING} is the only non-terminal state.
 *
 * @author trinity-xai
 */
public enum AlignmentState {
    RUNNING,
    /** Relative change of the template SRSF dropped below the tolerance. */
    CONVERGED,
    /** The round cap was reached first; the result is still returned. */
    MAX_ITERATIONS_EXCEEDED
}
