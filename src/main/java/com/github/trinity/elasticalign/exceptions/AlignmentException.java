package com.github.trinity.elasticalign.exceptions;

/**
 * Raised when a collaborator (warp solver or SRSF transform) fails during an alignment
 * run. The run is aborted: a missing warp leaves the population update of that round
 * undefined.
 *
 * @author trinity-xai
 */
public class AlignmentException extends RuntimeException {
    public AlignmentException(String message, Throwable cause) {
        super("Alignment failed: " + message, cause);
    }
}
