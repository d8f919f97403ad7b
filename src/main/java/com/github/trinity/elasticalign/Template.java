package com.github.trinity.elasticalign;

/**
 * Current template estimate: a function and its SRSF on the common sample grid.
 *
 * @param function template function samples
 * @param srsf     template SRSF samples
 * @author trinity-xai
 */
public record Template(double[] function, double[] srsf) {
}
