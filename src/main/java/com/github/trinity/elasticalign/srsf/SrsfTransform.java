package com.github.trinity.elasticalign.srsf;

import com.github.trinity.elasticalign.math.Numerics;
import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

/**
 * Square-root slope function (SRSF) transform.
 * <p>
 * For a function f with derivative f' the SRSF is {@code q = f' / sqrt(|f'| + eps)},
 * which equals {@code sign(f') sqrt(|f'|)} away from flat regions and is zero where the
 * function is constant. The inverse is {@code f(t) = f(t0) + integral of q |q|}.
 * </p>
 *
 * @author trinity-xai
 */
public final class SrsfTransform {

    private SrsfTransform() {
    }

    /**
     * SRSF of a sampled function using finite differences.
     *
     * @param f    function samples
     * @param time sample grid
     * @return SRSF samples
     */
    public static double[] encode(double[] f, double[] time) {
        return fromDerivative(Numerics.gradient(f, Numerics.meanSpacing(time)));
    }

    /**
     * Same as {@link #encode(double[], double[])} with every non-finite value replaced
     * by zero.
     */
    public static double[] encodeFinite(double[] f, double[] time) {
        double[] q = encode(f, time);
        for (int i = 0; i < q.length; i++) {
            if (!Double.isFinite(q[i])) {
                q[i] = 0.0;
            }
        }
        return q;
    }

    /**
     * SRSF of a sampled function using the derivative of the interpolating cubic spline
     * through its samples. Used for the initial encoding of the input set, where the
     * spline derivative is less noisy than finite differences.
     *
     * @param f    function samples, at least three
     * @param time strictly increasing sample grid
     * @return SRSF samples
     */
    public static double[] encodeSpline(double[] f, double[] time) {
        PolynomialSplineFunction spline = new SplineInterpolator().interpolate(time, f);
        PolynomialSplineFunction derivative = spline.polynomialSplineDerivative();
        double[] g = new double[time.length];
        for (int i = 0; i < time.length; i++) {
            g[i] = derivative.value(time[i]);
        }
        return fromDerivative(g);
    }

    /**
     * Reconstructs a function from its SRSF and starting value.
     *
     * @param q     SRSF samples
     * @param time  sample grid
     * @param start value of the function at {@code time[0]}
     * @return function samples
     */
    public static double[] toFunction(double[] q, double[] time, double start) {
        double[] qq = new double[q.length];
        for (int i = 0; i < q.length; i++) {
            qq[i] = q[i] * Math.abs(q[i]);
        }
        double[] f = Numerics.cumtrapz(time, qq);
        for (int i = 0; i < f.length; i++) {
            f[i] += start;
        }
        return f;
    }

    private static double[] fromDerivative(double[] g) {
        double[] q = new double[g.length];
        for (int i = 0; i < g.length; i++) {
            q[i] = g[i] / Math.sqrt(Math.abs(g[i]) + Numerics.EPS);
        }
        return q;
    }
}
