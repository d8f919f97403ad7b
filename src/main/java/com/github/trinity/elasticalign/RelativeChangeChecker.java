package com.github.trinity.elasticalign;

import com.github.trinity.elasticalign.math.Numerics;
import org.apache.commons.math3.optim.ConvergenceChecker;
import org.apache.commons.math3.optim.PointValuePair;

/**
 * Convergence checker on the relative L2 change of the template SRSF between two rounds.
 * The point of each pair is the template SRSF and the value is the round cost; the cost
 * is recorded but plays no part in the decision.
 *
 * @author trinity-xai
 */
public class RelativeChangeChecker implements ConvergenceChecker<PointValuePair> {

    public static final double DEFAULT_TOLERANCE = 1e-4;

    private final double tolerance;

    public RelativeChangeChecker() {
        this(DEFAULT_TOLERANCE);
    }

    /**
     * @param tolerance converged once the relative change is strictly below this value
     */
    public RelativeChangeChecker(double tolerance) {
        this.tolerance = tolerance;
    }

    public double getTolerance() {
        return tolerance;
    }

    @Override
    public boolean converged(int iteration, PointValuePair previous, PointValuePair current) {
        return converged(relativeChange(previous.getPoint(), current.getPoint()));
    }

    /**
     * Decision on an already computed relative change.
     */
    public boolean converged(double relativeChange) {
        return relativeChange < tolerance;
    }

    /**
     * {@code ||current - previous|| / ||previous||}. Zero when both norms vanish, positive
     * infinity when only the denominator does.
     */
    public static double relativeChange(double[] previous, double[] current) {
        double numerator = Numerics.euclideanDistance(current, previous);
        double denominator = Numerics.l2Norm(previous);
        if (denominator == 0.0) {
            return numerator == 0.0 ? 0.0 : Double.POSITIVE_INFINITY;
        }
        return numerator / denominator;
    }
}
