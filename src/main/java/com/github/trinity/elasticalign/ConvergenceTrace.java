package com.github.trinity.elasticalign;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only record of the alignment loop: the relative template change of every
 * recorded round (entry 0 is the initialization) and the cost of every update round.
 *
 * @author trinity-xai
 */
public class ConvergenceTrace {

    private final List<Double> relativeChanges = new ArrayList<>();
    private final List<Double> costs = new ArrayList<>();

    public void addInitial(double relativeChange) {
        relativeChanges.add(relativeChange);
    }

    public void addRound(double cost, double relativeChange) {
        costs.add(cost);
        relativeChanges.add(relativeChange);
    }

    public double[] getRelativeChanges() {
        return relativeChanges.stream().mapToDouble(Double::doubleValue).toArray();
    }

    public double[] getCosts() {
        return costs.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
