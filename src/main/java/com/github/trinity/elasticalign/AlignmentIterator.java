package com.github.trinity.elasticalign;

import com.github.trinity.elasticalign.math.Numerics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The alternating minimization loop: match every function to the template, update the
 * template with the configured statistic, and stop once the template SRSF stops moving
 * or the round cap is hit.
 * <p>
 * Rounds are strictly sequential; round r+1 matches against the template produced by
 * round r. Only the current frame is kept alive.
 * </p>
 *
 * @author trinity-xai
 */
public class AlignmentIterator {
    private static final Logger LOG = LoggerFactory.getLogger(AlignmentIterator.class);

    /** Final state of a run. */
    public record Outcome(IterationFrame last, ConvergenceTrace trace, AlignmentState state) {
        public Template template() {
            return last.template();
        }
    }

    private final MatchingStep matching;
    private final Method method;
    private final TemplateUpdater updater;
    private final RelativeChangeChecker checker;
    private final double lambda;
    private final int maxIterations;

    public AlignmentIterator(MatchingStep matching, Method method, double lambda, int maxIterations) {
        this(matching, method, lambda, maxIterations, new RelativeChangeChecker());
    }

    public AlignmentIterator(MatchingStep matching, Method method, double lambda, int maxIterations,
                             RelativeChangeChecker checker) {
        this.matching = matching;
        this.method = method;
        this.updater = method.updater();
        this.lambda = lambda;
        this.maxIterations = maxIterations;
        this.checker = checker;
    }

    /**
     * @param init      starting template
     * @param srsfs     original SRSFs, one row per function
     * @param functions original functions, one row per function
     * @return last frame, trace and terminal state
     */
    public Outcome run(TemplateInitializer.Initialization init, double[][] srsfs, double[][] functions) {
        double[] time = matching.getTime();
        double[] firstValues = Numerics.column(functions, 0);
        boolean withTangents = method == Method.MEDIAN;

        ConvergenceTrace trace = new ConvergenceTrace();
        trace.addInitial(init.relativeChange());
        IterationFrame current = new IterationFrame(init.template(), null);
        AlignmentState state = AlignmentState.RUNNING;

        for (int r = 1; r <= maxIterations && state == AlignmentState.RUNNING; r++) {
            LOG.info("updating step: r={}", r);
            Template template = current.template();
            MatchResult match = matching.match(template, srsfs, functions, withTangents);

            double cost = roundCost(template.srsf(), match, time);
            Template next = updater.update(template, match, time, firstValues);
            double relativeChange = RelativeChangeChecker.relativeChange(template.srsf(), next.srsf());
            trace.addRound(cost, relativeChange);
            LOG.debug("round {}: cost={} relative change={}", r, cost, relativeChange);

            current = new IterationFrame(next, match);

            if (checker.converged(relativeChange)) {
                state = AlignmentState.CONVERGED;
            } else if (r == maxIterations) {
                LOG.info("maximal number of iterations is reached.");
                state = AlignmentState.MAX_ITERATIONS_EXCEEDED;
            }
        }
        return new Outcome(current, trace, state);
    }

    /**
     * Matching cost of a round: the method's combination of data and penalty terms.
     */
    double roundCost(double[] mq, MatchResult match, double[] time) {
        return method.cost(dataTerm(mq, match, time), penaltyTerm(match, time));
    }

    /**
     * Sum over functions of the integrated squared residual between template and warped
     * SRSF.
     */
    static double dataTerm(double[] mq, MatchResult match, double[] time) {
        int n = mq.length;
        double[] residual = new double[n];
        double sum = 0.0;
        for (double[] q : match.warpedSrsfs) {
            for (int i = 0; i < n; i++) {
                double diff = mq[i] - q[i];
                residual[i] = diff * diff;
            }
            sum += Numerics.trapz(time, residual);
        }
        return sum;
    }

    /**
     * {@code lambda} times the sum over functions of the integrated
     * {@code (1 - sqrt(gam'))^2}.
     */
    double penaltyTerm(MatchResult match, double[] time) {
        if (lambda == 0.0) {
            return 0.0;
        }
        int n = time.length;
        double[] roughness = new double[n];
        double sum = 0.0;
        for (double[] dev : match.warpDerivatives) {
            for (int i = 0; i < n; i++) {
                double bend = 1.0 - Numerics.sqrtMagnitude(dev[i]);
                roughness[i] = bend * bend;
            }
            sum += Numerics.trapz(time, roughness);
        }
        return lambda * sum;
    }
}
