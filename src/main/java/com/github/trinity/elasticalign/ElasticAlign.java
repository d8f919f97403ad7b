package com.github.trinity.elasticalign;

import com.github.trinity.elasticalign.exceptions.AlignmentException;
import com.github.trinity.elasticalign.math.BoxSmoother;
import com.github.trinity.elasticalign.math.Numerics;
import com.github.trinity.elasticalign.srsf.SrsfTransform;
import com.github.trinity.elasticalign.warp.WarpSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ForkJoinPool;

/**
 * Group-wise elastic alignment of functional data.
 * <p>
 * Aligns M functions sampled on a common grid using the square-root slope function
 * framework: each function gets a time warp that aligns it to a template, and the
 * template is the Karcher mean or median of the functions in SRSF space. The result
 * separates amplitude (shape) from phase (timing) variability.
 * </p>
 *
 * <p>Usage example:</p>
 * <pre>
 *     AlignmentConfig config = new AlignmentConfig(0.0, Method.MEAN, 20);
 *     AlignmentResult out = ElasticAlign.timeWarping(f, time, config);
 *     double[][] aligned = out.fn;
 * </pre>
 *
 * References: Srivastava, A., Wu, W., Kurtek, S., Klassen, E., Marron, J. S. (2011),
 * Registration of functional data using Fisher-Rao metric; Tucker, J. D., Wu, W.,
 * Srivastava, A. (2013), Generative models for function data using phase and amplitude
 * separation.
 *
 * @author trinity-xai
 */
public final class ElasticAlign {
    private static final Logger LOG = LoggerFactory.getLogger(ElasticAlign.class);

    private ElasticAlign() {
    }

    /**
     * Aligns a set of functions with the warp solver selected by the configuration.
     *
     * @param f      functions, one row per function ([M][N]), M >= 2 and N >= 3
     * @param time   strictly increasing sample grid of length N
     * @param config run configuration
     * @return aligned functions, template, warps, trace and variance decomposition
     * @throws IllegalArgumentException if the configuration or input is invalid
     * @throws AlignmentException       if the warp solver or SRSF transform fails
     */
    public static AlignmentResult timeWarping(double[][] f, double[] time, AlignmentConfig config) {
        config.validate();
        return run(f, time, config, config.solverVariant.create(), config.solverVariant.name());
    }

    /**
     * Aligns a set of functions with a caller-supplied warp solver. The configured solver
     * variant is ignored.
     */
    public static AlignmentResult timeWarping(double[][] f, double[] time, AlignmentConfig config,
                                              WarpSolver solver) {
        config.validate();
        if (solver == null) {
            throw new IllegalArgumentException("warp solver must not be null");
        }
        return run(f, time, config, solver, solver.getClass().getSimpleName());
    }

    private static AlignmentResult run(double[][] f, double[] time, AlignmentConfig config,
                                       WarpSolver solver, String solverName) {
        validateInput(f, time);
        LOG.info("lambda = {}", config.lambda);

        int m = f.length;
        double[][] raw = Numerics.deepCopy(f);
        double[][] functions = config.smoothData
            ? BoxSmoother.smooth(raw, config.smoothingPasses)
            : Numerics.deepCopy(raw);
        double[] grid = time.clone();

        double[][] srsfs = new double[m][];
        for (int k = 0; k < m; k++) {
            try {
                srsfs[k] = SrsfTransform.encodeSpline(functions[k], grid);
            } catch (RuntimeException ex) {
                throw new AlignmentException("SRSF transform failed for function " + k, ex);
            }
        }

        ForkJoinPool pool = config.parallel
            ? new ForkJoinPool(Math.max(1, Runtime.getRuntime().availableProcessors() - 1))
            : null;
        try {
            MatchingStep matching = new MatchingStep(solver, grid, config.lambda, pool);

            LOG.info("Initializing...");
            TemplateInitializer.Initialization init = new TemplateInitializer(matching).initialize(srsfs, functions);

            LOG.info("Computing Karcher {} of {} functions in SRSF space...", config.method.getLabel(), m);
            AlignmentIterator.Outcome outcome = new AlignmentIterator(matching, config.method,
                config.lambda, config.maxIterations).run(init, srsfs, functions);

            WarpCentering.Centered centered = new WarpCentering(matching)
                .center(outcome.template(), outcome.last().match(), srsfs);

            return new StatisticsReducer(grid, config.method)
                .reduce(raw, functions, srsfs, centered, outcome, config.lambda, solverName);
        } finally {
            if (pool != null) {
                pool.shutdown();
            }
        }
    }

    static void validateInput(double[][] f, double[] time) {
        if (f == null || time == null) {
            throw new IllegalArgumentException("functions and time grid must not be null");
        }
        if (f.length < 2) {
            throw new IllegalArgumentException("at least 2 functions are required, got " + f.length);
        }
        int n = time.length;
        if (n < 3) {
            throw new IllegalArgumentException("at least 3 samples are required, got " + n);
        }
        for (int i = 0; i < n; i++) {
            if (!Double.isFinite(time[i])) {
                throw new IllegalArgumentException("time grid must be finite at index " + i);
            }
            if (i > 0 && time[i] <= time[i - 1]) {
                throw new IllegalArgumentException("time grid must be strictly increasing at index " + i);
            }
        }
        for (int k = 0; k < f.length; k++) {
            if (f[k] == null || f[k].length != n) {
                throw new IllegalArgumentException("function " + k + " must have " + n + " samples");
            }
            for (double v : f[k]) {
                if (!Double.isFinite(v)) {
                    throw new IllegalArgumentException("function " + k + " contains non-finite values");
                }
            }
        }
    }
}
