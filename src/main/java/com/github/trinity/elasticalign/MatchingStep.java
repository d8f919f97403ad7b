package com.github.trinity.elasticalign;

import com.github.trinity.elasticalign.exceptions.AlignmentException;
import com.github.trinity.elasticalign.math.Numerics;
import com.github.trinity.elasticalign.srsf.SrsfTransform;
import com.github.trinity.elasticalign.warp.WarpSolver;
import com.github.trinity.elasticalign.warp.Warps;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.function.IntConsumer;
import java.util.stream.IntStream;

/**
 * Per-function matching against a template.
 * <p>
 * Every function is matched independently, either sequentially or as a parallel map on
 * the supplied pool. Tasks write only their own row of the result; the call returns once
 * all of them have completed, which is the barrier before the template update.
 * </p>
 *
 * @author trinity-xai
 */
public class MatchingStep {

    private final WarpSolver solver;
    private final double[] time;
    private final double lambda;
    private final ForkJoinPool pool;

    /**
     * @param solver warp optimizer
     * @param time   common sample grid
     * @param lambda elasticity weight passed to the solver
     * @param pool   worker pool, or {@code null} to run sequentially
     */
    public MatchingStep(WarpSolver solver, double[] time, double lambda, ForkJoinPool pool) {
        this.solver = solver;
        this.time = time;
        this.lambda = lambda;
        this.pool = pool;
    }

    public double[] getTime() {
        return time;
    }

    /**
     * Solves only the warps of every SRSF against the template SRSF.
     *
     * @param templateSrsf template SRSF
     * @param srsfs        SRSFs to align, one per row
     * @return warps, one per row
     */
    public double[][] solveWarps(double[] templateSrsf, double[][] srsfs) {
        int m = srsfs.length;
        double[][] warps = new double[m][];
        forEachFunction(m, k -> warps[k] = solve(templateSrsf, srsfs[k], k));
        return warps;
    }

    /**
     * Full matching pass. Alignment always targets the original SRSFs and functions, never
     * a previously warped copy.
     *
     * @param template     current template
     * @param srsfs        original SRSFs, one per row
     * @param functions    original functions, one per row
     * @param withTangents also compute the unit tangents and reciprocal norms
     * @return per-function warps, warped functions and SRSFs
     */
    public MatchResult match(Template template, double[][] srsfs, double[][] functions, boolean withTangents) {
        int m = srsfs.length;
        int n = time.length;
        double[] mq = template.srsf();
        MatchResult result = new MatchResult(m, n, withTangents);

        forEachFunction(m, k -> {
            double[] gam = solve(mq, srsfs[k], k);
            double[] fWarped = Warps.resample(functions[k], time, gam);
            double[] qWarped;
            try {
                qWarped = SrsfTransform.encode(fWarped, time);
            } catch (RuntimeException ex) {
                throw new AlignmentException("SRSF transform failed for function " + k, ex);
            }
            result.warps[k] = gam;
            result.warpDerivatives[k] = Warps.derivative(gam);
            result.warpedFunctions[k] = fWarped;
            result.warpedSrsfs[k] = qWarped;

            if (withTangents) {
                double[] v = new double[n];
                double[] vv = new double[n];
                for (int i = 0; i < n; i++) {
                    v[i] = qWarped[i] - mq[i];
                    vv[i] = v[i] * v[i];
                }
                double d = Math.sqrt(Numerics.trapz(time, vv));
                // a function sitting on the template has no direction
                if (d > 0.0 && Double.isFinite(d)) {
                    for (int i = 0; i < n; i++) {
                        result.unitTangents[k][i] = v[i] / d;
                    }
                    result.inverseNorms[k] = 1.0 / d;
                }
            }
        });
        return result;
    }

    private double[] solve(double[] templateSrsf, double[] srsf, int k) {
        try {
            return solver.solve(templateSrsf, time, srsf, time, lambda);
        } catch (RuntimeException ex) {
            throw new AlignmentException("warp solver failed for function " + k, ex);
        }
    }

    private void forEachFunction(int m, IntConsumer task) {
        if (pool == null) {
            for (int k = 0; k < m; k++) {
                task.accept(k);
            }
            return;
        }
        try {
            pool.submit(() -> IntStream.range(0, m).parallel().forEach(task)).get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AlignmentException("matching step interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof AlignmentException) {
                throw (AlignmentException) cause;
            }
            throw new AlignmentException("matching step failed", cause);
        }
    }
}
