package com.github.trinity.elasticalign;

import com.github.trinity.elasticalign.AlignmentResult.VarianceDecomposition;
import com.github.trinity.elasticalign.math.Numerics;
import com.github.trinity.elasticalign.srsf.SrsfTransform;
import com.github.trinity.elasticalign.warp.Warps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the reported artifact from the centred alignment.
 * <p>
 * The template function is rebuilt from the centred template SRSF, anchored at the mean
 * (MEAN) or median (MEDIAN) of the raw first-sample values. Phase variance is the
 * integrated pointwise variance of the template pushed through each function's warp,
 * amplitude variance that of the aligned functions, and original variance that of the
 * functions before alignment.
 * </p>
 *
 * @author trinity-xai
 */
public class StatisticsReducer {
    private static final Logger LOG = LoggerFactory.getLogger(StatisticsReducer.class);

    private final double[] time;
    private final Method method;

    public StatisticsReducer(double[] time, Method method) {
        this.time = time;
        this.method = method;
    }

    /**
     * @param raw       input functions as given
     * @param functions pre-alignment functions (smoothed when smoothing is on)
     * @param srsfs     SRSFs of {@code functions}
     * @param centered  centred alignment
     * @param outcome   loop outcome, for the trace and terminal state
     * @param lambda    elasticity weight used
     * @param solver    name of the warp optimizer used
     * @return the alignment result
     */
    public AlignmentResult reduce(double[][] raw, double[][] functions, double[][] srsfs,
                                  WarpCentering.Centered centered, AlignmentIterator.Outcome outcome,
                                  double lambda, String solver) {
        double[] mqn = centered.template().srsf();
        double[] fmean = SrsfTransform.toFunction(mqn, time, method.anchor(Numerics.column(raw, 0)));

        double[][] gam = centered.warps();
        double[][] fgam = new double[gam.length][];
        for (int k = 0; k < gam.length; k++) {
            fgam[k] = Warps.resample(fmean, time, gam[k]);
        }

        VarianceDecomposition variance = new VarianceDecomposition(
            integratedVariance(functions),
            integratedVariance(centered.functions()),
            integratedVariance(fgam));
        LOG.info("Variance decomposition:\n{}", variance);

        return new AlignmentResult(time, raw, centered.functions(), srsfs, centered.srsfs(),
            fmean, mqn, gam, centered.centering().gamI(),
            outcome.trace().getRelativeChanges(), outcome.trace().getCosts(), variance,
            lambda, method, solver, outcome.state());
    }

    /**
     * Time integral of the pointwise (n - 1) variance across functions.
     */
    public double integratedVariance(double[][] functions) {
        return Numerics.trapz(time, Numerics.columnVariances(functions));
    }
}
