package com.github.trinity.elasticalign;

import com.github.trinity.elasticalign.math.Numerics;
import com.github.trinity.elasticalign.warp.KarcherWarpInverse;
import com.github.trinity.elasticalign.warp.KarcherWarpInverse.InverseWarp;
import com.github.trinity.elasticalign.warp.Warps;

/**
 * Removes the global reparameterization left in a converged template.
 * <p>
 * The Karcher mean or median is only defined up to a common warp of the time axis. One
 * more matching pass against the final template gives a warp per function; the inverse
 * of their Karcher mean ({@code gamI}) is then applied to the template, to every aligned
 * SRSF and function, and to every warp, so the population's average warp becomes the
 * identity.
 * </p>
 *
 * @author trinity-xai
 */
public class WarpCentering {

    /**
     * Centred template, aligned SRSFs and functions, composed warps and the centring warp.
     */
    public record Centered(Template template, double[][] srsfs, double[][] functions,
                           double[][] warps, InverseWarp centering) {
    }

    private final MatchingStep matching;

    public WarpCentering(MatchingStep matching) {
        this.matching = matching;
    }

    /**
     * @param template  final template of the loop
     * @param lastMatch matching pass of the last round; its warped SRSFs and functions
     *                  are the ones that get centred
     * @param srsfs     original SRSFs, one row per function
     * @return centred result
     */
    public Centered center(Template template, MatchResult lastMatch, double[][] srsfs) {
        double[] time = matching.getTime();
        double[][] warps = matching.solveWarps(template.srsf(), srsfs);
        InverseWarp centering = KarcherWarpInverse.compute(warps);
        double[] gamI = centering.gamI();
        double[] rootDev = new double[gamI.length];
        for (int i = 0; i < gamI.length; i++) {
            rootDev[i] = Numerics.sqrtMagnitude(centering.derivative()[i]);
        }

        Template centred = new Template(
            Warps.resample(template.function(), time, gamI),
            scaleInPlace(Warps.resample(template.srsf(), time, gamI), rootDev));

        int m = srsfs.length;
        double[][] qn = new double[m][];
        double[][] fn = new double[m][];
        double[][] gam = new double[m][];
        for (int k = 0; k < m; k++) {
            qn[k] = scaleInPlace(Warps.resample(lastMatch.warpedSrsfs[k], time, gamI), rootDev);
            fn[k] = Warps.resample(lastMatch.warpedFunctions[k], time, gamI);
            gam[k] = Warps.resample(warps[k], time, gamI);
        }
        return new Centered(centred, qn, fn, gam, centering);
    }

    private static double[] scaleInPlace(double[] values, double[] factors) {
        for (int i = 0; i < values.length; i++) {
            values[i] *= factors[i];
        }
        return values;
    }
}
