package com.github.trinity.elasticalign;

import com.github.trinity.elasticalign.math.Numerics;
import com.github.trinity.elasticalign.srsf.SrsfTransform;
import com.github.trinity.elasticalign.warp.KarcherWarpInverse;
import com.github.trinity.elasticalign.warp.Warps;

/**
 * Selects the starting template.
 * <p>
 * The function whose SRSF is closest to the cross-sectional mean SRSF (the medoid) is
 * taken as the template, every SRSF is aligned to it once, and the template function is
 * resampled through the inverse Karcher mean of those warps. This removes the timing
 * bias of the chosen medoid before the main loop starts.
 * </p>
 *
 * @author trinity-xai
 */
public class TemplateInitializer {

    /**
     * Initial template, the index of the medoid function, and the relative distance
     * between the recentred template SRSF and the medoid SRSF.
     */
    public record Initialization(Template template, int medoidIndex, double relativeChange) {
    }

    private final MatchingStep matching;

    public TemplateInitializer(MatchingStep matching) {
        this.matching = matching;
    }

    /**
     * @param srsfs     SRSF set, one row per function
     * @param functions function set, one row per function
     * @return the initial template
     */
    public Initialization initialize(double[][] srsfs, double[][] functions) {
        double[] time = matching.getTime();
        int medoid = medoidIndex(srsfs);
        double[] mq = srsfs[medoid];
        double[] mf = functions[medoid];

        double[][] warps = matching.solveWarps(mq, srsfs);
        KarcherWarpInverse.InverseWarp centre = KarcherWarpInverse.compute(warps);

        double[] function = Warps.resample(mf, time, centre.gamI());
        double[] srsf = SrsfTransform.encodeFinite(function, time);
        double relativeChange = RelativeChangeChecker.relativeChange(srsfs[medoid], srsf);
        return new Initialization(new Template(function, srsf), medoid, relativeChange);
    }

    /**
     * Index of the row with minimum L2 distance to the row-wise mean.
     */
    public static int medoidIndex(double[][] srsfs) {
        double[] mnq = Numerics.columnMeans(srsfs);
        int minIndex = 0;
        double minDist = Double.MAX_VALUE;
        for (int k = 0; k < srsfs.length; k++) {
            double dist = Numerics.euclideanDistance(srsfs[k], mnq);
            if (dist < minDist) {
                minDist = dist;
                minIndex = k;
            }
        }
        return minIndex;
    }
}
