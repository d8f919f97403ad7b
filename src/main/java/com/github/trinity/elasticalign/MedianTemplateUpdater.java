package com.github.trinity.elasticalign;

import com.github.trinity.elasticalign.math.Numerics;
import com.github.trinity.elasticalign.srsf.SrsfTransform;

/**
 * Karcher median update: one gradient step along the median descent direction.
 * <p>
 * The direction is the sum of the unit tangents divided by the sum of the reciprocal
 * tangent norms. The template function is rebuilt from the new SRSF, anchored at the
 * median of the first-sample values.
 * </p>
 *
 * @author trinity-xai
 */
public class MedianTemplateUpdater implements TemplateUpdater {

    public static final double STEP_SIZE = 0.3;

    @Override
    public Template update(Template current, MatchResult match, double[] time, double[] firstValues) {
        if (!match.hasTangents()) {
            throw new IllegalArgumentException("median update needs a matching pass with tangents");
        }
        double[] mq = current.srsf();
        int n = mq.length;
        double[] vbar = new double[n];
        double normSum = 0.0;
        for (int k = 0; k < match.size(); k++) {
            double[] v = match.unitTangents[k];
            for (int i = 0; i < n; i++) {
                vbar[i] += v[i];
            }
            normSum += match.inverseNorms[k];
        }

        double[] next = new double[n];
        for (int i = 0; i < n; i++) {
            double step = normSum > 0.0 ? vbar[i] / normSum : 0.0;
            next[i] = mq[i] + STEP_SIZE * step;
        }
        double[] function = SrsfTransform.toFunction(next, time, Numerics.median(firstValues));
        return new Template(function, next);
    }
}
