package com.github.trinity.elasticalign;

import com.github.trinity.elasticalign.math.Numerics;

/**
 * Karcher mean update: the new template is the pointwise arithmetic mean of the warped
 * SRSFs and of the warped functions.
 *
 * @author trinity-xai
 */
public class MeanTemplateUpdater implements TemplateUpdater {

    @Override
    public Template update(Template current, MatchResult match, double[] time, double[] firstValues) {
        return new Template(
            Numerics.columnMeans(match.warpedFunctions),
            Numerics.columnMeans(match.warpedSrsfs));
    }
}
