package com.github.trinity.elasticalign;

/**
 * Template update rule applied after each matching pass.
 *
 * @author trinity-xai
 */
public interface TemplateUpdater {

    /**
     * @param current     template the functions were matched against
     * @param match       result of the matching pass against {@code current}
     * @param time        common sample grid
     * @param firstValues first-sample value of every (pre-alignment) function
     * @return the next template
     */
    Template update(Template current, MatchResult match, double[] time, double[] firstValues);
}
