package com.github.trinity.elasticalign;

import com.github.trinity.elasticalign.demo.SimulatedData;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TemplateUpdaterTest {

    private static final double[] TIME = SimulatedData.uniformGrid(5, 0.0, 1.0);

    private static MatchResult matchOf(double[][] functions, double[][] srsfs, boolean withTangents) {
        MatchResult match = new MatchResult(functions.length, TIME.length, withTangents);
        for (int k = 0; k < functions.length; k++) {
            match.warps[k] = TIME.clone();
            match.warpDerivatives[k] = new double[]{1, 1, 1, 1, 1};
            match.warpedFunctions[k] = functions[k];
            match.warpedSrsfs[k] = srsfs[k];
        }
        return match;
    }

    @Test
    void mean_isThePointwiseAverage() {
        double[][] f = {{0, 1, 2, 3, 4}, {2, 3, 4, 5, 6}};
        double[][] q = {{1, 1, 1, 1, 1}, {3, 3, 3, 3, 3}};
        Template current = new Template(new double[5], new double[5]);

        Template next = new MeanTemplateUpdater().update(current, matchOf(f, q, false), TIME, new double[]{0, 2});
        assertArrayEquals(new double[]{1, 2, 3, 4, 5}, next.function(), 1e-15);
        assertArrayEquals(new double[]{2, 2, 2, 2, 2}, next.srsf(), 1e-15);
    }

    @Test
    void median_stepsAlongTheTangent() {
        double[] mq = {1, 1, 1, 1, 1};
        double[][] q = {{2, 2, 2, 2, 2}};
        MatchResult match = matchOf(new double[][]{{0, 0, 0, 0, 0}}, q, true);
        // v = q - mq has norm 1 over [0, 1]
        match.unitTangents[0] = new double[]{1, 1, 1, 1, 1};
        match.inverseNorms[0] = 1.0;

        Template next = new MedianTemplateUpdater().update(new Template(new double[5], mq), match, TIME,
            new double[]{7.0});
        for (double v : next.srsf()) {
            assertEquals(1.0 + MedianTemplateUpdater.STEP_SIZE, v, 1e-15);
        }
        assertEquals(7.0, next.function()[0], 1e-15);
        // q = 1.3 everywhere integrates to slope 1.69
        assertEquals(7.0 + 1.69, next.function()[4], 1e-12);
    }

    @Test
    void median_opposingTangentsCancel() {
        double[] mq = {0.5, 0.5, 0.5, 0.5, 0.5};
        MatchResult match = matchOf(new double[2][5], new double[2][5], true);
        match.unitTangents[0] = new double[]{1, -1, 1, -1, 1};
        match.unitTangents[1] = new double[]{-1, 1, -1, 1, -1};
        match.inverseNorms[0] = 2.0;
        match.inverseNorms[1] = 2.0;

        Template next = new MedianTemplateUpdater().update(new Template(new double[5], mq), match, TIME,
            new double[]{1.0, 3.0});
        assertArrayEquals(mq, next.srsf(), 1e-15);
        assertEquals(2.0, next.function()[0], 1e-15);
    }

    @Test
    void median_allFunctionsOnTheTemplateLeaveItInPlace() {
        double[] mq = {0.5, 0.2, -0.1, 0.3, 0.0};
        MatchResult match = matchOf(new double[3][5], new double[3][5], true);

        Template next = new MedianTemplateUpdater().update(new Template(new double[5], mq), match, TIME,
            new double[]{0.0, 0.0, 0.0});
        assertArrayEquals(mq, next.srsf(), 0.0);
        for (double v : next.function()) {
            assertTrue(Double.isFinite(v));
        }
        assertEquals(0.0, next.function()[0]);
    }

    @Test
    void median_needsTangents() {
        MatchResult match = matchOf(new double[2][5], new double[2][5], false);
        assertFalse(match.hasTangents());
        assertThrows(IllegalArgumentException.class, () -> new MedianTemplateUpdater()
            .update(new Template(new double[5], new double[5]), match, TIME, new double[]{0.0, 0.0}));
    }
}
