package com.github.trinity.elasticalign;

import org.apache.commons.math3.optim.PointValuePair;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RelativeChangeCheckerTest {

    @Test
    void relativeChange_isScaledByThePreviousNorm() {
        assertEquals(0.1, RelativeChangeChecker.relativeChange(new double[]{3, 4}, new double[]{3, 4.5}), 1e-12);
    }

    @Test
    void relativeChange_degenerateDenominator() {
        assertEquals(0.0, RelativeChangeChecker.relativeChange(new double[]{0, 0}, new double[]{0, 0}));
        assertEquals(Double.POSITIVE_INFINITY,
            RelativeChangeChecker.relativeChange(new double[]{0, 0}, new double[]{0, 1}));
    }

    @Test
    void converged_isStrictlyBelowTolerance() {
        RelativeChangeChecker checker = new RelativeChangeChecker(0.1);
        PointValuePair previous = new PointValuePair(new double[]{3, 4}, 1.0);
        assertFalse(checker.converged(1, previous, new PointValuePair(new double[]{3, 4.5}, 1.0)));
        assertTrue(checker.converged(1, previous, new PointValuePair(new double[]{3, 4.4}, 1.0)));
        assertTrue(checker.converged(0.099));
        assertFalse(checker.converged(0.1));
        assertEquals(RelativeChangeChecker.DEFAULT_TOLERANCE, new RelativeChangeChecker().getTolerance());
    }

    @Test
    void trace_recordsInitialEntryAndRounds() {
        ConvergenceTrace trace = new ConvergenceTrace();
        trace.addInitial(0.5);
        trace.addRound(2.0, 0.25);
        trace.addRound(1.5, 0.01);
        assertArrayEquals(new double[]{0.5, 0.25, 0.01}, trace.getRelativeChanges());
        assertArrayEquals(new double[]{2.0, 1.5}, trace.getCosts());
    }
}
