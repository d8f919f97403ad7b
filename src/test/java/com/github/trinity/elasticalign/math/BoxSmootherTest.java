package com.github.trinity.elasticalign.math;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BoxSmootherTest {

    @Test
    void singlePass_spreadsASpikeSymmetrically() {
        double[][] f = {{0.0, 0.0, 4.0, 0.0, 0.0}};
        double[][] s = BoxSmoother.smooth(f, 1);
        assertArrayEquals(new double[]{0.0, 1.0, 2.0, 1.0, 0.0}, s[0], 1e-12);
    }

    @Test
    void passesReadThePreviousPassValues() {
        double[][] f = {{0.0, 0.0, 4.0, 0.0, 0.0}};
        double[][] s = BoxSmoother.smooth(f, 2);
        // second pass applied to {0, 1, 2, 1, 0}
        assertArrayEquals(new double[]{0.0, 1.0, 1.5, 1.0, 0.0}, s[0], 1e-12);
    }

    @Test
    void endpointsAndConstantsAreUntouched() {
        double[][] f = {{3.0, 3.0, 3.0, 3.0}, {1.0, 5.0, -2.0, 7.0}};
        double[][] s = BoxSmoother.smooth(f, 25);
        assertArrayEquals(new double[]{3.0, 3.0, 3.0, 3.0}, s[0], 1e-12);
        assertEquals(1.0, s[1][0]);
        assertEquals(7.0, s[1][3]);
    }

    @Test
    void inputIsNotModified() {
        double[][] f = {{0.0, 0.0, 4.0, 0.0, 0.0}};
        BoxSmoother.smooth(f, 3);
        assertArrayEquals(new double[]{0.0, 0.0, 4.0, 0.0, 0.0}, f[0]);
    }

    @Test
    void zeroPasses_returnsACopy() {
        double[][] f = {{1.0, 2.0, 3.0}};
        double[][] s = BoxSmoother.smooth(f, 0);
        assertArrayEquals(f[0], s[0]);
        assertNotSame(f[0], s[0]);
    }
}
