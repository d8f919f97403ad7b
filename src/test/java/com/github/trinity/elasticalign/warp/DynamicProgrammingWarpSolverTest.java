package com.github.trinity.elasticalign.warp;

import com.github.trinity.elasticalign.demo.SimulatedData;
import com.github.trinity.elasticalign.math.Numerics;
import com.github.trinity.elasticalign.srsf.SrsfTransform;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DynamicProgrammingWarpSolverTest {

    private static final double[] TIME = SimulatedData.uniformGrid(61, 0.0, 1.0);

    private static void assertValidWarp(double[] gam) {
        assertEquals(0.0, gam[0]);
        assertEquals(1.0, gam[gam.length - 1]);
        for (int i = 1; i < gam.length; i++) {
            assertTrue(gam[i] >= gam[i - 1], "warp decreases at " + i);
        }
    }

    private static double l2Distance(double[] a, double[] b, double[] time) {
        double[] sq = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            sq[i] = (a[i] - b[i]) * (a[i] - b[i]);
        }
        return Math.sqrt(Numerics.trapz(time, sq));
    }

    @Test
    void steps_startWithTheDiagonalAndAreCoprime() {
        int[][] steps = DynamicProgrammingWarpSolver.buildSteps(7);
        assertArrayEquals(new int[]{1, 1}, steps[0]);
        assertEquals(35, steps.length);
        Set<String> seen = new HashSet<>();
        for (int[] s : steps) {
            assertTrue(seen.add(s[0] + "," + s[1]), "duplicate step");
            assertEquals(1, BigInteger.valueOf(s[0]).gcd(BigInteger.valueOf(s[1])).intValue());
        }
        assertEquals(1, DynamicProgrammingWarpSolver.buildSteps(1).length);
    }

    @Test
    void rejectsEmptyNeighbourhood() {
        assertThrows(IllegalArgumentException.class, () -> new DynamicProgrammingWarpSolver(0));
    }

    @Test
    void identicalSrsfs_giveTheIdentityWarp() {
        double[] f = SimulatedData.bump(TIME, 0.4, 0.1, 1.0);
        double[] q = SrsfTransform.encode(f, TIME);
        double[] gam = new DynamicProgrammingWarpSolver(7).solve(q, TIME, q.clone(), TIME, 0.0);
        assertArrayEquals(Warps.identity(TIME), gam, 1e-12);
    }

    @Test
    void diagonalOnlyNeighbourhood_alwaysGivesTheIdentity() {
        double[] q1 = SrsfTransform.encode(SimulatedData.bump(TIME, 0.4, 0.1, 1.0), TIME);
        double[] q2 = SrsfTransform.encode(SimulatedData.bump(TIME, 0.6, 0.1, 1.0), TIME);
        double[] gam = new DynamicProgrammingWarpSolver(1).solve(q1, TIME, q2, TIME, 0.0);
        assertArrayEquals(Warps.identity(TIME), gam, 1e-12);
    }

    @Test
    void shiftedBump_isAlignedToTheTemplate() {
        double[] template = SimulatedData.bump(TIME, 0.45, 0.1, 1.0);
        double[] target = SimulatedData.bump(TIME, 0.55, 0.1, 1.0);
        double[] q1 = SrsfTransform.encode(template, TIME);
        double[] q2 = SrsfTransform.encode(target, TIME);

        for (WarpSolverVariant variant : WarpSolverVariant.values()) {
            double[] gam = variant.create().solve(q1, TIME, q2, TIME, 0.0);
            assertValidWarp(gam);
            double[] aligned = Warps.resample(target, TIME, gam);
            double before = l2Distance(template, target, TIME);
            double after = l2Distance(template, aligned, TIME);
            assertTrue(after < 0.25 * before,
                variant + ": aligned distance " + after + " vs unaligned " + before);
        }
    }

    @Test
    void largerLambda_keepsTheWarpCloserToTheIdentity() {
        double[] q1 = SrsfTransform.encode(SimulatedData.bump(TIME, 0.4, 0.1, 1.0), TIME);
        double[] q2 = SrsfTransform.encode(SimulatedData.bump(TIME, 0.6, 0.1, 1.0), TIME);
        DynamicProgrammingWarpSolver solver = new DynamicProgrammingWarpSolver(7);
        double[] identity = Warps.identity(TIME);

        double[] free = solver.solve(q1, TIME, q2, TIME, 0.0);
        double[] stiff = solver.solve(q1, TIME, q2, TIME, 1.0e4);
        assertValidWarp(free);
        assertValidWarp(stiff);
        assertTrue(l2Distance(stiff, identity, TIME) < l2Distance(free, identity, TIME));
        // the penalty of any bent path outweighs the whole data term here
        assertArrayEquals(identity, stiff, 1e-12);
    }

    @Test
    void solve_isDeterministic() {
        double[] q1 = SrsfTransform.encode(SimulatedData.bump(TIME, 0.4, 0.1, 1.0), TIME);
        double[] q2 = SrsfTransform.encode(SimulatedData.bump(TIME, 0.55, 0.12, 1.3), TIME);
        DynamicProgrammingWarpSolver solver = new DynamicProgrammingWarpSolver(7);
        assertArrayEquals(solver.solve(q1, TIME, q2, TIME, 0.1), solver.solve(q1, TIME, q2, TIME, 0.1));
    }

    @Test
    void edgeCost_isZeroOnTheDiagonalForEqualInputs() {
        double[] q = SrsfTransform.encode(SimulatedData.bump(TIME, 0.5, 0.1, 1.0), TIME);
        double[] u = Warps.identity(TIME);
        assertEquals(0.0, DynamicProgrammingWarpSolver.edgeCost(q, u, q, u, 10, 11, 10, 11, 5.0));
        assertTrue(DynamicProgrammingWarpSolver.edgeCost(q, u, q, u, 10, 11, 10, 12, 5.0) > 0.0);
    }
}
