package com.github.trinity.elasticalign;

import com.github.trinity.elasticalign.warp.WarpSolverVariant;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AlignmentConfigTest {

    @Test
    void defaults() {
        AlignmentConfig config = new AlignmentConfig();
        assertEquals(0.0, config.lambda);
        assertEquals(Method.MEAN, config.method);
        assertFalse(config.smoothData);
        assertEquals(25, config.smoothingPasses);
        assertFalse(config.parallel);
        assertEquals(WarpSolverVariant.DP, config.solverVariant);
        assertEquals(20, config.maxIterations);
        assertDoesNotThrow(config::validate);
    }

    @Test
    void methodByName() {
        AlignmentConfig config = new AlignmentConfig(0.5, "median", 10);
        assertEquals(Method.MEDIAN, config.method);
        assertEquals(0.5, config.lambda);
        assertEquals(10, config.maxIterations);
        assertThrows(IllegalArgumentException.class, () -> new AlignmentConfig(0.0, "mode", 10));
    }

    @Test
    void validate_rejectsBadOptions() {
        AlignmentConfig negativeLambda = new AlignmentConfig(-1.0, Method.MEAN, 20);
        assertThrows(IllegalArgumentException.class, negativeLambda::validate);

        AlignmentConfig nanLambda = new AlignmentConfig(Double.NaN, Method.MEAN, 20);
        assertThrows(IllegalArgumentException.class, nanLambda::validate);

        AlignmentConfig infiniteLambda = new AlignmentConfig(Double.POSITIVE_INFINITY, Method.MEAN, 20);
        assertThrows(IllegalArgumentException.class, infiniteLambda::validate);

        AlignmentConfig noRounds = new AlignmentConfig(0.0, Method.MEAN, 0);
        assertThrows(IllegalArgumentException.class, noRounds::validate);

        AlignmentConfig noMethod = new AlignmentConfig();
        noMethod.method = null;
        assertThrows(IllegalArgumentException.class, noMethod::validate);

        AlignmentConfig noSolver = new AlignmentConfig();
        noSolver.solverVariant = null;
        assertThrows(IllegalArgumentException.class, noSolver::validate);

        AlignmentConfig negativePasses = new AlignmentConfig();
        negativePasses.smoothingPasses = -1;
        assertThrows(IllegalArgumentException.class, negativePasses::validate);
    }
}
