package com.hyperunmix.server.unmixing;

import com.hyperunmix.server.unmixing.error.NoiseEstimationException;
import com.hyperunmix.server.unmixing.error.ValidationException;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class NoiseCovarianceEstimatorTest {

    private final NoiseCovarianceEstimator estimator = new NoiseCovarianceEstimator();

    @Test
    public void testVarianceOfVerticalDifferences() {
        // Column 0,1,3 -> differences 1,2 -> sample variance 0.5
        HyperspectralCube cube = new HyperspectralCube(3, 1, 1, new double[] { 0.0, 1.0, 3.0 });
        RealMatrix cov = estimator.estimate(cube);
        assertEquals(1, cov.getRowDimension());
        assertEquals(0.5, cov.getEntry(0, 0), 1e-12);
    }

    @Test
    public void testRowsWithNaNAreIgnored() {
        HyperspectralCube cube = new HyperspectralCube(4, 1, 1, new double[] { 0.0, 1.0, 3.0, Double.NaN });
        assertEquals(0.5, estimator.estimate(cube).getEntry(0, 0), 1e-12);
    }

    @Test
    public void testCovarianceIsSymmetric() {
        HyperspectralCube cube = SyntheticCubes.gaussianNoise(20, 15, 6, 3L);
        RealMatrix cov = estimator.estimate(cube);
        assertEquals(6, cov.getRowDimension());
        assertEquals(6, cov.getColumnDimension());
        for (int i = 0; i < 6; i++) {
            assertTrue(cov.getEntry(i, i) > 0, "Diagonal must be positive");
            for (int j = 0; j < 6; j++) {
                assertEquals(cov.getEntry(i, j), cov.getEntry(j, i), 0.0);
            }
        }
    }

    @Test
    public void testAllNaNDifferencesFail() {
        double[] data = new double[3 * 2 * 2];
        Arrays.fill(data, Double.NaN);
        HyperspectralCube cube = new HyperspectralCube(3, 2, 2, data);
        NoiseEstimationException e = assertThrows(NoiseEstimationException.class, () -> estimator.estimate(cube));
        assertTrue(e.getMessage().contains("NaNs everywhere"));
    }

    @Test
    public void testSingleRowIsRejected() {
        HyperspectralCube cube = new HyperspectralCube(1, 4, 2, new double[8]);
        assertThrows(ValidationException.class, () -> estimator.estimate(cube));
    }
}
