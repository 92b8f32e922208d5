package com.hyperunmix.server.unmixing;

import com.hyperunmix.server.unmixing.error.NumericalException;
import com.hyperunmix.server.unmixing.error.ValidationException;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

public class AbundanceMapperTest {

    private static final double[] A = { 0.9, 0.5, 0.1, 0.2 };
    private static final double[] B = { 0.1, 0.3, 0.8, 0.6 };

    // 2x2 cube: pure A, pure B, 30/70 mix, 60/40 mix
    private static HyperspectralCube mixedCube() {
        double[][] pixels = { A, B, mix(0.3, 0.7), mix(0.6, 0.4) };
        return HyperspectralCube.fromPixels(2, 2, pixels);
    }

    private static double[] mix(double fa, double fb) {
        double[] out = new double[A.length];
        for (int b = 0; b < A.length; b++) {
            out[b] = fa * A[b] + fb * B[b];
        }
        return out;
    }

    private static void assertConstraints(AbundanceResult result) {
        for (int p = 0; p < result.getHeight() * result.getWidth(); p++) {
            double[] f = result.getAbundances(p);
            double sum = 0.0;
            for (double v : f) {
                assertTrue(v >= 0.0, "Negative abundance at pixel " + p);
                sum += v;
            }
            assertEquals(1.0, sum, 1e-6);
        }
    }

    @Test
    public void testRecoversLinearMixtures() {
        AbundanceResult result = new AbundanceMapper().map(new double[][] { A, B }, mixedCube(), false);

        assertEquals(2, result.getLayerCount());
        assertFalse(result.isShadeIncluded());
        assertConstraints(result);
        assertEquals(1.0, result.get(0, 0, 0), 1e-9);
        assertEquals(1.0, result.get(0, 1, 1), 1e-9);
        assertEquals(0.3, result.get(1, 0, 0), 1e-9);
        assertEquals(0.7, result.get(1, 0, 1), 1e-9);
        assertEquals(0.6, result.get(1, 1, 0), 1e-9);
    }

    @Test
    public void testShadeAddsLayer() {
        AbundanceResult result = new AbundanceMapper().map(new double[][] { A, B }, mixedCube(), true);

        assertEquals(3, result.getLayerCount());
        assertTrue(result.isShadeIncluded());
        assertConstraints(result);
        // The shade endmember has no signal so it takes no fraction
        assertEquals(0.0, result.get(1, 0, 2), 1e-9);
        assertEquals(2, result.getMap(2).length);
        assertThrows(ValidationException.class, () -> result.getMap(3));
    }

    @Test
    public void testDarkPixelStaysUnconstrainedZero() {
        double[][] pixels = { A, B, { -0.5, -0.5, -0.5, -0.5 }, mix(0.5, 0.5) };
        AbundanceResult result = new AbundanceMapper().map(new double[][] { A, B },
                HyperspectralCube.fromPixels(2, 2, pixels), false);
        double[] f = result.getAbundances(2);
        // Both raw fractions negative, clipped to zero and left unscaled
        assertEquals(0.0, f[0], 0.0);
        assertEquals(0.0, f[1], 0.0);
    }

    @Test
    public void testNaNPixelGetsZeroAbundances() {
        double[][] pixels = { A, B, { 0.5, Double.NaN, 0.4, 0.4 }, mix(0.5, 0.5) };
        AbundanceResult result = new AbundanceMapper().map(new double[][] { A, B },
                HyperspectralCube.fromPixels(2, 2, pixels), true);
        for (double v : result.getAbundances(2)) {
            assertEquals(0.0, v, 0.0);
        }
        assertEquals(0.5, result.get(1, 1, 0), 1e-9);
    }

    @Test
    public void testLeastSquaresFallbackPreservesConstraints() {
        AbundanceMapper failingPinv = new AbundanceMapper() {
            @Override
            protected RealMatrix pseudoInverse(RealMatrix matrix) {
                throw new NumericalException("SVD did not converge");
            }
        };
        AbundanceResult fallback = failingPinv.map(new double[][] { A, B }, mixedCube(), true);
        AbundanceResult primary = new AbundanceMapper().map(new double[][] { A, B }, mixedCube(), true);

        assertEquals(3, fallback.getLayerCount());
        assertConstraints(fallback);
        for (int p = 0; p < 4; p++) {
            assertArrayEquals(primary.getAbundances(p), fallback.getAbundances(p), 1e-9);
        }
    }

    @Test
    public void testFallbackWithDependentEndmembersFails() {
        AbundanceMapper failingPinv = new AbundanceMapper() {
            @Override
            protected RealMatrix pseudoInverse(RealMatrix matrix) {
                throw new NumericalException("SVD did not converge");
            }
        };
        double[] doubled = { 1.8, 1.0, 0.2, 0.4 };
        assertThrows(NumericalException.class,
                () -> failingPinv.map(new double[][] { A, doubled }, mixedCube(), false));
    }

    @Test
    public void testValidation() {
        AbundanceMapper mapper = new AbundanceMapper();
        assertThrows(ValidationException.class, () -> mapper.map((EndmemberSet) null, mixedCube(), true));
        assertThrows(ValidationException.class, () -> mapper.map(new double[0][], mixedCube(), true));
        assertThrows(ValidationException.class,
                () -> mapper.map(new double[][] { { 1.0, 2.0 } }, mixedCube(), true));
        assertThrows(ValidationException.class,
                () -> mapper.map(new double[][] { { 1.0, Double.NaN, 0.0, 0.0 } }, mixedCube(), true));
    }
}
