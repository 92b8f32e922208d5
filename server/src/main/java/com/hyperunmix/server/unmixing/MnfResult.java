package com.hyperunmix.server.unmixing;

import com.hyperunmix.server.unmixing.error.NumericalException;
import com.hyperunmix.server.unmixing.error.ValidationException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;

import java.util.Arrays;

/**
 * Output of {@link MnfTransform}: the component cube with eigenvalues sorted in non-increasing order.
 * Component k of the cube corresponds to eigenvalue k.
 */
public class MnfResult {
    private final HyperspectralCube components;
    private final double[] eigenvalues;
    private final RealMatrix projection;
    private final double[] bandMeans;

    public MnfResult(HyperspectralCube components, double[] eigenvalues, RealMatrix projection, double[] bandMeans) {
        this.components = components;
        this.eigenvalues = Arrays.copyOf(eigenvalues, eigenvalues.length);
        this.projection = projection.copy();
        this.bandMeans = Arrays.copyOf(bandMeans, bandMeans.length);
    }

    public HyperspectralCube getComponents() {
        return components;
    }

    public double[] getEigenvalues() {
        return Arrays.copyOf(eigenvalues, eigenvalues.length);
    }

    /**
     * Keeps the first {@code count} components, the highest signal-to-noise ones.
     */
    public HyperspectralCube reduce(int count) {
        return components.firstBands(count);
    }

    /**
     * Reconstructs a cube in the original band space from the selected components only.
     * All other components are zeroed before inverting the projection.
     */
    public HyperspectralCube inverse(int... selectedComponents) {
        int bands = components.getBands();
        boolean[] keep = new boolean[bands];
        for (int k : selectedComponents) {
            if (k < 0 || k >= bands) {
                throw new ValidationException("Component index " + k + " outside [0, " + bands + ")");
            }
            keep[k] = true;
        }

        double[][] inv;
        try {
            inv = new SingularValueDecomposition(projection).getSolver().getInverse().getData();
        } catch (MathIllegalStateException e) {
            throw new NumericalException("Pseudo-inverse of the MNF projection failed", e);
        }

        int n = components.getPixelCount();
        double[] out = new double[n * bands];
        for (int p = 0; p < n; p++) {
            double[] y = components.getPixel(p);
            int base = p * bands;
            for (int b = 0; b < bands; b++) {
                double sum = bandMeans[b];
                for (int k = 0; k < bands; k++) {
                    if (keep[k]) {
                        sum += y[k] * inv[k][b];
                    }
                }
                out[base + b] = sum;
            }
        }
        return new HyperspectralCube(components.getHeight(), components.getWidth(), bands, out);
    }
}
