package com.hyperunmix.server.unmixing;

import com.hyperunmix.server.unmixing.error.NumericalException;
import com.hyperunmix.server.unmixing.error.ValidationException;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Linear unmixing against an endmember matrix, optionally with an all-zero shade endmember.
 *
 * Raw abundances come from the Moore-Penrose pseudo-inverse of the (bands x endmembers) matrix, falling back
 * to per-pixel least squares when the pseudo-inverse cannot be computed. Negative fractions are clipped to 0
 * and each pixel is rescaled to sum to 1; a pixel whose clipped sum is 0 keeps all-zero fractions.
 * This approximates fully constrained least squares without iterating.
 */
public class AbundanceMapper {
    private static final Logger logger = LoggerFactory.getLogger(AbundanceMapper.class);

    // Smallest |R(i,i)| the least squares fallback accepts as full rank
    static final double RANK_THRESHOLD = 1e-10;

    public AbundanceResult map(EndmemberSet endmembers, HyperspectralCube cube, boolean addShade) {
        if (endmembers == null) {
            throw new ValidationException("Endmembers must be extracted before abundance mapping");
        }
        return map(endmembers.getSpectra(), cube, addShade);
    }

    public AbundanceResult map(double[][] endmembers, HyperspectralCube cube, boolean addShade) {
        validate(endmembers, cube);
        long start = System.currentTimeMillis();
        int bands = cube.getBands();
        int n = cube.getPixelCount();
        int layers = endmembers.length + (addShade ? 1 : 0);

        // (bands, layers); the shade column stays zero
        RealMatrix matrix = MatrixUtils.createRealMatrix(bands, layers);
        for (int e = 0; e < endmembers.length; e++) {
            matrix.setColumn(e, endmembers[e]);
        }
        logger.info("Unmixing {} pixels x {} bands against {} endmembers (shade: {})", n, bands, layers, addShade);

        double[] abundances = new double[n * layers];
        try {
            double[][] pinv = pseudoInverse(matrix).getData();
            for (int p = 0; p < n; p++) {
                if (cube.pixelHasNaN(p)) {
                    continue;
                }
                double[] px = cube.getPixel(p);
                int base = p * layers;
                for (int k = 0; k < layers; k++) {
                    double sum = 0.0;
                    for (int b = 0; b < bands; b++) {
                        sum += pinv[k][b] * px[b];
                    }
                    abundances[base + k] = sum;
                }
            }
        } catch (NumericalException e) {
            logger.warn("Pseudo-inverse failed ({}), using per-pixel least squares", e.getMessage());
            leastSquares(matrix, cube, abundances);
        }

        applyConstraints(abundances, layers);
        logger.info("Abundance mapping completed in {} ms", (System.currentTimeMillis() - start));
        return new AbundanceResult(cube.getHeight(), cube.getWidth(), layers, addShade, abundances);
    }

    protected RealMatrix pseudoInverse(RealMatrix matrix) {
        try {
            return new SingularValueDecomposition(matrix).getSolver().getInverse();
        } catch (MathIllegalStateException | MathArithmeticException e) {
            throw new NumericalException("Pseudo-inverse of the endmember matrix failed", e);
        }
    }

    // All-zero columns (the shade endmember) have no determined abundance and stay 0.
    private void leastSquares(RealMatrix matrix, HyperspectralCube cube, double[] abundances) {
        int layers = matrix.getColumnDimension();
        int[] usable = new int[layers];
        int count = 0;
        for (int k = 0; k < layers; k++) {
            if (matrix.getColumnVector(k).getNorm() > 0.0) {
                usable[count++] = k;
            }
        }
        if (count == 0) {
            throw new NumericalException("Every endmember is all zero, nothing to unmix against");
        }
        RealMatrix reduced = MatrixUtils.createRealMatrix(matrix.getRowDimension(), count);
        for (int i = 0; i < count; i++) {
            reduced.setColumnVector(i, matrix.getColumnVector(usable[i]));
        }
        DecompositionSolver solver = new QRDecomposition(reduced, RANK_THRESHOLD).getSolver();
        if (!solver.isNonSingular()) {
            throw new NumericalException("Endmember matrix is rank deficient, least squares fallback failed");
        }

        for (int p = 0; p < cube.getPixelCount(); p++) {
            if (cube.pixelHasNaN(p)) {
                continue;
            }
            double[] x = solver.solve(new ArrayRealVector(cube.getPixel(p), false)).toArray();
            for (int i = 0; i < count; i++) {
                abundances[p * layers + usable[i]] = x[i];
            }
        }
    }

    static void applyConstraints(double[] abundances, int layers) {
        for (int base = 0; base < abundances.length; base += layers) {
            double sum = 0.0;
            for (int k = 0; k < layers; k++) {
                if (abundances[base + k] < 0) {
                    abundances[base + k] = 0.0;
                }
                sum += abundances[base + k];
            }
            if (sum == 0.0) {
                sum = 1.0;
            }
            for (int k = 0; k < layers; k++) {
                abundances[base + k] /= sum;
            }
        }
    }

    private static void validate(double[][] endmembers, HyperspectralCube cube) {
        if (cube == null) {
            throw new ValidationException("Cube must not be null");
        }
        if (endmembers == null || endmembers.length == 0) {
            throw new ValidationException("At least one endmember is required");
        }
        for (int e = 0; e < endmembers.length; e++) {
            if (endmembers[e] == null || endmembers[e].length != cube.getBands()) {
                throw new ValidationException("Endmember " + e + " does not have " + cube.getBands() + " bands");
            }
            for (double v : endmembers[e]) {
                if (!Double.isFinite(v)) {
                    throw new ValidationException("Endmember " + e + " contains a non-finite value");
                }
            }
        }
    }
}
