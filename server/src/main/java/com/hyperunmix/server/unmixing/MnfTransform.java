package com.hyperunmix.server.unmixing;

import com.hyperunmix.server.unmixing.error.NumericalException;
import com.hyperunmix.server.unmixing.error.ValidationException;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Minimum Noise Fraction transform.
 *
 * 1. Whitening W = Ev diag(1 / sqrt(ew)) Ev^T from the noise covariance, eigenvalues floored at epsilon.
 * 2. Signal covariance Cd of the demeaned pixels (NaN samples count as 0).
 * 3. Eigenpairs of W Cd W^T sorted by descending eigenvalue.
 * 4. Components Y = Xc P with P = W^T E.
 *
 * Flooring the noise eigenvalues keeps a near-singular noise covariance invertible at the cost of
 * fidelity in its lowest-variance directions. This is a known approximation.
 */
public class MnfTransform {
    private static final Logger logger = LoggerFactory.getLogger(MnfTransform.class);

    public static final double DEFAULT_EIGENVALUE_FLOOR = 1e-8;

    private final NoiseCovarianceEstimator noiseEstimator;
    private final double eigenvalueFloor;

    public MnfTransform() {
        this(new NoiseCovarianceEstimator(), DEFAULT_EIGENVALUE_FLOOR);
    }

    public MnfTransform(NoiseCovarianceEstimator noiseEstimator, double eigenvalueFloor) {
        if (!(eigenvalueFloor > 0)) {
            throw new ValidationException("Eigenvalue floor must be positive, got " + eigenvalueFloor);
        }
        this.noiseEstimator = noiseEstimator;
        this.eigenvalueFloor = eigenvalueFloor;
    }

    public MnfResult apply(HyperspectralCube cube) {
        validate(cube);
        long start = System.currentTimeMillis();
        int h = cube.getHeight();
        int w = cube.getWidth();
        int bands = cube.getBands();
        int n = cube.getPixelCount();
        logger.info("Applying MNF to cube {}x{}x{}", h, w, bands);

        RealMatrix noiseCov = noiseEstimator.estimate(cube);

        // Demeaned pixels, NaN replaced by 0
        double[][] xc = cube.toPixelMatrix();
        double[] mean = new double[bands];
        for (double[] px : xc) {
            for (int b = 0; b < bands; b++) {
                if (Double.isNaN(px[b])) {
                    px[b] = 0.0;
                }
                mean[b] += px[b];
            }
        }
        for (int b = 0; b < bands; b++) {
            mean[b] /= n;
        }
        for (double[] px : xc) {
            for (int b = 0; b < bands; b++) {
                px[b] -= mean[b];
            }
        }
        RealMatrix signalCov = scatter(xc, bands, Math.max(1, n - 1));

        RealMatrix whitening = whitening(noiseCov);
        RealMatrix a = symmetrize(whitening.multiply(signalCov).multiply(whitening.transpose()));

        EigenDecomposition eig = decompose(a, "whitened signal covariance");
        double[] lam = eig.getRealEigenvalues();
        RealMatrix vectors = eig.getV();

        Integer[] order = new Integer[bands];
        for (int i = 0; i < bands; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> lam[i]).reversed());

        double[] eigenvalues = new double[bands];
        RealMatrix sorted = MatrixUtils.createRealMatrix(bands, bands);
        for (int k = 0; k < bands; k++) {
            eigenvalues[k] = lam[order[k]];
            sorted.setColumnVector(k, vectors.getColumnVector(order[k]));
        }

        RealMatrix projection = whitening.transpose().multiply(sorted);
        double[][] p = projection.getData();

        double[] y = new double[n * bands];
        for (int i = 0; i < n; i++) {
            double[] px = xc[i];
            int base = i * bands;
            for (int k = 0; k < bands; k++) {
                double sum = 0.0;
                for (int b = 0; b < bands; b++) {
                    sum += px[b] * p[b][k];
                }
                y[base + k] = sum;
            }
        }

        HyperspectralCube components = new HyperspectralCube(h, w, bands, y);
        logger.info("MNF complete in {} ms. Leading eigenvalue={}", (System.currentTimeMillis() - start),
                String.format("%.4f", eigenvalues[0]));
        return new MnfResult(components, eigenvalues, projection, mean);
    }

    RealMatrix whitening(RealMatrix noiseCov) {
        EigenDecomposition eig = decompose(symmetrize(noiseCov), "noise covariance");
        double[] ew = eig.getRealEigenvalues();
        RealMatrix ev = eig.getV();

        int floored = 0;
        double[] invSqrt = new double[ew.length];
        for (int i = 0; i < ew.length; i++) {
            double v = ew[i];
            if (v < eigenvalueFloor) {
                v = eigenvalueFloor;
                floored++;
            }
            invSqrt[i] = 1.0 / Math.sqrt(v);
        }
        if (floored > 0) {
            logger.warn("Noise covariance is near-singular: floored {} of {} eigenvalues to {}", floored,
                    ew.length, eigenvalueFloor);
        }
        return ev.multiply(MatrixUtils.createRealDiagonalMatrix(invSqrt)).multiply(ev.transpose());
    }

    private static EigenDecomposition decompose(RealMatrix m, String what) {
        try {
            return new EigenDecomposition(m);
        } catch (MathIllegalStateException | MathArithmeticException e) {
            throw new NumericalException("Eigendecomposition of the " + what + " failed", e);
        }
    }

    private static RealMatrix scatter(double[][] rows, int bands, double denom) {
        double[][] cov = new double[bands][bands];
        for (double[] px : rows) {
            for (int i = 0; i < bands; i++) {
                double pi = px[i];
                for (int j = i; j < bands; j++) {
                    cov[i][j] += pi * px[j];
                }
            }
        }
        for (int i = 0; i < bands; i++) {
            for (int j = i; j < bands; j++) {
                cov[i][j] /= denom;
                cov[j][i] = cov[i][j];
            }
        }
        return new Array2DRowRealMatrix(cov, false);
    }

    private static RealMatrix symmetrize(RealMatrix m) {
        return m.add(m.transpose()).scalarMultiply(0.5);
    }

    private static void validate(HyperspectralCube cube) {
        if (cube == null) {
            throw new ValidationException("Cube must not be null");
        }
        if (cube.getHeight() < 2) {
            throw new ValidationException("MNF needs at least 2 rows, got " + cube.getHeight());
        }
        for (int p = 0; p < cube.getPixelCount(); p++) {
            for (double v : cube.getPixel(p)) {
                if (Double.isInfinite(v)) {
                    throw new ValidationException("Cube contains an infinite value at pixel " + p);
                }
            }
        }
    }
}
