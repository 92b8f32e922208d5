package com.hyperunmix.server.unmixing;

import com.hyperunmix.server.unmixing.error.NoiseEstimationException;
import com.hyperunmix.server.unmixing.error.ValidationException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Estimates the noise covariance of a cube from first differences between vertically adjacent pixels.
 *
 * diff[r][c] = cube[r + 1][c] - cube[r][c], rows holding any NaN are dropped, the remaining rows are
 * demeaned and Cn = Xn^T Xn / max(1, M - 1).
 */
public class NoiseCovarianceEstimator {
    private static final Logger logger = LoggerFactory.getLogger(NoiseCovarianceEstimator.class);

    public RealMatrix estimate(HyperspectralCube cube) {
        if (cube.getHeight() < 2) {
            throw new ValidationException("Noise estimation needs at least 2 rows, got " + cube.getHeight());
        }
        int h = cube.getHeight();
        int w = cube.getWidth();
        int bands = cube.getBands();

        // 1. Mean of the valid difference rows
        double[] mean = new double[bands];
        double[] diff = new double[bands];
        long valid = 0;
        for (int r = 0; r < h - 1; r++) {
            for (int c = 0; c < w; c++) {
                if (difference(cube, r, c, diff)) {
                    for (int b = 0; b < bands; b++) {
                        mean[b] += diff[b];
                    }
                    valid++;
                }
            }
        }
        if (valid == 0) {
            throw new NoiseEstimationException("Noise estimation failed (NaNs everywhere after diff).");
        }
        for (int b = 0; b < bands; b++) {
            mean[b] /= valid;
        }

        // 2. Upper triangle of the scatter matrix
        double[][] cov = new double[bands][bands];
        for (int r = 0; r < h - 1; r++) {
            for (int c = 0; c < w; c++) {
                if (!difference(cube, r, c, diff)) {
                    continue;
                }
                for (int b = 0; b < bands; b++) {
                    diff[b] -= mean[b];
                }
                for (int i = 0; i < bands; i++) {
                    double di = diff[i];
                    for (int j = i; j < bands; j++) {
                        cov[i][j] += di * diff[j];
                    }
                }
            }
        }

        double denom = Math.max(1, valid - 1);
        for (int i = 0; i < bands; i++) {
            for (int j = i; j < bands; j++) {
                cov[i][j] /= denom;
                cov[j][i] = cov[i][j];
            }
        }

        long dropped = (long) (h - 1) * w - valid;
        if (dropped > 0) {
            logger.debug("Noise estimation dropped {} of {} difference rows containing NaN", dropped,
                    (long) (h - 1) * w);
        }
        return new Array2DRowRealMatrix(cov, false);
    }

    // Fills out with cube[r + 1][c] - cube[r][c]; false when any sample is NaN.
    private static boolean difference(HyperspectralCube cube, int r, int c, double[] out) {
        for (int b = 0; b < out.length; b++) {
            double v = cube.get(r + 1, c, b) - cube.get(r, c, b);
            if (Double.isNaN(v)) {
                return false;
            }
            out[b] = v;
        }
        return true;
    }
}
