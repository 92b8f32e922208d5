package com.hyperunmix.server.unmixing;

import com.hyperunmix.server.unmixing.backend.ArrayBackend;
import com.hyperunmix.server.unmixing.backend.CpuArrayBackend;
import com.hyperunmix.server.unmixing.error.ValidationException;
import com.hyperunmix.util.SpectralMath;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.UnitSphereRandomVectorGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.concurrent.CancellationException;

/**
 * Pixel Purity Index.
 *
 * Every pixel is normalized to unit length (zero-norm pixels stay as they are) and projected onto K random
 * unit skewers. For each skewer, pixels within range * thresholdFactor of the maximum or of the minimum
 * projection score one point each, so a score never exceeds 2K. Skewers are processed in batches; the
 * cancellation signal is polled between batches only.
 */
public class PixelPurityScorer {
    private static final Logger logger = LoggerFactory.getLogger(PixelPurityScorer.class);

    public static final int DEFAULT_BATCH_SIZE = 1000;

    private final ArrayBackend backend;
    private final int batchSize;

    public PixelPurityScorer() {
        this(new CpuArrayBackend(), DEFAULT_BATCH_SIZE);
    }

    public PixelPurityScorer(ArrayBackend backend, int batchSize) {
        if (backend == null) {
            throw new ValidationException("Array backend must not be null");
        }
        if (batchSize <= 0) {
            throw new ValidationException("Batch size must be positive, got " + batchSize);
        }
        this.backend = backend;
        this.batchSize = batchSize;
    }

    public PurityResult score(HyperspectralCube cube, int iterations, double thresholdFactor, Long seed) {
        return score(cube, iterations, thresholdFactor, seed, CancellationSignal.NONE, ProgressListener.NONE);
    }

    public PurityResult score(HyperspectralCube cube, int iterations, double thresholdFactor, Long seed,
            CancellationSignal cancellation, ProgressListener progress) {
        validate(cube, iterations, thresholdFactor);
        long start = System.currentTimeMillis();
        int n = cube.getPixelCount();
        int dims = cube.getBands();
        logger.info("Calculating PPI with {} iterations (threshold: {}, backend: {}, batch: {}) on {} pixels x {} dims",
                iterations, thresholdFactor, backend.getName(), batchSize, n, dims);

        double[][] normalized = normalizedPixels(cube);
        double[][] skewers = generateSkewers(iterations, dims, seed);

        int[] scores = new int[n];
        double[][] projections = new double[0][];
        for (int batchStart = 0; batchStart < iterations; batchStart += batchSize) {
            if (cancellation.isCancelled() || Thread.currentThread().isInterrupted()) {
                logger.info("PPI cancelled after {}/{} iterations, discarding partial scores", batchStart,
                        iterations);
                throw new CancellationException("PPI cancelled after " + batchStart + " of " + iterations
                        + " iterations");
            }
            int batchEnd = Math.min(batchStart + batchSize, iterations);
            double[][] batch = Arrays.copyOfRange(skewers, batchStart, batchEnd);

            projections = backend.multiplyTransposed(normalized, batch);
            backend.accumulateExtrema(projections, thresholdFactor, scores);

            progress.onProgress(batchEnd, iterations);
            if (logger.isDebugEnabled()) {
                logger.debug("  Progress: {}/{} iterations ({}%)", batchEnd, iterations,
                        String.format("%.1f", 100.0 * batchEnd / iterations));
            }
        }

        PurityResult result = new PurityResult(cube.getHeight(), cube.getWidth(), iterations, scores, skewers,
                projections);
        logger.info("PPI completed in {} ms. Pixels with non-zero score: {}", (System.currentTimeMillis() - start),
                result.countScoredPixels());
        return result;
    }

    /**
     * Draws {@code count} unit vectors uniformly on the sphere of the given dimension.
     */
    public static double[][] generateSkewers(int count, int dimension, Long seed) {
        RandomGenerator rng = seed != null ? new Well19937c(seed) : new Well19937c();
        UnitSphereRandomVectorGenerator generator = new UnitSphereRandomVectorGenerator(dimension, rng);
        double[][] skewers = new double[count][];
        for (int i = 0; i < count; i++) {
            skewers[i] = generator.nextVector();
        }
        return skewers;
    }

    static double[][] normalizedPixels(HyperspectralCube cube) {
        double[][] pixels = cube.toPixelMatrix();
        for (double[] px : pixels) {
            for (int b = 0; b < px.length; b++) {
                if (Double.isNaN(px[b])) {
                    px[b] = 0.0;
                }
            }
            double norm = SpectralMath.norm(px);
            if (norm == 0.0) {
                norm = 1.0;
            }
            for (int b = 0; b < px.length; b++) {
                px[b] /= norm;
            }
        }
        return pixels;
    }

    private static void validate(HyperspectralCube cube, int iterations, double thresholdFactor) {
        if (cube == null) {
            throw new ValidationException("Cube must not be null");
        }
        if (iterations <= 0) {
            throw new ValidationException("Iteration count must be positive, got " + iterations);
        }
        if (!(thresholdFactor >= 0.0 && thresholdFactor <= 1.0)) {
            throw new ValidationException("Threshold factor must be in [0, 1], got " + thresholdFactor);
        }
    }
}
