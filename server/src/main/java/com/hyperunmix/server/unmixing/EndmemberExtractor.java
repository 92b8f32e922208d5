package com.hyperunmix.server.unmixing;

import com.hyperunmix.server.unmixing.error.ClusteringException;
import com.hyperunmix.server.unmixing.error.InsufficientPurePixelsException;
import com.hyperunmix.server.unmixing.error.ValidationException;
import com.hyperunmix.util.SpectralMath;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.ml.clustering.CentroidCluster;
import org.apache.commons.math3.ml.clustering.Clusterable;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.clustering.MultiKMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Selects the purest pixels (score at or above the top percentile of the positive scores), clusters their
 * full-band spectra with k-means++ and keeps the purest member of every non-empty cluster.
 */
public class EndmemberExtractor {
    private static final Logger logger = LoggerFactory.getLogger(EndmemberExtractor.class);

    public static final double DEFAULT_TOP_PERCENTILE = 98.0;
    public static final int DEFAULT_INITIALIZATIONS = 10;
    public static final int DEFAULT_MAX_ITERATIONS = 300;
    public static final long DEFAULT_SEED = 42L;

    static final double DUPLICATE_COSINE = 0.9999;

    private final double topPercentile;
    private final int initializations;
    private final int maxIterations;
    private final long seed;

    public EndmemberExtractor() {
        this(DEFAULT_TOP_PERCENTILE, DEFAULT_INITIALIZATIONS, DEFAULT_MAX_ITERATIONS, DEFAULT_SEED);
    }

    public EndmemberExtractor(double topPercentile, int initializations, int maxIterations, long seed) {
        if (!(topPercentile > 0.0 && topPercentile <= 100.0)) {
            throw new ValidationException("Top percentile must be in (0, 100], got " + topPercentile);
        }
        if (initializations <= 0 || maxIterations <= 0) {
            throw new ValidationException("k-means initializations and iterations must be positive");
        }
        this.topPercentile = topPercentile;
        this.initializations = initializations;
        this.maxIterations = maxIterations;
        this.seed = seed;
    }

    public EndmemberSet extract(PurityResult purity, HyperspectralCube original, int count) {
        validate(purity, original, count);
        long start = System.currentTimeMillis();
        int[] scores = purity.getScores();

        // 1. Pure pixel selection
        double[] positive = Arrays.stream(scores).filter(s -> s > 0).asDoubleStream().toArray();
        if (positive.length == 0) {
            throw new InsufficientPurePixelsException("No pixel has a positive purity score; no pixels found above "
                    + topPercentile + "th percentile. Try a lower threshold or more iterations.");
        }
        double threshold = new Percentile(topPercentile)
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(positive);

        List<PixelPoint> points = new ArrayList<>();
        int skippedNaN = 0;
        for (int p = 0; p < scores.length; p++) {
            if (scores[p] > 0 && scores[p] >= threshold) {
                if (original.pixelHasNaN(p)) {
                    skippedNaN++;
                    continue;
                }
                points.add(new PixelPoint(p, scores[p], original.getPixel(p)));
            }
        }
        if (skippedNaN > 0) {
            logger.warn("Excluded {} pure pixels with missing (NaN) samples from clustering", skippedNaN);
        }
        if (points.isEmpty()) {
            throw new InsufficientPurePixelsException("No pixels found above " + topPercentile
                    + "th percentile (score >= " + threshold + "). Try a lower threshold or more iterations.");
        }
        if (points.size() < count) {
            throw new ClusteringException("Only " + points.size() + " pure pixels for " + count + " endmembers");
        }
        logger.info("Selected {} pure pixels (score >= {}) for {} clusters", points.size(),
                String.format("%.2f", threshold), count);

        // 2. k-means on the full-band spectra
        List<CentroidCluster<PixelPoint>> clusters = cluster(points, count);

        // 3. Purest member of each cluster
        int[] assignments = new int[scores.length];
        Arrays.fill(assignments, -1);
        List<Endmember> endmembers = new ArrayList<>();
        for (int i = 0; i < clusters.size(); i++) {
            List<PixelPoint> members = clusters.get(i).getPoints();
            if (members.isEmpty()) {
                logger.warn("Cluster {} is empty, no endmember emitted for it", i);
                continue;
            }
            PixelPoint best = members.get(0);
            int[] memberPixels = new int[members.size()];
            double[][] memberSpectra = new double[members.size()][];
            for (int m = 0; m < members.size(); m++) {
                PixelPoint pt = members.get(m);
                memberPixels[m] = pt.index;
                memberSpectra[m] = pt.spectrum;
                if (pt.score > best.score) {
                    best = pt;
                }
                assignments[pt.index] = endmembers.size();
            }
            endmembers.add(new Endmember(best.spectrum, best.index, best.score, i, memberPixels, memberSpectra));
        }
        if (endmembers.isEmpty()) {
            throw new ClusteringException("k-means produced no non-empty cluster");
        }
        warnOnNearDuplicates(endmembers);

        logger.info("Extracted {} endmembers in {} ms", endmembers.size(), (System.currentTimeMillis() - start));
        return new EndmemberSet(endmembers, assignments, purity.getHeight(), purity.getWidth(), threshold);
    }

    private static void warnOnNearDuplicates(List<Endmember> endmembers) {
        for (int i = 0; i < endmembers.size(); i++) {
            for (int j = i + 1; j < endmembers.size(); j++) {
                double cos = SpectralMath.cosineSimilarity(endmembers.get(i).getSpectrum(),
                        endmembers.get(j).getSpectrum());
                if (cos > DUPLICATE_COSINE) {
                    logger.warn("Endmembers {} and {} are nearly identical (cosine {}); fewer materials than "
                            + "requested may be present", i, j, String.format("%.5f", cos));
                }
            }
        }
    }

    private List<CentroidCluster<PixelPoint>> cluster(List<PixelPoint> points, int count) {
        KMeansPlusPlusClusterer<PixelPoint> kmeans = new KMeansPlusPlusClusterer<>(count, maxIterations,
                new EuclideanDistance(), new Well19937c(seed));
        MultiKMeansPlusPlusClusterer<PixelPoint> multi = new MultiKMeansPlusPlusClusterer<>(kmeans,
                initializations);
        try {
            return multi.cluster(points);
        } catch (MathIllegalStateException | MathIllegalArgumentException e) {
            throw new ClusteringException("k-means clustering of " + points.size() + " pure pixels into " + count
                    + " clusters failed", e);
        }
    }

    private static void validate(PurityResult purity, HyperspectralCube original, int count) {
        if (purity == null || original == null) {
            throw new ValidationException("Purity map and original cube are required");
        }
        if (count < 2) {
            throw new ValidationException("Endmember count must be at least 2, got " + count);
        }
        if (purity.getHeight() != original.getHeight() || purity.getWidth() != original.getWidth()) {
            throw new ValidationException("Purity map " + purity.getHeight() + "x" + purity.getWidth()
                    + " does not match cube " + original.getHeight() + "x" + original.getWidth());
        }
    }

    private static class PixelPoint implements Clusterable {
        final int index;
        final int score;
        final double[] spectrum;

        PixelPoint(int index, int score, double[] spectrum) {
            this.index = index;
            this.score = score;
            this.spectrum = spectrum;
        }

        @Override
        public double[] getPoint() {
            return spectrum;
        }
    }
}
