package com.hyperunmix.server.unmixing.backend;

/**
 * Array computations used by the pixel purity scorer. Implementations differ only in how the work is
 * scheduled: for the same inputs every backend must produce the same scores.
 */
public interface ArrayBackend {

    /**
     * Projections whose range is at or below this value have no extrema and score nothing.
     */
    double DEGENERATE_RANGE = 1e-12;

    String getName();

    /**
     * Computes a . b^T for a (n x c) and b (k x c), giving an n x k matrix.
     */
    double[][] multiplyTransposed(double[][] a, double[][] b);

    /**
     * For every column of projections (n x k), adds 1 to scores[p] when projection[p] is within
     * range * thresholdFactor of the column maximum, and 1 more when it is within that distance of the
     * column minimum.
     */
    void accumulateExtrema(double[][] projections, double thresholdFactor, int[] scores);
}
