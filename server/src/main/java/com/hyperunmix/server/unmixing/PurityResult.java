package com.hyperunmix.server.unmixing;

import com.hyperunmix.util.SpectralMath;

import java.util.Arrays;

/**
 * Output of {@link PixelPurityScorer}. Skewers and projections are kept for visualization only.
 */
public class PurityResult {
    private final int height;
    private final int width;
    private final int iterations;
    private final int[] scores;
    private final double[][] skewers;
    private final double[][] projections;

    public PurityResult(int height, int width, int iterations, int[] scores, double[][] skewers,
            double[][] projections) {
        this.height = height;
        this.width = width;
        this.iterations = iterations;
        this.scores = Arrays.copyOf(scores, scores.length);
        this.skewers = copyOf(skewers);
        this.projections = copyOf(projections);
    }

    /**
     * Same scores and skewers with the projection matrix dropped. It is pixels x batch size, the
     * largest part of the result, and nothing downstream of endmember extraction reads it.
     */
    public PurityResult withoutProjections() {
        return new PurityResult(height, width, iterations, scores, skewers, new double[0][]);
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    public int getIterations() {
        return iterations;
    }

    public int getScore(int row, int col) {
        return scores[row * width + col];
    }

    /**
     * Flattened scores, index = row * width + col.
     */
    public int[] getScores() {
        return Arrays.copyOf(scores, scores.length);
    }

    public int[][] getScoreMap() {
        int[][] map = new int[height][width];
        for (int r = 0; r < height; r++) {
            System.arraycopy(scores, r * width, map[r], 0, width);
        }
        return map;
    }

    // iterations x components, unit vectors
    public double[][] getSkewers() {
        return copyOf(skewers);
    }

    // pixels x skewers of the final batch
    public double[][] getProjections() {
        return copyOf(projections);
    }

    public boolean hasProjections() {
        return projections.length > 0;
    }

    // Flat index of the highest score, the first one on ties
    public int getPurestPixel() {
        return SpectralMath.argmax(scores);
    }

    public int getMaxPossibleScore() {
        return 2 * iterations;
    }

    public int countScoredPixels() {
        int count = 0;
        for (int s : scores) {
            if (s > 0) {
                count++;
            }
        }
        return count;
    }

    private static double[][] copyOf(double[][] rows) {
        double[][] copy = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            copy[i] = rows[i].clone();
        }
        return copy;
    }
}
