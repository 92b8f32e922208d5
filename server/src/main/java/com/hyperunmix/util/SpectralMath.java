package com.hyperunmix.util;

public class SpectralMath {

    /**
     * Euclidean norm of a vector.
     */
    public static double norm(double[] v) {
        double sum = 0.0;
        for (double x : v) {
            sum += x * x;
        }
        return Math.sqrt(sum);
    }

    public static double dot(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Arrays must have same length");
        }
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    /**
     * Cosine of the angle between two spectra. Returns 0 when either spectrum is all zero.
     */
    public static double cosineSimilarity(double[] a, double[] b) {
        double na = norm(a);
        double nb = norm(b);
        if (na == 0.0 || nb == 0.0) {
            return 0.0;
        }
        return dot(a, b) / (na * nb);
    }

    /**
     * Returns the index of the maximum value, the first one on ties.
     */
    public static int argmax(int[] x) {
        int bestIdx = -1;
        int bestVal = Integer.MIN_VALUE;
        for (int i = 0; i < x.length; i++) {
            if (x[i] > bestVal) {
                bestVal = x[i];
                bestIdx = i;
            }
        }
        return bestIdx;
    }
}
