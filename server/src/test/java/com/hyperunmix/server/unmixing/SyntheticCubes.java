package com.hyperunmix.server.unmixing;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.util.Arrays;

/**
 * Cubes with a known answer for the unmixing tests.
 */
public final class SyntheticCubes {

    private SyntheticCubes() {
    }

    // Rising reflectance, 0.2 to 0.8
    public static double[] materialA(int bands) {
        double[] s = new double[bands];
        for (int b = 0; b < bands; b++) {
            s[b] = 0.2 + 0.6 * b / (bands - 1);
        }
        return s;
    }

    // Falling reflectance, 0.8 to 0.2
    public static double[] materialB(int bands) {
        double[] s = new double[bands];
        for (int b = 0; b < bands; b++) {
            s[b] = 0.8 - 0.6 * b / (bands - 1);
        }
        return s;
    }

    /**
     * Material A in the left half of the columns, material B in the right half, plus gaussian noise.
     */
    public static HyperspectralCube twoMaterials(int height, int width, int bands, double noise, long seed) {
        RandomGenerator rng = new Well19937c(seed);
        double[] a = materialA(bands);
        double[] b = materialB(bands);
        double[][][] values = new double[height][width][bands];
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                double[] base = c < width / 2 ? a : b;
                for (int k = 0; k < bands; k++) {
                    values[r][c][k] = base[k] + noise * rng.nextGaussian();
                }
            }
        }
        return HyperspectralCube.of(values);
    }

    public static HyperspectralCube gaussianNoise(int height, int width, int bands, long seed) {
        RandomGenerator rng = new Well19937c(seed);
        double[] data = new double[height * width * bands];
        for (int i = 0; i < data.length; i++) {
            data[i] = rng.nextGaussian();
        }
        return new HyperspectralCube(height, width, bands, data);
    }

    public static HyperspectralCube constant(int height, int width, int bands, double value) {
        double[] data = new double[height * width * bands];
        Arrays.fill(data, value);
        return new HyperspectralCube(height, width, bands, data);
    }
}
