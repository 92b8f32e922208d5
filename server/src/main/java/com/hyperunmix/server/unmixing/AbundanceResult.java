package com.hyperunmix.server.unmixing;

import com.hyperunmix.server.unmixing.error.ValidationException;

import java.util.Arrays;

/**
 * H x W x layers abundance fractions. When the shade endmember was requested it is the last layer.
 * Every pixel's fractions are non-negative and sum to 1, except pixels with no usable fraction (all zero).
 */
public class AbundanceResult {
    private final int height;
    private final int width;
    private final int layers;
    private final boolean shadeIncluded;
    private final double[] data;

    public AbundanceResult(int height, int width, int layers, boolean shadeIncluded, double[] data) {
        this.height = height;
        this.width = width;
        this.layers = layers;
        this.shadeIncluded = shadeIncluded;
        this.data = Arrays.copyOf(data, data.length);
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    public int getLayerCount() {
        return layers;
    }

    public boolean isShadeIncluded() {
        return shadeIncluded;
    }

    public double get(int row, int col, int layer) {
        return data[(row * width + col) * layers + layer];
    }

    public double[] getAbundances(int pixelIndex) {
        return Arrays.copyOfRange(data, pixelIndex * layers, (pixelIndex + 1) * layers);
    }

    /**
     * The fraction map of one endmember (or of the shade layer).
     */
    public double[][] getMap(int layer) {
        if (layer < 0 || layer >= layers) {
            throw new ValidationException("Abundance layer " + layer + " outside [0, " + layers + ")");
        }
        double[][] map = new double[height][width];
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                map[r][c] = data[(r * width + c) * layers + layer];
            }
        }
        return map;
    }
}
