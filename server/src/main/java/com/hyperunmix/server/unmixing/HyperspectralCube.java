package com.hyperunmix.server.unmixing;

import com.hyperunmix.server.unmixing.error.ValidationException;

import java.util.Arrays;

/**
 * An immutable H x W x B cube of spectral samples.
 * Values are stored pixel-interleaved: index = (row * width + col) * bands + band.
 * NaN marks a missing sample.
 */
public class HyperspectralCube {
    private final int height;
    private final int width;
    private final int bands;
    private final double[] data;

    public HyperspectralCube(int height, int width, int bands, double[] data) {
        if (height <= 0 || width <= 0 || bands <= 0) {
            throw new ValidationException(
                    "Cube dimensions must be positive, got (" + height + ", " + width + ", " + bands + ")");
        }
        if (data == null || data.length != height * width * bands) {
            throw new ValidationException("Cube data length " + (data == null ? "null" : data.length)
                    + " does not match shape (" + height + ", " + width + ", " + bands + ")");
        }
        this.height = height;
        this.width = width;
        this.bands = bands;
        this.data = Arrays.copyOf(data, data.length);
    }

    /**
     * Builds a cube from a [row][col][band] array. Every row and pixel must have the same length.
     */
    public static HyperspectralCube of(double[][][] values) {
        if (values == null || values.length == 0 || values[0] == null || values[0].length == 0
                || values[0][0] == null || values[0][0].length == 0) {
            throw new ValidationException("Cube must be a non-empty 3D array (height, width, bands)");
        }
        int h = values.length;
        int w = values[0].length;
        int b = values[0][0].length;
        double[] flat = new double[h * w * b];
        int idx = 0;
        for (int r = 0; r < h; r++) {
            if (values[r] == null || values[r].length != w) {
                throw new ValidationException("Row " + r + " does not have width " + w);
            }
            for (int c = 0; c < w; c++) {
                if (values[r][c] == null || values[r][c].length != b) {
                    throw new ValidationException("Pixel (" + r + ", " + c + ") does not have " + b + " bands");
                }
                System.arraycopy(values[r][c], 0, flat, idx, b);
                idx += b;
            }
        }
        return new HyperspectralCube(h, w, b, flat);
    }

    /**
     * Builds a cube from an N x B pixel matrix where N = height * width.
     */
    public static HyperspectralCube fromPixels(int height, int width, double[][] pixels) {
        if (pixels == null || pixels.length != height * width || pixels.length == 0) {
            throw new ValidationException("Pixel matrix must have " + (height * width) + " rows");
        }
        int b = pixels[0].length;
        double[] flat = new double[pixels.length * b];
        for (int p = 0; p < pixels.length; p++) {
            if (pixels[p].length != b) {
                throw new ValidationException("Pixel " + p + " does not have " + b + " bands");
            }
            System.arraycopy(pixels[p], 0, flat, p * b, b);
        }
        return new HyperspectralCube(height, width, b, flat);
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    public int getBands() {
        return bands;
    }

    public int getPixelCount() {
        return height * width;
    }

    public double get(int row, int col, int band) {
        return data[(row * width + col) * bands + band];
    }

    /**
     * Returns a copy of the spectrum at the given flat pixel index (row * width + col).
     */
    public double[] getPixel(int pixelIndex) {
        return Arrays.copyOfRange(data, pixelIndex * bands, (pixelIndex + 1) * bands);
    }

    /**
     * Returns a new N x B matrix holding every pixel spectrum.
     */
    public double[][] toPixelMatrix() {
        int n = getPixelCount();
        double[][] out = new double[n][];
        for (int p = 0; p < n; p++) {
            out[p] = getPixel(p);
        }
        return out;
    }

    public boolean pixelHasNaN(int pixelIndex) {
        int base = pixelIndex * bands;
        for (int b = 0; b < bands; b++) {
            if (Double.isNaN(data[base + b])) {
                return true;
            }
        }
        return false;
    }

    public boolean hasNaN() {
        for (double v : data) {
            if (Double.isNaN(v)) {
                return true;
            }
        }
        return false;
    }

    public HyperspectralCube scale(double factor) {
        double[] scaled = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            scaled[i] = data[i] * factor;
        }
        return new HyperspectralCube(height, width, bands, scaled);
    }

    /**
     * Keeps the first {@code count} bands of every pixel.
     */
    public HyperspectralCube firstBands(int count) {
        if (count < 1 || count > bands) {
            throw new ValidationException("Band count must be in [1, " + bands + "], got " + count);
        }
        int n = getPixelCount();
        double[] out = new double[n * count];
        for (int p = 0; p < n; p++) {
            System.arraycopy(data, p * bands, out, p * count, count);
        }
        return new HyperspectralCube(height, width, count, out);
    }

    /**
     * Returns a [row][col][band] copy of the cube.
     */
    public double[][][] toArray() {
        double[][][] out = new double[height][width][bands];
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                System.arraycopy(data, (r * width + c) * bands, out[r][c], 0, bands);
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return "HyperspectralCube{" + height + "x" + width + "x" + bands + "}";
    }
}
