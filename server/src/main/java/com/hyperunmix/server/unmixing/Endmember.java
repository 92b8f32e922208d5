package com.hyperunmix.server.unmixing;

import java.util.Arrays;

/**
 * A representative spectrum chosen from one cluster of pure pixels, together with the cluster it stands for.
 */
public class Endmember {
    private final double[] spectrum;
    private final int sourcePixel;
    private final int sourcePurity;
    private final int clusterIndex;
    private final int[] memberPixels;
    private final double[][] memberSpectra;

    public Endmember(double[] spectrum, int sourcePixel, int sourcePurity, int clusterIndex, int[] memberPixels,
            double[][] memberSpectra) {
        this.spectrum = Arrays.copyOf(spectrum, spectrum.length);
        this.sourcePixel = sourcePixel;
        this.sourcePurity = sourcePurity;
        this.clusterIndex = clusterIndex;
        this.memberPixels = Arrays.copyOf(memberPixels, memberPixels.length);
        this.memberSpectra = copyOf(memberSpectra);
    }

    public double[] getSpectrum() {
        return Arrays.copyOf(spectrum, spectrum.length);
    }

    // Flat pixel index, row * width + col
    public int getSourcePixel() {
        return sourcePixel;
    }

    public int getSourcePurity() {
        return sourcePurity;
    }

    public int getClusterIndex() {
        return clusterIndex;
    }

    public int[] getMemberPixels() {
        return Arrays.copyOf(memberPixels, memberPixels.length);
    }

    public double[][] getMemberSpectra() {
        return copyOf(memberSpectra);
    }

    public int getMemberCount() {
        return memberPixels.length;
    }

    private static double[][] copyOf(double[][] rows) {
        double[][] copy = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            copy[i] = Arrays.copyOf(rows[i], rows[i].length);
        }
        return copy;
    }
}
