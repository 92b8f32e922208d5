package com.hyperunmix.server.unmixing;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Output of {@link EndmemberExtractor}, ordered by cluster index.
 */
public class EndmemberSet {
    private final List<Endmember> endmembers;
    private final int[] clusterAssignments;
    private final int height;
    private final int width;
    private final double purityThreshold;

    public EndmemberSet(List<Endmember> endmembers, int[] clusterAssignments, int height, int width,
            double purityThreshold) {
        this.endmembers = Collections.unmodifiableList(new ArrayList<>(endmembers));
        this.clusterAssignments = Arrays.copyOf(clusterAssignments, clusterAssignments.length);
        this.height = height;
        this.width = width;
        this.purityThreshold = purityThreshold;
    }

    public List<Endmember> getEndmembers() {
        return endmembers;
    }

    public int size() {
        return endmembers.size();
    }

    public int getBands() {
        return endmembers.isEmpty() ? 0 : endmembers.get(0).getSpectrum().length;
    }

    /**
     * The endmember matrix, one spectrum per row.
     */
    public double[][] getSpectra() {
        double[][] out = new double[endmembers.size()][];
        for (int i = 0; i < out.length; i++) {
            out[i] = endmembers.get(i).getSpectrum();
        }
        return out;
    }

    public int[] getSourceIndices() {
        int[] out = new int[endmembers.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = endmembers.get(i).getSourcePixel();
        }
        return out;
    }

    /**
     * Per pixel, the position of its endmember in this set, or -1 when the pixel was not selected as pure.
     */
    public int[] getClusterAssignments() {
        return Arrays.copyOf(clusterAssignments, clusterAssignments.length);
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    public double getPurityThreshold() {
        return purityThreshold;
    }
}
