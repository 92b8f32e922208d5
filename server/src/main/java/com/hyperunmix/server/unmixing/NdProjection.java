package com.hyperunmix.server.unmixing;

import java.util.ArrayList;
import java.util.List;

/**
 * Cluster members and endmembers projected onto the leading principal components of all member spectra.
 */
public class NdProjection {
    private final int components;
    private final List<double[][]> clusterPoints;
    private final List<double[]> endmemberPoints;
    private final double[] variances;

    public NdProjection(int components, List<double[][]> clusterPoints, List<double[]> endmemberPoints,
            double[] variances) {
        this.components = components;
        this.clusterPoints = new ArrayList<>();
        for (double[][] points : clusterPoints) {
            this.clusterPoints.add(copyOf(points));
        }
        this.endmemberPoints = new ArrayList<>();
        for (double[] point : endmemberPoints) {
            this.endmemberPoints.add(point.clone());
        }
        this.variances = variances.clone();
    }

    public int getComponents() {
        return components;
    }

    // One (members x components) array per endmember, same order as the endmember set
    public List<double[][]> getClusterPoints() {
        List<double[][]> copy = new ArrayList<>(clusterPoints.size());
        for (double[][] points : clusterPoints) {
            copy.add(copyOf(points));
        }
        return copy;
    }

    public List<double[]> getEndmemberPoints() {
        List<double[]> copy = new ArrayList<>(endmemberPoints.size());
        for (double[] point : endmemberPoints) {
            copy.add(point.clone());
        }
        return copy;
    }

    // Variance along each kept principal component, descending
    public double[] getVariances() {
        return variances.clone();
    }

    private static double[][] copyOf(double[][] rows) {
        double[][] copy = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            copy[i] = rows[i].clone();
        }
        return copy;
    }
}
