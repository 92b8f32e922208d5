package com.hyperunmix.server.unmixing;

import com.hyperunmix.server.unmixing.error.NumericalException;
import com.hyperunmix.server.unmixing.error.ValidationException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.correlation.Covariance;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Prepares the n-dimensional endmember view: PCA over every cluster member spectrum.
 */
public class EndmemberVisualizer {

    public static final int DEFAULT_COMPONENTS = 3;

    public NdProjection project(EndmemberSet endmembers, int numComponents) {
        if (endmembers == null || endmembers.size() == 0) {
            throw new ValidationException("Endmembers must be extracted before visualization");
        }
        int bands = endmembers.getBands();
        if (numComponents < 1 || numComponents > bands) {
            throw new ValidationException("Component count must be in [1, " + bands + "], got " + numComponents);
        }

        List<double[]> stacked = new ArrayList<>();
        for (Endmember em : endmembers.getEndmembers()) {
            stacked.addAll(Arrays.asList(em.getMemberSpectra()));
        }
        if (stacked.size() < 2) {
            throw new ValidationException("At least 2 cluster members are needed for a projection");
        }
        double[][] data = stacked.toArray(new double[0][]);

        double[] mean = new double[bands];
        for (double[] row : data) {
            for (int b = 0; b < bands; b++) {
                mean[b] += row[b] / data.length;
            }
        }

        RealMatrix basis;
        double[] variances = new double[numComponents];
        try {
            EigenDecomposition eig = new EigenDecomposition(new Covariance(data).getCovarianceMatrix());
            double[] values = eig.getRealEigenvalues();
            Integer[] order = new Integer[values.length];
            for (int i = 0; i < order.length; i++) {
                order[i] = i;
            }
            Arrays.sort(order, Comparator.comparingDouble((Integer i) -> values[i]).reversed());
            basis = eig.getV().copy();
            RealMatrix leading = MatrixUtils.createRealMatrix(bands, numComponents);
            for (int k = 0; k < numComponents; k++) {
                leading.setColumnVector(k, basis.getColumnVector(order[k]));
                variances[k] = values[order[k]];
            }
            basis = leading;
        } catch (MathIllegalStateException e) {
            throw new NumericalException("PCA of the cluster members failed", e);
        }

        List<double[][]> clusterPoints = new ArrayList<>();
        List<double[]> endmemberPoints = new ArrayList<>();
        for (Endmember em : endmembers.getEndmembers()) {
            double[][] members = em.getMemberSpectra();
            double[][] projected = new double[members.length][];
            for (int m = 0; m < members.length; m++) {
                projected[m] = projectOne(members[m], mean, basis);
            }
            clusterPoints.add(projected);
            endmemberPoints.add(projectOne(em.getSpectrum(), mean, basis));
        }
        return new NdProjection(numComponents, clusterPoints, endmemberPoints, variances);
    }

    private static double[] projectOne(double[] spectrum, double[] mean, RealMatrix basis) {
        double[] centered = new double[spectrum.length];
        for (int b = 0; b < spectrum.length; b++) {
            centered[b] = spectrum[b] - mean[b];
        }
        return basis.preMultiply(centered);
    }
}
