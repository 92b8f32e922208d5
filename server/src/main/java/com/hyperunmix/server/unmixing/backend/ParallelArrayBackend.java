package com.hyperunmix.server.unmixing.backend;

import java.util.stream.IntStream;

/**
 * Splits pixel rows across the common fork-join pool. Each pixel is still computed by one thread in the
 * same order as {@link CpuArrayBackend}, so results are identical.
 */
public class ParallelArrayBackend implements ArrayBackend {

    public static final String NAME = "parallel";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public double[][] multiplyTransposed(double[][] a, double[][] b) {
        double[][] out = new double[a.length][b.length];
        IntStream.range(0, a.length).parallel().forEach(i -> CpuArrayBackend.multiplyRow(a[i], b, out[i]));
        return out;
    }

    @Override
    public void accumulateExtrema(double[][] projections, double thresholdFactor, int[] scores) {
        if (projections.length == 0) {
            return;
        }
        int k = projections[0].length;
        double[] upper = new double[k];
        double[] lower = new double[k];
        boolean[] active = new boolean[k];
        CpuArrayBackend.columnBounds(projections, thresholdFactor, upper, lower, active);

        IntStream.range(0, projections.length).parallel()
                .forEach(p -> scores[p] += CpuArrayBackend.countExtrema(projections[p], upper, lower, active));
    }
}
