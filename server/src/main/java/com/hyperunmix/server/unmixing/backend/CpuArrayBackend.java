package com.hyperunmix.server.unmixing.backend;

public class CpuArrayBackend implements ArrayBackend {

    public static final String NAME = "cpu";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public double[][] multiplyTransposed(double[][] a, double[][] b) {
        double[][] out = new double[a.length][b.length];
        for (int i = 0; i < a.length; i++) {
            multiplyRow(a[i], b, out[i]);
        }
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
        columnBounds(projections, thresholdFactor, upper, lower, active);

        for (int p = 0; p < projections.length; p++) {
            scores[p] += countExtrema(projections[p], upper, lower, active);
        }
    }

    static void multiplyRow(double[] row, double[][] b, double[] out) {
        for (int j = 0; j < b.length; j++) {
            double[] s = b[j];
            double sum = 0.0;
            for (int c = 0; c < row.length; c++) {
                sum += row[c] * s[c];
            }
            out[j] = sum;
        }
    }

    // upper[j] = max - thr, lower[j] = min + thr; inactive columns have a degenerate range
    static void columnBounds(double[][] projections, double thresholdFactor, double[] upper, double[] lower,
            boolean[] active) {
        int k = upper.length;
        double[] max = new double[k];
        double[] min = new double[k];
        System.arraycopy(projections[0], 0, max, 0, k);
        System.arraycopy(projections[0], 0, min, 0, k);
        for (int p = 1; p < projections.length; p++) {
            double[] row = projections[p];
            for (int j = 0; j < k; j++) {
                double v = row[j];
                if (v > max[j])
                    max[j] = v;
                if (v < min[j])
                    min[j] = v;
            }
        }
        for (int j = 0; j < k; j++) {
            double range = max[j] - min[j];
            double thr = range * thresholdFactor;
            upper[j] = max[j] - thr;
            lower[j] = min[j] + thr;
            active[j] = range > DEGENERATE_RANGE;
        }
    }

    static int countExtrema(double[] row, double[] upper, double[] lower, boolean[] active) {
        int count = 0;
        for (int j = 0; j < row.length; j++) {
            if (!active[j]) {
                continue;
            }
            if (row[j] >= upper[j]) {
                count++;
            }
            if (row[j] <= lower[j]) {
                count++;
            }
        }
        return count;
    }
}
