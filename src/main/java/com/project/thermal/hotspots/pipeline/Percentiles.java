package com.project.thermal.hotspots.pipeline;

import java.util.Arrays;

/**
 * Order statistics with linear interpolation between closest ranks:
 * {@code rank = p / 100 * (n - 1)}.
 */
public final class Percentiles {

    private Percentiles() {}

    public static double percentile(double[] values, double p) {
        DetectionParameters.requirePercentile(p);
        if (values.length == 0) {
            return Double.NaN;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        return ofSorted(sorted, p);
    }

    /** Several percentiles of the same data with a single sort. */
    public static double[] percentiles(double[] values, double... ps) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double[] out = new double[ps.length];
        for (int i = 0; i < ps.length; i++) {
            DetectionParameters.requirePercentile(ps[i]);
            out[i] = sorted.length == 0 ? Double.NaN : ofSorted(sorted, ps[i]);
        }
        return out;
    }

    public static double median(double[] values) {
        return percentile(values, 50.0);
    }

    static double ofSorted(double[] sorted, double p) {
        double rank = p / 100.0 * (sorted.length - 1);
        int lo = (int) Math.floor(rank);
        int hi = (int) Math.ceil(rank);
        if (lo == hi) {
            return sorted[lo];
        }
        return sorted[lo] + (sorted[hi] - sorted[lo]) * (rank - lo);
    }
}
