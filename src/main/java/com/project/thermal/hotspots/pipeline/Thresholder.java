package com.project.thermal.hotspots.pipeline;

/** Selects candidate pixels whose value reaches a percentile of the whole field. */
public class Thresholder {

    /**
     * @param mask pixels with {@code value >= tau}
     * @param tau  the cutoff value
     */
    public record Result(BinaryMask mask, double tau) {}

    public Result threshold(Grid field, double percentile) {
        DetectionParameters.requirePercentile(percentile);
        final double[] v = field.data();
        double tau = Percentiles.percentile(v, percentile);

        boolean[] bits = new boolean[v.length];
        for (int i = 0; i < v.length; i++) {
            bits[i] = v[i] >= tau;
        }
        return new Result(BinaryMask.wrap(field.rows(), field.cols(), bits), tau);
    }

    /** Pixels with {@code value > tau}. */
    public BinaryMask above(Grid field, double tau) {
        final double[] v = field.data();
        boolean[] bits = new boolean[v.length];
        for (int i = 0; i < v.length; i++) {
            bits[i] = v[i] > tau;
        }
        return BinaryMask.wrap(field.rows(), field.cols(), bits);
    }
}
