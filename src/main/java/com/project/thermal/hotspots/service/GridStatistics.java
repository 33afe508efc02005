package com.project.thermal.hotspots.service;

import com.project.thermal.hotspots.pipeline.Grid;
import com.project.thermal.hotspots.pipeline.Percentiles;
import org.springframework.stereotype.Component;

import java.util.Locale;

/** Descriptive statistics of a grid, plus the clipping range used when rendering it. */
@Component
public class GridStatistics {

    public record Summary(
            int rows,
            int cols,
            double min,
            double max,
            double mean,
            double std,
            double p1,
            double p5,
            double p50,
            double p95,
            double p99,
            double clipLow,
            double clipHigh
    ) {
        /** One line per statistic, in the units of the grid. */
        public String describe(String unit) {
            return String.format(Locale.ROOT,
                    "Array shape: %d x %d%n"
                            + "min=%.3f %s, max=%.3f %s%n"
                            + "mean=%.3f %s, std=%.3f %s%n"
                            + "Percentiles: p1=%.3f, p5=%.3f, p50=%.3f, p95=%.3f, p99=%.3f%n"
                            + "Suggested clipping range: [%.3f, %.3f] %s",
                    rows, cols, min, unit, max, unit, mean, unit, std, unit,
                    p1, p5, p50, p95, p99, clipLow, clipHigh, unit);
        }
    }

    public Summary describe(Grid grid, double clipLo, double clipHi) {
        double[] v = grid.toArray();
        double sum = 0;
        for (double x : v) sum += x;
        double mean = sum / v.length;
        double sq = 0;
        for (double x : v) sq += (x - mean) * (x - mean);
        // population standard deviation
        double std = Math.sqrt(sq / v.length);

        double[] p = Percentiles.percentiles(v, 1, 5, 50, 95, 99, clipLo, clipHi);
        return new Summary(grid.rows(), grid.cols(), grid.min(), grid.max(), mean, std,
                p[0], p[1], p[2], p[3], p[4], p[5], p[6]);
    }
}
