package com.project.thermal.hotspots.pipeline;

/**
 * Discrete gradient magnitude: central differences inside the grid, one-sided differences on the
 * first and last row/column, {@code sqrt(gx^2 + gy^2)} per pixel. A dimension of length 1 has no
 * derivative along it.
 */
public class GradientField {

    public Grid gradient(Grid grid) {
        final int h = grid.rows(), w = grid.cols();
        final double[] t = grid.data();
        double[] mag = new double[w * h];

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                double gx = derivative(t, y * w, 1, x, w);
                double gy = derivative(t, x, w, y, h);
                mag[y * w + x] = Math.sqrt(gx * gx + gy * gy);
            }
        }
        return Grid.wrap(h, w, mag);
    }

    /** Derivative along one axis at position {@code i} of a line starting at {@code base}. */
    private static double derivative(double[] t, int base, int stride, int i, int n) {
        if (n < 2) {
            return 0.0;
        }
        if (i == 0) {
            return t[base + stride] - t[base];
        }
        if (i == n - 1) {
            return t[base + i * stride] - t[base + (i - 1) * stride];
        }
        return (t[base + (i + 1) * stride] - t[base + (i - 1) * stride]) / 2.0;
    }
}
