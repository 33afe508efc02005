package com.project.thermal.hotspots.pipeline;

/** Row pass then column pass of a normalized 1-D Gaussian kernel, pure array implementation. */
public class SeparableGaussianFilter implements SmoothingFilter {

    @Override
    public Grid smooth(Grid grid, double sigma) {
        DetectionParameters.requireSigma(sigma);
        final int h = grid.rows(), w = grid.cols();
        final double[] kernel = kernel(sigma);
        final int radius = kernel.length / 2;
        final double[] src = grid.data();

        double[] tmp = new double[w * h];
        for (int y = 0; y < h; y++) {
            int row = y * w;
            for (int x = 0; x < w; x++) {
                double acc = 0;
                for (int k = -radius; k <= radius; k++) {
                    acc += kernel[k + radius] * src[row + clamp(x + k, w)];
                }
                tmp[row + x] = acc;
            }
        }

        double[] out = new double[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                double acc = 0;
                for (int k = -radius; k <= radius; k++) {
                    acc += kernel[k + radius] * tmp[clamp(y + k, h) * w + x];
                }
                out[y * w + x] = acc;
            }
        }
        return Grid.wrap(h, w, out);
    }

    /** Weights {@code exp(-x^2 / (2 sigma^2))} over {@code [-r, r]}, normalized to sum 1. */
    static double[] kernel(double sigma) {
        int radius = SmoothingFilter.kernelRadius(sigma);
        double[] k = new double[2 * radius + 1];
        double sum = 0;
        for (int i = -radius; i <= radius; i++) {
            double v = Math.exp(-(i * (double) i) / (2 * sigma * sigma));
            k[i + radius] = v;
            sum += v;
        }
        for (int i = 0; i < k.length; i++) k[i] /= sum;
        return k;
    }

    // nearest edge value outside the grid
    private static int clamp(int i, int n) {
        return (i < 0) ? 0 : Math.min(n - 1, i);
    }
}
