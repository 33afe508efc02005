package com.project.thermal.hotspots.pipeline;

/**
 * Isotropic Gaussian blur with edge-replicated borders. Implementations reject
 * {@code sigma <= 0} with an {@link com.project.thermal.hotspots.exceptions.InvalidParameterException}.
 */
public interface SmoothingFilter {

    Grid smooth(Grid grid, double sigma);

    /** Kernel half-width for {@code sigma}: {@code ceil(3 * sigma)}, at least 1. */
    static int kernelRadius(double sigma) {
        return Math.max(1, (int) Math.ceil(3 * sigma));
    }
}
