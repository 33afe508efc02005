package com.project.thermal.hotspots.pipeline;

import com.project.thermal.hotspots.exceptions.InvalidParameterException;

/**
 * Control parameters of a detection run.
 *
 * @param gaussianSigma      standard deviation of the smoothing kernel, {@code > 0}
 * @param gradientPercentile percentile of the gradient magnitude used as cutoff, in [0, 100]
 * @param minRegionArea      smallest region (pixels) kept after labeling, {@code >= 1}
 * @param ringWidth          width of the background annulus around each region, {@code >= 0}
 */
public record DetectionParameters(
        double gaussianSigma,
        double gradientPercentile,
        int minRegionArea,
        int ringWidth
) {
    public static final double DEFAULT_GAUSSIAN_SIGMA = 1.0;
    public static final double DEFAULT_GRADIENT_PERCENTILE = 97.0;
    public static final int DEFAULT_MIN_REGION_AREA = 50;
    public static final int DEFAULT_RING_WIDTH = 5;

    public static DetectionParameters defaults() {
        return new DetectionParameters(DEFAULT_GAUSSIAN_SIGMA, DEFAULT_GRADIENT_PERCENTILE,
                DEFAULT_MIN_REGION_AREA, DEFAULT_RING_WIDTH);
    }

    public DetectionParameters withMinRegionArea(int area) {
        return new DetectionParameters(gaussianSigma, gradientPercentile, area, ringWidth);
    }

    public DetectionParameters withGradientPercentile(double percentile) {
        return new DetectionParameters(gaussianSigma, percentile, minRegionArea, ringWidth);
    }

    /** Rejects the whole parameter set before any computation starts. */
    public DetectionParameters validate() {
        requireSigma(gaussianSigma);
        requirePercentile(gradientPercentile);
        if (minRegionArea < 1) {
            throw new InvalidParameterException("minRegionArea must be >= 1, got " + minRegionArea);
        }
        requireRadius("ringWidth", ringWidth);
        return this;
    }

    static void requireSigma(double sigma) {
        if (!(sigma > 0) || Double.isInfinite(sigma)) {
            throw new InvalidParameterException("gaussianSigma must be a finite value > 0, got " + sigma);
        }
    }

    static void requirePercentile(double percentile) {
        if (!(percentile >= 0 && percentile <= 100)) {
            throw new InvalidParameterException("Percentile must be within [0, 100], got " + percentile);
        }
    }

    static void requireRadius(String name, int radius) {
        if (radius < 0) {
            throw new InvalidParameterException(name + " must be >= 0, got " + radius);
        }
    }
}
