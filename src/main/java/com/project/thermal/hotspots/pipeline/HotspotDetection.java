package com.project.thermal.hotspots.pipeline;

import java.util.List;

/**
 * Output of one pipeline run.
 *
 * @param smoothedGradient gradient magnitude of the smoothed grid
 * @param tau              gradient cutoff chosen by the percentile
 * @param candidates       thresholded mask before morphology
 * @param mask             final mask after morphology and area filtering
 * @param labels           dense labels of {@code mask}
 * @param regions          analyzed regions, hottest first
 */
public record HotspotDetection(
        Grid smoothedGradient,
        double tau,
        BinaryMask candidates,
        BinaryMask mask,
        LabelMap labels,
        List<Region> regions
) {
    public HotspotDetection {
        regions = List.copyOf(regions);
    }

    public boolean hasHotspots() {
        return !regions.isEmpty();
    }
}
