package com.project.thermal.hotspots.DTOs;

import com.project.thermal.hotspots.pipeline.Region;
import com.project.thermal.hotspots.service.GridStatistics;

import java.util.List;

public record HotspotReport(
        int rows,
        int cols,
        String encoding,
        GridStatistics.Summary temperatureStats,
        GridStatistics.Summary gradientStats,   // raw, unsmoothed gradient
        double tau,
        int candidatePixels,
        List<Region> regions,                   // hottest first
        byte[] thermalPng,                      // jet palette, top 3 outlined
        byte[] thermalInfernoPng,
        byte[] histogramPng,
        byte[] gradientMapPng,                  // raw gradient
        byte[] gradientPng,                     // smoothed gradient with candidate contour
        byte[] maskPng,
        byte[] topRegionsPng,
        byte[] csv
) {
    public boolean hasHotspots() {
        return !regions.isEmpty();
    }

    public List<Region> top(int n) {
        return regions.subList(0, Math.min(n, regions.size()));
    }
}
