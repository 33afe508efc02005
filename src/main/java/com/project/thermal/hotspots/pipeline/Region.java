package com.project.thermal.hotspots.pipeline;

/**
 * Measurements of one detected hotspot. Temperatures come from the original, unsmoothed grid.
 *
 * @param id      label identifier in the final label map
 * @param areaPx  pixel count
 * @param tMax    peak temperature
 * @param tMean   mean temperature over the region
 * @param tBg     local ring background (median)
 * @param deltaT  {@code tMax - tBg}
 * @param row     row of the peak
 * @param col     column of the peak
 */
public record Region(
        int id,
        int areaPx,
        double tMax,
        double tMean,
        double tBg,
        double deltaT,
        int row,
        int col
) {}
