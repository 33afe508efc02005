package com.project.thermal.hotspots.pipeline;

import com.project.thermal.hotspots.exceptions.InvalidParameterException;

/**
 * Drops labeled regions smaller than a minimum area. The returned mask is meant to be labeled
 * again so that surviving regions get dense identifiers.
 */
public class RegionFilter {

    public BinaryMask filter(LabelMap labels, int minArea) {
        if (minArea < 1) {
            throw new InvalidParameterException("minRegionArea must be >= 1, got " + minArea);
        }
        int[] areas = labels.areas();
        boolean[] keepLabel = new boolean[areas.length];
        for (int l = 1; l < areas.length; l++) {
            keepLabel[l] = areas[l] >= minArea;
        }

        int[] lab = labels.data();
        boolean[] out = new boolean[lab.length];
        for (int i = 0; i < lab.length; i++) {
            out[i] = lab[i] != 0 && keepLabel[lab[i]];
        }
        return BinaryMask.wrap(labels.rows(), labels.cols(), out);
    }
}
