package com.project.thermal.hotspots.pipeline;

/**
 * Binary morphology with disk structuring elements (offsets with {@code dx^2 + dy^2 <= r^2}).
 * Pixels outside the grid count as background for both dilation and erosion.
 *
 * <p>Two implementations exist, {@link ArrayMorphologyEngine} and {@link OpenCvMorphologyEngine}.
 * One of them is chosen per deployment and injected into the pipeline.
 */
public interface MorphologyEngine {

    int CLOSING_RADIUS = 2;
    int DILATION_RADIUS = 1;

    /** Dilation by a disk of {@code radius}; radius 0 returns the mask unchanged. */
    BinaryMask dilate(BinaryMask mask, int radius);

    /** Erosion by a disk of {@code radius}; radius 0 returns the mask unchanged. */
    BinaryMask erode(BinaryMask mask, int radius);

    /** Sets every background pixel that cannot reach the border through 4-connected background. */
    BinaryMask fillHoles(BinaryMask mask);

    default BinaryMask close(BinaryMask mask, int radius) {
        return erode(dilate(mask, radius), radius);
    }

    /**
     * Turns the edge signature of a hot region into a solid body: closing (r=2), dilation (r=1),
     * then hole filling.
     */
    default BinaryMask refine(BinaryMask mask) {
        BinaryMask closed = close(mask, CLOSING_RADIUS);
        BinaryMask dilated = dilate(closed, DILATION_RADIUS);
        return fillHoles(dilated);
    }

    /** Offsets of a disk as {@code {dy, dx}} pairs. */
    static int[][] disk(int radius) {
        DetectionParameters.requireRadius("radius", radius);
        int n = 0;
        for (int dy = -radius; dy <= radius; dy++)
            for (int dx = -radius; dx <= radius; dx++)
                if (dx * dx + dy * dy <= radius * radius) n++;
        int[][] offsets = new int[n][];
        int i = 0;
        for (int dy = -radius; dy <= radius; dy++)
            for (int dx = -radius; dx <= radius; dx++)
                if (dx * dx + dy * dy <= radius * radius) offsets[i++] = new int[]{dy, dx};
        return offsets;
    }
}
