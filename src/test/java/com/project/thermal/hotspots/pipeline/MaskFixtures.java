package com.project.thermal.hotspots.pipeline;

/** Builds masks from text rows: {@code #} is foreground. */
final class MaskFixtures {

    private MaskFixtures() {}

    static BinaryMask mask(String... rows) {
        int h = rows.length, w = rows[0].length();
        boolean[] bits = new boolean[h * w];
        for (int r = 0; r < h; r++)
            for (int c = 0; c < w; c++)
                bits[r * w + c] = rows[r].charAt(c) == '#';
        return BinaryMask.of(h, w, bits);
    }

    static BinaryMask block(int rows, int cols, int r0, int c0, int r1, int c1) {
        boolean[] bits = new boolean[rows * cols];
        for (int r = r0; r <= r1; r++)
            for (int c = c0; c <= c1; c++)
                bits[r * cols + c] = true;
        return BinaryMask.of(rows, cols, bits);
    }
}
