package com.project.thermal.hotspots.pipeline;

import java.util.ArrayDeque;
import java.util.Arrays;

/** Exact disk morphology on plain boolean arrays. */
public class ArrayMorphologyEngine implements MorphologyEngine {

    private static final int[][] DIRS = {{0, -1}, {0, 1}, {-1, 0}, {1, 0}};

    @Override
    public BinaryMask dilate(BinaryMask mask, int radius) {
        DetectionParameters.requireRadius("radius", radius);
        if (radius == 0) return mask;
        int[][] se = MorphologyEngine.disk(radius);
        final int w = mask.cols(), h = mask.rows();
        final boolean[] src = mask.data();
        boolean[] dst = new boolean[w * h];

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if (!src[y * w + x]) continue;
                for (int[] o : se) {
                    int yy = y + o[0], xx = x + o[1];
                    if (yy >= 0 && yy < h && xx >= 0 && xx < w) {
                        dst[yy * w + xx] = true;
                    }
                }
            }
        }
        return BinaryMask.wrap(h, w, dst);
    }

    @Override
    public BinaryMask erode(BinaryMask mask, int radius) {
        DetectionParameters.requireRadius("radius", radius);
        if (radius == 0) return mask;
        int[][] se = MorphologyEngine.disk(radius);
        final int w = mask.cols(), h = mask.rows();
        final boolean[] src = mask.data();
        boolean[] dst = new boolean[w * h];

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if (!src[y * w + x]) continue;

                boolean keep = true;
                for (int i = 0; i < se.length && keep; i++) {
                    int yy = y + se[i][0], xx = x + se[i][1];
                    if (yy < 0 || yy >= h || xx < 0 || xx >= w || !src[yy * w + xx]) {
                        keep = false;
                    }
                }
                dst[y * w + x] = keep;
            }
        }
        return BinaryMask.wrap(h, w, dst);
    }

    @Override
    public BinaryMask fillHoles(BinaryMask mask) {
        final int w = mask.cols(), h = mask.rows(), n = w * h;
        final boolean[] src = mask.data();
        boolean[] outside = new boolean[n];
        ArrayDeque<Integer> q = new ArrayDeque<>();

        for (int x = 0; x < w; x++) {
            seed(src, outside, q, x);
            seed(src, outside, q, (h - 1) * w + x);
        }
        for (int y = 1; y < h - 1; y++) {
            seed(src, outside, q, y * w);
            seed(src, outside, q, y * w + (w - 1));
        }

        while (!q.isEmpty()) {
            int idx = q.removeFirst();
            int x = idx % w, y = idx / w;
            for (int[] dir : DIRS) {
                int nx = x + dir[0];
                int ny = y + dir[1];
                if (nx >= 0 && nx < w && ny >= 0 && ny < h) {
                    int nIdx = ny * w + nx;
                    if (!src[nIdx] && !outside[nIdx]) {
                        outside[nIdx] = true;
                        q.add(nIdx);
                    }
                }
            }
        }

        boolean[] out = Arrays.copyOf(src, n);
        for (int i = 0; i < n; i++) {
            if (!src[i] && !outside[i]) out[i] = true;
        }
        return BinaryMask.wrap(h, w, out);
    }

    private static void seed(boolean[] src, boolean[] outside, ArrayDeque<Integer> q, int idx) {
        if (!src[idx] && !outside[idx]) {
            outside[idx] = true;
            q.add(idx);
        }
    }
}
