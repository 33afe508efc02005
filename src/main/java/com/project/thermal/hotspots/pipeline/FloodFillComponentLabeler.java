package com.project.thermal.hotspots.pipeline;

/**
 * Raster-scan labeling: each unlabeled foreground pixel seeds a flood fill driven by an explicit
 * stack, so foreground size never affects call depth. Labels follow row-major discovery order.
 */
public class FloodFillComponentLabeler implements ComponentLabeler {

    @Override
    public LabelMap label(BinaryMask mask) {
        final int w = mask.cols(), h = mask.rows();
        final boolean[] fg = mask.data();
        int[] labels = new int[w * h];
        // every pixel is pushed at most once
        int[] stack = new int[w * h];
        int nextLabel = 1;

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int idx = y * w + x;
                if (!fg[idx] || labels[idx] != 0) continue;
                floodFill(fg, labels, stack, idx, w, h, nextLabel);
                nextLabel++;
            }
        }
        return LabelMap.wrap(h, w, labels, nextLabel - 1);
    }

    private static void floodFill(boolean[] fg, int[] labels, int[] stack, int start, int w, int h, int label) {
        int top = 0;
        stack[top++] = start;
        labels[start] = label;

        while (top > 0) {
            int p = stack[--top];
            int px = p % w, py = p / w;

            if (px > 0) top = visit(fg, labels, stack, top, p - 1, label);
            if (px < w - 1) top = visit(fg, labels, stack, top, p + 1, label);
            if (py > 0) top = visit(fg, labels, stack, top, p - w, label);
            if (py < h - 1) top = visit(fg, labels, stack, top, p + w, label);
        }
    }

    private static int visit(boolean[] fg, int[] labels, int[] stack, int top, int idx, int label) {
        if (fg[idx] && labels[idx] == 0) {
            labels[idx] = label;
            stack[top++] = idx;
        }
        return top;
    }
}
