package com.project.thermal.hotspots.pipeline;

import com.project.thermal.hotspots.exceptions.InvalidInputException;

/**
 * Connected-region labels for a grid: 0 is background, {@code 1..count()} identify regions.
 * Identifiers follow discovery order and carry no meaning across labeling passes.
 */
public final class LabelMap {
    private final int rows;
    private final int cols;
    private final int[] labels;
    private final int count;

    private LabelMap(int rows, int cols, int[] labels, int count) {
        this.rows = rows;
        this.cols = cols;
        this.labels = labels;
        this.count = count;
    }

    public static LabelMap of(int rows, int cols, int[] rowMajor, int count) {
        if (rowMajor == null || rows <= 0 || cols <= 0 || rowMajor.length != rows * cols) {
            throw new InvalidInputException("Label array does not match shape " + rows + "x" + cols);
        }
        for (int v : rowMajor) {
            if (v < 0 || v > count) {
                throw new InvalidInputException("Label " + v + " outside 0.." + count);
            }
        }
        return new LabelMap(rows, cols, rowMajor.clone(), count);
    }

    static LabelMap wrap(int rows, int cols, int[] labels, int count) {
        return new LabelMap(rows, cols, labels, count);
    }

    public int rows() { return rows; }

    public int cols() { return cols; }

    /** Number of distinct regions. */
    public int count() { return count; }

    public int get(int row, int col) {
        return labels[row * cols + col];
    }

    /** Pixel count per label; index 0 holds the background count. */
    public int[] areas() {
        int[] areas = new int[count + 1];
        for (int l : labels) areas[l]++;
        return areas;
    }

    /** Mask of the pixels carrying {@code label}. */
    public BinaryMask regionMask(int label) {
        boolean[] bits = new boolean[labels.length];
        for (int i = 0; i < labels.length; i++) bits[i] = labels[i] == label;
        return BinaryMask.wrap(rows, cols, bits);
    }

    /** Mask of every labeled pixel. */
    public BinaryMask foreground() {
        boolean[] bits = new boolean[labels.length];
        for (int i = 0; i < labels.length; i++) bits[i] = labels[i] != 0;
        return BinaryMask.wrap(rows, cols, bits);
    }

    public int[] toArray() {
        return labels.clone();
    }

    int[] data() {
        return labels;
    }

    @Override
    public String toString() {
        return "LabelMap[" + rows + "x" + cols + ", count=" + count + "]";
    }
}
