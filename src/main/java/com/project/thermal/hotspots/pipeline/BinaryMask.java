package com.project.thermal.hotspots.pipeline;

import com.project.thermal.hotspots.exceptions.InvalidInputException;

import java.util.Arrays;

/** Immutable grid-shaped boolean mask, row-major like {@link Grid}. */
public final class BinaryMask {
    private final int rows;
    private final int cols;
    private final boolean[] bits;

    private BinaryMask(int rows, int cols, boolean[] bits) {
        this.rows = rows;
        this.cols = cols;
        this.bits = bits;
    }

    public static BinaryMask of(int rows, int cols, boolean[] rowMajor) {
        if (rows <= 0 || cols <= 0) {
            throw new InvalidInputException("Mask shape must be positive, got " + rows + "x" + cols);
        }
        if (rowMajor == null || rowMajor.length != rows * cols) {
            throw new InvalidInputException("Expected " + (rows * cols) + " mask values, got "
                    + (rowMajor == null ? 0 : rowMajor.length));
        }
        return new BinaryMask(rows, cols, rowMajor.clone());
    }

    public static BinaryMask empty(int rows, int cols) {
        return of(rows, cols, new boolean[Math.max(0, rows * cols)]);
    }

    static BinaryMask wrap(int rows, int cols, boolean[] bits) {
        return new BinaryMask(rows, cols, bits);
    }

    public int rows() { return rows; }

    public int cols() { return cols; }

    public boolean get(int row, int col) {
        return bits[row * cols + col];
    }

    /** Number of foreground pixels. */
    public int count() {
        int n = 0;
        for (boolean b : bits) if (b) n++;
        return n;
    }

    public boolean isEmpty() {
        for (boolean b : bits) if (b) return false;
        return true;
    }

    public boolean sameShape(int otherRows, int otherCols) {
        return rows == otherRows && cols == otherCols;
    }

    public boolean[] toArray() {
        return bits.clone();
    }

    boolean[] data() {
        return bits;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BinaryMask other)) return false;
        return rows == other.rows && cols == other.cols && Arrays.equals(bits, other.bits);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + cols) + Arrays.hashCode(bits);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("BinaryMask[" + rows + "x" + cols + "]");
        if (bits.length <= 400) {
            for (int r = 0; r < rows; r++) {
                sb.append('\n');
                for (int c = 0; c < cols; c++) sb.append(bits[r * cols + c] ? '#' : '.');
            }
        }
        return sb.toString();
    }
}
