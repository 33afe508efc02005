package com.project.thermal.hotspots.pipeline;

import com.project.thermal.hotspots.exceptions.InvalidInputException;

import java.util.Arrays;

/**
 * Immutable rectangular field of finite real values stored row-major (index = row * cols + col).
 *
 * <p>Used both for temperature grids and for fields derived from them, such as the gradient
 * magnitude. Every pipeline stage returns a new instance and never modifies its input.
 */
public final class Grid {
    private final int rows;
    private final int cols;
    private final double[] values;

    private Grid(int rows, int cols, double[] values) {
        this.rows = rows;
        this.cols = cols;
        this.values = values;
    }

    /** Builds a grid from nested rows, rejecting empty, ragged or non-finite input. */
    public static Grid of(double[][] data) {
        if (data == null || data.length == 0) {
            throw new InvalidInputException("Grid has no rows");
        }
        int cols = data[0] == null ? 0 : data[0].length;
        if (cols == 0) {
            throw new InvalidInputException("Grid has no columns");
        }
        double[] flat = new double[data.length * cols];
        for (int r = 0; r < data.length; r++) {
            if (data[r] == null || data[r].length != cols) {
                throw new InvalidInputException("Grid is not rectangular: row " + r + " has "
                        + (data[r] == null ? 0 : data[r].length) + " values, expected " + cols);
            }
            System.arraycopy(data[r], 0, flat, r * cols, cols);
        }
        return of(data.length, cols, flat);
    }

    /** Builds a grid from a row-major array, which is copied. */
    public static Grid of(int rows, int cols, double[] rowMajor) {
        if (rows <= 0 || cols <= 0) {
            throw new InvalidInputException("Grid shape must be positive, got " + rows + "x" + cols);
        }
        if (rowMajor == null || rowMajor.length != rows * cols) {
            throw new InvalidInputException("Expected " + (rows * cols) + " values for a " + rows + "x" + cols
                    + " grid, got " + (rowMajor == null ? 0 : rowMajor.length));
        }
        for (int i = 0; i < rowMajor.length; i++) {
            if (!Double.isFinite(rowMajor[i])) {
                throw new InvalidInputException("Non-finite value " + rowMajor[i]
                        + " at row " + (i / cols) + ", col " + (i % cols));
            }
        }
        return new Grid(rows, cols, rowMajor.clone());
    }

    public static Grid filled(int rows, int cols, double value) {
        double[] v = new double[Math.max(0, rows * cols)];
        Arrays.fill(v, value);
        return of(rows, cols, v);
    }

    /** Wraps an array produced by a stage; the caller hands over ownership. */
    static Grid wrap(int rows, int cols, double[] values) {
        return new Grid(rows, cols, values);
    }

    public int rows() { return rows; }

    public int cols() { return cols; }

    public int size() { return values.length; }

    public double get(int row, int col) {
        return values[row * cols + col];
    }

    public double min() {
        double m = Double.POSITIVE_INFINITY;
        for (double v : values) m = Math.min(m, v);
        return m;
    }

    public double max() {
        double m = Double.NEGATIVE_INFINITY;
        for (double v : values) m = Math.max(m, v);
        return m;
    }

    public boolean sameShape(int otherRows, int otherCols) {
        return rows == otherRows && cols == otherCols;
    }

    public double[] toArray() {
        return values.clone();
    }

    // no copy; stages must not write through it
    double[] data() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Grid other)) return false;
        return rows == other.rows && cols == other.cols && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + cols) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Grid[" + rows + "x" + cols + "]";
    }
}
