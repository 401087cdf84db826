package com.spnlearn.learner.data;

import java.util.Arrays;
import java.util.List;

/**
 * Read-only view over a row-major dataset, restricted to a subset of rows and
 * columns. Selecting rows or columns never copies the underlying values.
 */
public class DataSlice {

    private final double[][] data;
    private final int[] rows;
    private final int[] cols;

    private DataSlice(double[][] data, int[] rows, int[] cols) {
        this.data = data;
        this.rows = rows;
        this.cols = cols;
    }

    /**
     * Wraps a full dataset. Every row must have the same number of columns.
     */
    public static DataSlice of(double[][] data) {
        if (data == null || data.length == 0) {
            throw new IllegalArgumentException("dataset must have at least one row");
        }
        int width = data[0].length;
        for (int r = 0; r < data.length; r++) {
            if (data[r] == null || data[r].length != width) {
                throw new IllegalArgumentException("row " + r + " does not have " + width + " columns");
            }
        }
        int[] rows = new int[data.length];
        for (int r = 0; r < rows.length; r++) {
            rows[r] = r;
        }
        int[] cols = new int[width];
        for (int c = 0; c < cols.length; c++) {
            cols[c] = c;
        }
        return new DataSlice(data, rows, cols);
    }

    public int numRows() {
        return rows.length;
    }

    public int numCols() {
        return cols.length;
    }

    public double get(int row, int col) {
        return data[rows[row]][cols[col]];
    }

    // Copy of one column of this slice.
    public double[] column(int col) {
        double[] values = new double[rows.length];
        int source = cols[col];
        for (int r = 0; r < rows.length; r++) {
            values[r] = data[rows[r]][source];
        }
        return values;
    }

    // Copy of one row of this slice, restricted to the slice's columns.
    public double[] row(int row) {
        double[] values = new double[cols.length];
        double[] source = data[rows[row]];
        for (int c = 0; c < cols.length; c++) {
            values[c] = source[cols[c]];
        }
        return values;
    }

    /**
     * Returns a slice holding only the given columns, addressed by position in
     * this slice. The result stays two-dimensional for a single column.
     */
    public DataSlice selectColumns(List<Integer> positions) {
        int[] selected = new int[positions.size()];
        for (int i = 0; i < selected.length; i++) {
            int p = positions.get(i);
            if (p < 0 || p >= cols.length) {
                throw new IndexOutOfBoundsException("column position " + p + " outside slice of width " + cols.length);
            }
            selected[i] = cols[p];
        }
        return new DataSlice(data, rows, selected);
    }

    /**
     * Returns a slice holding only the given rows, addressed by position in this
     * slice.
     */
    public DataSlice selectRows(int[] positions) {
        int[] selected = new int[positions.length];
        for (int i = 0; i < positions.length; i++) {
            int p = positions[i];
            if (p < 0 || p >= rows.length) {
                throw new IndexOutOfBoundsException("row position " + p + " outside slice of height " + rows.length);
            }
            selected[i] = rows[p];
        }
        return new DataSlice(data, selected, cols);
    }

    // Index of each slice column in the original dataset.
    public int[] sourceColumns() {
        return Arrays.copyOf(cols, cols.length);
    }

    public String shape() {
        return rows.length + "x" + cols.length;
    }

    @Override
    public String toString() {
        return "DataSlice{" + shape() + "}";
    }
}
