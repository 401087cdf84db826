package com.spnlearn.learner.leaves;

import com.spnlearn.learner.structure.LeafNode;

import java.util.Arrays;
import java.util.Collections;

/**
 * Univariate piecewise-constant density over equal-width bins. Values outside
 * {@code [lower, lower + bins * binWidth]} have zero density.
 */
public class HistogramLeaf extends LeafNode {

    private final int column;
    private final double lower;
    private final double binWidth;
    // log density per bin
    private final double[] logDensities;

    public HistogramLeaf(int column, double lower, double binWidth, double[] logDensities) {
        super(Collections.singletonList(column));
        if (binWidth <= 0.0 || logDensities.length == 0) {
            throw new IllegalArgumentException("histogram needs a positive bin width and at least one bin");
        }
        this.column = column;
        this.lower = lower;
        this.binWidth = binWidth;
        this.logDensities = logDensities;
    }

    @Override
    public double logDensity(double[] row) {
        double v = row[column];
        int bin = binOf(v);
        if (bin < 0) {
            return Double.NEGATIVE_INFINITY;
        }
        return logDensities[bin];
    }

    int binOf(double v) {
        if (Double.isNaN(v)) {
            return -1;
        }
        double upper = lower + logDensities.length * binWidth;
        if (v < lower || v > upper) {
            return -1;
        }
        int bin = (int) Math.floor((v - lower) / binWidth);
        // the upper edge belongs to the last bin
        return Math.min(bin, logDensities.length - 1);
    }

    public int getColumn() {
        return column;
    }

    public double getLower() {
        return lower;
    }

    public double getBinWidth() {
        return binWidth;
    }

    public int getBins() {
        return logDensities.length;
    }

    public double[] getLogDensities() {
        return Arrays.copyOf(logDensities, logDensities.length);
    }
}
