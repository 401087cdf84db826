package com.spnlearn.learner.leaves;

import com.spnlearn.learner.data.DataSlice;
import com.spnlearn.learner.data.DatasetContext;
import com.spnlearn.learner.learning.LeafFactory;
import com.spnlearn.learner.structure.LeafNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Fits {@link HistogramLeaf}s over the column's domain taken from the dataset
 * context, so sibling leaves of the same column share bin edges. Bin
 * probabilities use Laplace smoothing.
 */
public class HistogramLeafFactory implements LeafFactory {

    private static final Logger logger = LoggerFactory.getLogger(HistogramLeafFactory.class);

    private final int bins;
    private final double alpha;

    public HistogramLeafFactory() {
        this(10, 1.0);
    }

    public HistogramLeafFactory(int bins, double alpha) {
        if (bins < 1) {
            throw new IllegalArgumentException("bins must be positive");
        }
        if (alpha < 0.0) {
            throw new IllegalArgumentException("smoothing alpha must not be negative");
        }
        this.bins = bins;
        this.alpha = alpha;
    }

    @Override
    public LeafNode createLeaf(DataSlice data, DatasetContext context, List<Integer> scope) {
        if (scope.size() != 1 || data.numCols() != 1) {
            throw new IllegalArgumentException("histogram leaves are univariate, got scope " + scope + " on slice "
                    + data.shape());
        }
        int column = scope.get(0);
        double[] values = data.column(0);

        double min;
        double max;
        if (column < context.numFeatures()) {
            min = context.getDomainMin(column);
            max = context.getDomainMax(column);
        } else {
            min = Double.POSITIVE_INFINITY;
            max = Double.NEGATIVE_INFINITY;
            for (double v : values) {
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
        }

        int binCount = bins;
        double lower = min;
        double width = (max - min) / bins;
        if (!(width > 0.0)) {
            // constant domain: one unit-wide bin centred on the value
            binCount = 1;
            lower = min - 0.5;
            width = 1.0;
        }

        long[] counts = new long[binCount];
        int total = 0;
        for (double v : values) {
            if (Double.isNaN(v) || v < lower || v > lower + binCount * width) {
                continue;
            }
            int bin = Math.min((int) Math.floor((v - lower) / width), binCount - 1);
            counts[bin]++;
            total++;
        }

        double denom = total + alpha * binCount;
        double[] logDensities = new double[binCount];
        for (int b = 0; b < binCount; b++) {
            double p = denom > 0 ? (counts[b] + alpha) / denom : 1.0 / binCount;
            logDensities[b] = Math.log(p / width);
        }

        logger.trace("Histogram leaf for column {} over [{}, {}] from {} values", column, lower,
                lower + binCount * width, total);
        return new HistogramLeaf(column, lower, width, logDensities);
    }
}
