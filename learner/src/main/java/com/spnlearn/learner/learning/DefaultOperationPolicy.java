package com.spnlearn.learner.learning;

import com.spnlearn.learner.data.DataSlice;

import java.util.ArrayList;
import java.util.List;

/**
 * Rule-ordered policy: the first matching rule wins.
 * <ol>
 * <li>single column: leaf, unless univariate clustering is allowed and the
 * slice is still large and unclustered</li>
 * <li>zero-variance columns: factorize all, or factor out the constant ones</li>
 * <li>few rows, or both splitters already failed: naive factorization</li>
 * <li>column split failed: split rows</li>
 * <li>row split failed: split columns</li>
 * <li>first slice: the configured opening move</li>
 * <li>otherwise split columns</li>
 * </ol>
 */
public class DefaultOperationPolicy implements OperationPolicy {

    public static final int DEFAULT_MIN_INSTANCES_SLICE = 100;

    private final int minInstancesSlice;
    private final boolean clusterFirst;
    private final boolean clusterUnivariate;

    public DefaultOperationPolicy() {
        this(DEFAULT_MIN_INSTANCES_SLICE, true, false);
    }

    public DefaultOperationPolicy(int minInstancesSlice) {
        this(minInstancesSlice, true, false);
    }

    public DefaultOperationPolicy(int minInstancesSlice, boolean clusterFirst, boolean clusterUnivariate) {
        if (minInstancesSlice < 0) {
            throw new IllegalArgumentException("minInstancesSlice must not be negative");
        }
        this.minInstancesSlice = minInstancesSlice;
        this.clusterFirst = clusterFirst;
        this.clusterUnivariate = clusterUnivariate;
    }

    public int getMinInstancesSlice() {
        return minInstancesSlice;
    }

    public boolean isClusterFirst() {
        return clusterFirst;
    }

    public boolean isClusterUnivariate() {
        return clusterUnivariate;
    }

    @Override
    public OperationDecision nextOperation(DataSlice data, List<Integer> scope, boolean noClusters,
            boolean noIndependencies, boolean isFirst) {
        return decide(data, scope, noClusters, noIndependencies, isFirst, clusterFirst, clusterUnivariate);
    }

    public OperationDecision decide(DataSlice data, List<Integer> scope, boolean noClusters,
            boolean noIndependencies, boolean isFirst, boolean clusterFirst, boolean clusterUnivariate) {
        boolean minimalFeatures = scope.size() == 1;
        boolean minimalInstances = data.numRows() <= minInstancesSlice;

        if (minimalFeatures) {
            if (minimalInstances || noClusters) {
                return OperationDecision.of(Operation.CREATE_LEAF);
            }
            return clusterUnivariate ? OperationDecision.of(Operation.SPLIT_ROWS)
                    : OperationDecision.of(Operation.CREATE_LEAF);
        }

        List<Integer> zeroVariance = zeroVarianceColumns(data, scope.size());
        if (!zeroVariance.isEmpty()) {
            if (zeroVariance.size() == data.numCols()) {
                return OperationDecision.of(Operation.NAIVE_FACTORIZATION);
            }
            return OperationDecision.removeUninformative(zeroVariance);
        }

        if (minimalInstances || (noClusters && noIndependencies)) {
            return OperationDecision.of(Operation.NAIVE_FACTORIZATION);
        }

        if (noIndependencies) {
            return OperationDecision.of(Operation.SPLIT_ROWS);
        }

        if (noClusters) {
            return OperationDecision.of(Operation.SPLIT_COLUMNS);
        }

        if (isFirst) {
            return clusterFirst ? OperationDecision.of(Operation.SPLIT_ROWS)
                    : OperationDecision.of(Operation.SPLIT_COLUMNS);
        }

        return OperationDecision.of(Operation.SPLIT_COLUMNS);
    }

    /**
     * Ascending positions, among the first {@code width} columns, of the columns
     * holding a single repeated value.
     */
    static List<Integer> zeroVarianceColumns(DataSlice data, int width) {
        List<Integer> positions = new ArrayList<>();
        int rows = data.numRows();
        for (int c = 0; c < width; c++) {
            boolean constant = true;
            if (rows > 0) {
                double first = data.get(0, c);
                for (int r = 1; r < rows; r++) {
                    if (data.get(r, c) != first) {
                        constant = false;
                        break;
                    }
                }
            }
            if (constant) {
                positions.add(c);
            }
        }
        return positions;
    }

    @Override
    public String toString() {
        return "DefaultOperationPolicy{minInstancesSlice=" + minInstancesSlice + ", clusterFirst=" + clusterFirst
                + ", clusterUnivariate=" + clusterUnivariate + '}';
    }
}
