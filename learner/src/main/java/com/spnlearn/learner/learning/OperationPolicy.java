package com.spnlearn.learner.learning;

import com.spnlearn.learner.data.DataSlice;

import java.util.List;

/**
 * Chooses the next structural operation for a pending slice.
 */
public interface OperationPolicy {

    /**
     * @param noClusters       row clustering was already tried on this slice and
     *                         found a single cluster
     * @param noIndependencies column splitting was already tried on this slice
     *                         and found a single group
     * @param isFirst          the slice is the one the root is learned from
     */
    OperationDecision nextOperation(DataSlice data, List<Integer> scope, boolean noClusters,
            boolean noIndependencies, boolean isFirst);
}
