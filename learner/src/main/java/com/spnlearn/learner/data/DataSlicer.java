package com.spnlearn.learner.data;

import java.util.List;

/**
 * Carves a sub-slice out of a slice by scope-relative column positions.
 * Implementations must keep the result two-dimensional for one column.
 */
public interface DataSlicer {

    DataSlice slice(DataSlice data, List<Integer> columnPositions);
}
