package com.spnlearn.learner.learning;

import com.spnlearn.learner.data.DataSlice;
import com.spnlearn.learner.data.DatasetContext;

import java.util.List;

/**
 * Partitions the columns of a slice into mutually independent groups. Each
 * result's scope must be a subset of the incoming scope. A single result means
 * no independence was found.
 */
public interface ColumnSplitter {

    List<SplitResult> split(DataSlice data, DatasetContext context, List<Integer> scope);
}
