package com.spnlearn.learner.learning;

import com.spnlearn.learner.data.DataSlice;
import com.spnlearn.learner.data.DatasetContext;

import java.util.List;

/**
 * Partitions the rows of a slice into sub-populations. Must return at least one
 * result; a single result means no structure was found.
 */
public interface RowSplitter {

    List<SplitResult> split(DataSlice data, DatasetContext context, List<Integer> scope);
}
