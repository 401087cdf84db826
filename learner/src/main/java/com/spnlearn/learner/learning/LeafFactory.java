package com.spnlearn.learner.learning;

import com.spnlearn.learner.data.DataSlice;
import com.spnlearn.learner.data.DatasetContext;
import com.spnlearn.learner.structure.LeafNode;

import java.util.List;

public interface LeafFactory {

    LeafNode createLeaf(DataSlice data, DatasetContext context, List<Integer> scope);
}
