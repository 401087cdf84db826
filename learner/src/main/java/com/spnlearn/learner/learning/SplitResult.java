package com.spnlearn.learner.learning;

import com.spnlearn.learner.data.DataSlice;

import java.util.List;

/**
 * One part produced by a row or column splitter.
 */
public class SplitResult {
    private final DataSlice slice;
    private final List<Integer> scope;
    // mixture proportion for row splits; column splitters may put anything here
    private final double proportion;

    public SplitResult(DataSlice slice, List<Integer> scope, double proportion) {
        this.slice = slice;
        this.scope = scope;
        this.proportion = proportion;
    }

    public DataSlice getSlice() {
        return slice;
    }

    public List<Integer> getScope() {
        return scope;
    }

    public double getProportion() {
        return proportion;
    }

    @Override
    public String toString() {
        return "SplitResult{" + (slice != null ? slice.shape() : "null") + ", scope=" + scope + ", proportion="
                + proportion + '}';
    }
}
