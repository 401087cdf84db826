package com.spnlearn.learner.structure;

import java.util.Collections;
import java.util.List;

/**
 * Terminal distribution over its scope. The structure learner only places
 * leaves; it never looks at what they model.
 */
public abstract class LeafNode extends SpnNode {

    protected LeafNode(List<Integer> scope) {
        super(scope);
    }

    /**
     * Log density of the leaf's scope entries of a full dataset row.
     */
    public abstract double logDensity(double[] row);

    @Override
    public List<SpnNode> getChildren() {
        return Collections.emptyList();
    }
}
