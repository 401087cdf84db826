package com.spnlearn.learner.learning;

import com.spnlearn.learner.data.DataSlice;
import com.spnlearn.learner.structure.InnerNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pending work: learn the sub-model for a slice and place it into one
 * placeholder slot of its parent. The two flags record which splitters have
 * already failed on this slice.
 */
public class LearningTask {
    private final DataSlice data;
    private final InnerNode parent;
    private final int slot;
    private final List<Integer> scope;
    private final boolean noClusters;
    private final boolean noIndependencies;

    public LearningTask(DataSlice data, InnerNode parent, int slot, List<Integer> scope, boolean noClusters,
            boolean noIndependencies) {
        this.data = data;
        this.parent = parent;
        this.slot = slot;
        this.scope = Collections.unmodifiableList(new ArrayList<>(scope));
        this.noClusters = noClusters;
        this.noIndependencies = noIndependencies;
    }

    // Same task after row clustering found a single cluster.
    public LearningTask withNoClusters() {
        return new LearningTask(data, parent, slot, scope, true, noIndependencies);
    }

    // Same task after column splitting found a single group.
    public LearningTask withNoIndependencies() {
        return new LearningTask(data, parent, slot, scope, noClusters, true);
    }

    public DataSlice getData() {
        return data;
    }

    public InnerNode getParent() {
        return parent;
    }

    public int getSlot() {
        return slot;
    }

    public List<Integer> getScope() {
        return scope;
    }

    public boolean isNoClusters() {
        return noClusters;
    }

    public boolean isNoIndependencies() {
        return noIndependencies;
    }

    @Override
    public String toString() {
        return "LearningTask{" + data.shape() + ", parent=" + parent.getName() + ", slot=" + slot + ", scope=" + scope
                + ", noClusters=" + noClusters + ", noIndependencies=" + noIndependencies + '}';
    }
}
