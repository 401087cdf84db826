package com.spnlearn.learner.structure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of a sum-product network. Every node covers a scope: the original
 * dataset column ids it models.
 */
public abstract class SpnNode {

    // -1 until assigned by StructureOps.assignIds
    private int id = -1;
    private final List<Integer> scope = new ArrayList<>();

    protected SpnNode(List<Integer> scope) {
        if (scope != null) {
            this.scope.addAll(scope);
        }
    }

    public int getId() {
        return id;
    }

    public void setId(int id) {
        this.id = id;
    }

    public List<Integer> getScope() {
        return Collections.unmodifiableList(scope);
    }

    // Leaves return an empty list.
    public abstract List<SpnNode> getChildren();

    public String getName() {
        return getClass().getSimpleName() + "_" + id;
    }

    @Override
    public String toString() {
        return getName() + scope;
    }
}
