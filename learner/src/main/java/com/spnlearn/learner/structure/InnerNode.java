package com.spnlearn.learner.structure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base for Sum and Product nodes. Children are held in index-addressed slots so
 * a tree can be grown out of order: a slot is reserved with
 * {@link #addPlaceholder()} and filled exactly once with {@link #setChild}.
 * A {@code null} entry is an unfilled placeholder.
 */
public abstract class InnerNode extends SpnNode {

    private final List<SpnNode> children = new ArrayList<>();

    protected InnerNode(List<Integer> scope) {
        super(scope);
    }

    /**
     * Reserves a new empty child slot and returns its index.
     */
    public int addPlaceholder() {
        children.add(null);
        return children.size() - 1;
    }

    public void setChild(int slot, SpnNode child) {
        if (slot < 0 || slot >= children.size()) {
            throw new IllegalStateException(getName() + " has no child slot " + slot);
        }
        if (child == null) {
            throw new IllegalStateException("cannot fill slot " + slot + " of " + getName() + " with null");
        }
        if (children.get(slot) != null) {
            throw new IllegalStateException("slot " + slot + " of " + getName() + " is already filled");
        }
        children.set(slot, child);
    }

    public void addChild(SpnNode child) {
        setChild(addPlaceholder(), child);
    }

    public int countPlaceholders() {
        int n = 0;
        for (SpnNode c : children) {
            if (c == null)
                n++;
        }
        return n;
    }

    @Override
    public List<SpnNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    // Used by the pruner to rewire finished trees.
    void replaceChild(int slot, SpnNode child) {
        children.set(slot, child);
    }

    void removeChild(int slot) {
        children.remove(slot);
    }
}
