package com.spnlearn.learner.structure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Weighted mixture over children that share this node's scope. Weight i belongs
 * to child i; weights are stored as given and not normalized here.
 */
public class SumNode extends InnerNode {

    private final List<Double> weights = new ArrayList<>();

    public SumNode(List<Integer> scope) {
        super(scope);
    }

    /**
     * Reserves a child slot together with its mixture weight.
     */
    public int addPlaceholder(double weight) {
        int slot = addPlaceholder();
        weights.add(weight);
        return slot;
    }

    public void addChild(SpnNode child, double weight) {
        setChild(addPlaceholder(weight), child);
    }

    public List<Double> getWeights() {
        return Collections.unmodifiableList(weights);
    }

    public double getWeight(int slot) {
        return weights.get(slot);
    }

    void removeWeight(int slot) {
        weights.remove(slot);
    }

    void appendWeight(double weight) {
        weights.add(weight);
    }

    @Override
    public String getName() {
        return "Sum_" + getId();
    }
}
