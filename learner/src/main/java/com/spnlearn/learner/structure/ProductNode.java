package com.spnlearn.learner.structure;

import java.util.List;

/**
 * Factorization over children with pairwise disjoint scopes.
 */
public class ProductNode extends InnerNode {

    public ProductNode(List<Integer> scope) {
        super(scope);
    }

    @Override
    public String getName() {
        return "Product_" + getId();
    }
}
