package com.spnlearn.learner.structure;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks for a finished sum-product network.
 */
public class StructureValidator {

    public ValidationResult validate(SpnNode root) {
        return validate(root, true);
    }

    /**
     * @param checkIds also require ids to be assigned and unique
     */
    public ValidationResult validate(SpnNode root, boolean checkIds) {
        if (root == null) {
            return ValidationResult.invalid("root is null");
        }

        Set<Integer> seenIds = new HashSet<>();
        for (SpnNode node : StructureOps.getNodes(root)) {
            if (checkIds) {
                if (node.getId() < 0) {
                    return ValidationResult.invalid(node.getName() + " has no id assigned");
                }
                if (!seenIds.add(node.getId())) {
                    return ValidationResult.invalid("duplicate node id " + node.getId());
                }
            }
            if (node.getScope().isEmpty()) {
                return ValidationResult.invalid(node.getName() + " has an empty scope");
            }
            if (node instanceof LeafNode) {
                continue;
            }

            List<SpnNode> children = node.getChildren();
            if (children.isEmpty()) {
                return ValidationResult.invalid(node.getName() + " has no children");
            }
            for (int i = 0; i < children.size(); i++) {
                if (children.get(i) == null) {
                    return ValidationResult.invalid(node.getName() + " has an unfilled placeholder at slot " + i);
                }
            }

            String error = null;
            if (node instanceof SumNode) {
                error = checkSum((SumNode) node);
            } else if (node instanceof ProductNode) {
                error = checkProduct((ProductNode) node);
            }
            if (error != null) {
                return ValidationResult.invalid(error);
            }
        }
        return ValidationResult.ok();
    }

    private String checkSum(SumNode node) {
        List<Double> weights = node.getWeights();
        if (weights.size() != node.getChildren().size()) {
            return node.getName() + " has " + weights.size() + " weights for " + node.getChildren().size()
                    + " children";
        }
        for (double w : weights) {
            if (Double.isNaN(w) || Double.isInfinite(w) || w < 0.0) {
                return node.getName() + " has invalid weight " + w;
            }
        }
        // completeness: every child covers exactly the sum's scope
        Set<Integer> scope = new HashSet<>(node.getScope());
        for (SpnNode child : node.getChildren()) {
            if (!scope.equals(new HashSet<>(child.getScope()))) {
                return node.getName() + " is incomplete: child " + child.getName() + " has scope "
                        + child.getScope() + " instead of " + node.getScope();
            }
        }
        return null;
    }

    private String checkProduct(ProductNode node) {
        // consistency: children partition the product's scope
        Set<Integer> covered = new HashSet<>();
        for (SpnNode child : node.getChildren()) {
            for (Integer s : child.getScope()) {
                if (!covered.add(s)) {
                    return node.getName() + " is inconsistent: column " + s + " appears in more than one child";
                }
            }
        }
        if (!covered.equals(new HashSet<>(node.getScope()))) {
            return node.getName() + " is inconsistent: children cover " + covered + " instead of "
                    + node.getScope();
        }
        return null;
    }
}
