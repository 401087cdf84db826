package com.spnlearn.learner.structure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Compacts a finished tree: inner children with a single child are replaced by
 * that grandchild, and children of the same type as their parent are merged
 * into it. Merged sum weights are scaled by the child's weight in the parent.
 */
public class StructurePruner {

    private static final Logger logger = LoggerFactory.getLogger(StructurePruner.class);

    private final StructureValidator validator;

    public StructurePruner() {
        this(new StructureValidator());
    }

    public StructurePruner(StructureValidator validator) {
        this.validator = validator;
    }

    public SpnNode prune(SpnNode root) {
        ValidationResult before = validator.validate(root, false);
        if (!before.isValid()) {
            throw new InvalidStructureException("cannot prune invalid structure: " + before.getMessage());
        }

        int collapsed = 0;
        int merged = 0;

        List<InnerNode> pending = new ArrayList<>(StructureOps.getNodesByType(root, InnerNode.class));
        while (!pending.isEmpty()) {
            InnerNode node = pending.remove(pending.size() - 1);
            boolean isSum = node instanceof SumNode;

            int i = 0;
            while (i < node.getChildren().size()) {
                SpnNode child = node.getChildren().get(i);

                if (child instanceof InnerNode && child.getChildren().size() == 1) {
                    // weight of the only grandchild is irrelevant, the slot keeps its own weight
                    node.replaceChild(i, child.getChildren().get(0));
                    collapsed++;
                    continue;
                }

                if (child.getClass() == node.getClass()) {
                    node.removeChild(i);
                    for (SpnNode grandChild : child.getChildren()) {
                        node.addChild(grandChild);
                    }
                    if (isSum) {
                        SumNode sum = (SumNode) node;
                        double w = sum.getWeight(i);
                        sum.removeWeight(i);
                        for (double cw : ((SumNode) child).getWeights()) {
                            sum.appendWeight(cw * w);
                        }
                    }
                    merged++;
                    continue;
                }
                i++;
            }
        }

        SpnNode result = root;
        if (result instanceof InnerNode && result.getChildren().size() == 1) {
            result = result.getChildren().get(0);
            collapsed++;
        }

        StructureOps.assignIds(result);
        logger.debug("Pruned structure: collapsed {} single-child nodes, merged {} nested nodes", collapsed, merged);

        ValidationResult after = validator.validate(result);
        if (!after.isValid()) {
            throw new InvalidStructureException("pruning produced an invalid structure: " + after.getMessage());
        }
        return result;
    }
}
