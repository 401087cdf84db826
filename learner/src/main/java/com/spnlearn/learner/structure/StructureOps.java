package com.spnlearn.learner.structure;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Traversals over finished or partially built trees. Unfilled placeholders are
 * skipped.
 */
public class StructureOps {

    private StructureOps() {
    }

    /**
     * Numbers every node 0..n-1 in breadth-first order.
     */
    public static void assignIds(SpnNode root) {
        int next = 0;
        for (SpnNode node : getNodes(root)) {
            node.setId(next++);
        }
    }

    // Breadth-first listing starting at root.
    public static List<SpnNode> getNodes(SpnNode root) {
        List<SpnNode> result = new ArrayList<>();
        Deque<SpnNode> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            SpnNode node = queue.poll();
            result.add(node);
            for (SpnNode child : node.getChildren()) {
                if (child != null) {
                    queue.add(child);
                }
            }
        }
        return result;
    }

    public static <T extends SpnNode> List<T> getNodesByType(SpnNode root, Class<T> type) {
        List<T> result = new ArrayList<>();
        for (SpnNode node : getNodes(root)) {
            if (type.isInstance(node)) {
                result.add(type.cast(node));
            }
        }
        return result;
    }

    public static int depth(SpnNode root) {
        int best = 0;
        for (SpnNode child : root.getChildren()) {
            if (child != null) {
                best = Math.max(best, depth(child));
            }
        }
        return best + 1;
    }

    public static StructureStats getStats(SpnNode root) {
        int sums = 0;
        int products = 0;
        int leaves = 0;
        int edges = 0;
        List<SpnNode> nodes = getNodes(root);
        for (SpnNode node : nodes) {
            if (node instanceof SumNode) {
                sums++;
            } else if (node instanceof ProductNode) {
                products++;
            } else if (node instanceof LeafNode) {
                leaves++;
            }
            for (SpnNode child : node.getChildren()) {
                if (child != null)
                    edges++;
            }
        }
        return new StructureStats(nodes.size(), sums, products, leaves, edges, depth(root));
    }
}
