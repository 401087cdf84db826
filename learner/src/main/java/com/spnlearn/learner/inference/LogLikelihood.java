package com.spnlearn.learner.inference;

import com.spnlearn.learner.data.DataSlice;
import com.spnlearn.learner.structure.LeafNode;
import com.spnlearn.learner.structure.ProductNode;
import com.spnlearn.learner.structure.SpnNode;
import com.spnlearn.learner.structure.SumNode;

import java.util.List;

/**
 * Bottom-up log-likelihood of complete rows. Sum weights are normalized at
 * evaluation time.
 */
public class LogLikelihood {

    private LogLikelihood() {
    }

    /**
     * @param row a full dataset row, indexed by original column id
     */
    public static double evaluate(SpnNode node, double[] row) {
        if (node instanceof LeafNode) {
            return ((LeafNode) node).logDensity(row);
        }

        List<SpnNode> children = node.getChildren();
        if (node instanceof ProductNode) {
            double total = 0.0;
            for (SpnNode child : children) {
                total += evaluate(child, row);
            }
            return total;
        }

        if (node instanceof SumNode) {
            SumNode sum = (SumNode) node;
            double[] raw = new double[children.size()];
            for (int i = 0; i < raw.length; i++) {
                raw[i] = sum.getWeight(i);
            }
            double[] weights = MathUtil.normalize(raw);
            double[] terms = new double[children.size()];
            for (int i = 0; i < terms.length; i++) {
                terms[i] = Math.log(weights[i]) + evaluate(children.get(i), row);
            }
            return MathUtil.logSumExp(terms);
        }

        throw new IllegalArgumentException("Unsupported node type: " + node.getClass().getName());
    }

    /**
     * One log-likelihood per row of a slice holding all dataset columns in
     * original order.
     */
    public static double[] evaluate(SpnNode root, DataSlice data) {
        double[] result = new double[data.numRows()];
        for (int r = 0; r < result.length; r++) {
            result[r] = evaluate(root, data.row(r));
        }
        return result;
    }

    public static double mean(SpnNode root, DataSlice data) {
        double[] values = evaluate(root, data);
        double sum = 0.0;
        for (double v : values)
            sum += v;
        return sum / values.length;
    }
}
