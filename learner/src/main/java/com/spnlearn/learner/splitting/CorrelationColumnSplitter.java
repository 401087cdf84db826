package com.spnlearn.learner.splitting;

import com.spnlearn.learner.data.DataSlice;
import com.spnlearn.learner.data.DatasetContext;
import com.spnlearn.learner.learning.ColumnSplitter;
import com.spnlearn.learner.learning.SplitResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Groups columns into the connected components of a dependency graph, where two
 * columns are linked when their absolute Pearson correlation reaches the
 * threshold. Components are returned in order of their lowest column.
 */
public class CorrelationColumnSplitter implements ColumnSplitter {

    private static final Logger logger = LoggerFactory.getLogger(CorrelationColumnSplitter.class);

    private final double threshold;

    public CorrelationColumnSplitter() {
        this(0.3);
    }

    public CorrelationColumnSplitter(double threshold) {
        if (threshold <= 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be in (0, 1]");
        }
        this.threshold = threshold;
    }

    @Override
    public List<SplitResult> split(DataSlice data, DatasetContext context, List<Integer> scope) {
        int d = data.numCols();
        boolean[][] linked = dependencyGraph(data);

        boolean[] visited = new boolean[d];
        List<SplitResult> result = new ArrayList<>();
        for (int start = 0; start < d; start++) {
            if (visited[start]) {
                continue;
            }
            List<Integer> component = new ArrayList<>();
            Deque<Integer> stack = new ArrayDeque<>();
            stack.push(start);
            visited[start] = true;
            while (!stack.isEmpty()) {
                int col = stack.pop();
                component.add(col);
                for (int other = 0; other < d; other++) {
                    if (!visited[other] && linked[col][other]) {
                        visited[other] = true;
                        stack.push(other);
                    }
                }
            }
            component.sort(null);

            List<Integer> componentScope = new ArrayList<>();
            for (int pos : component) {
                componentScope.add(scope.get(pos));
            }
            result.add(new SplitResult(data.selectColumns(component), componentScope, (double) component.size() / d));
        }

        logger.trace("correlation graph on {} has {} components", data.shape(), result.size());
        return result;
    }

    boolean[][] dependencyGraph(DataSlice data) {
        int d = data.numCols();
        int n = data.numRows();
        double[][] centered = new double[d][];
        double[] norms = new double[d];
        for (int c = 0; c < d; c++) {
            double[] values = data.column(c);
            double mean = 0.0;
            for (double v : values)
                mean += v;
            mean /= n;
            double ss = 0.0;
            for (int r = 0; r < n; r++) {
                values[r] -= mean;
                ss += values[r] * values[r];
            }
            centered[c] = values;
            norms[c] = Math.sqrt(ss);
        }

        boolean[][] linked = new boolean[d][d];
        for (int i = 0; i < d; i++) {
            for (int j = i + 1; j < d; j++) {
                // constant columns are treated as uncorrelated with everything
                if (norms[i] == 0.0 || norms[j] == 0.0) {
                    continue;
                }
                double dot = 0.0;
                for (int r = 0; r < n; r++) {
                    dot += centered[i][r] * centered[j][r];
                }
                double corr = dot / (norms[i] * norms[j]);
                if (Math.abs(corr) >= threshold) {
                    linked[i][j] = true;
                    linked[j][i] = true;
                }
            }
        }
        return linked;
    }
}
