package com.spnlearn.learner.splitting;

import com.spnlearn.learner.data.DataSlice;
import com.spnlearn.learner.data.DatasetContext;
import com.spnlearn.learner.learning.RowSplitter;
import com.spnlearn.learner.learning.SplitResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Clusters the rows of a slice with Lloyd's k-means. The first center is a
 * seeded random row; every further center is the row farthest from the centers
 * chosen so far. Each non-empty cluster becomes one result, weighted by its
 * share of the rows.
 */
public class KMeansRowSplitter implements RowSplitter {

    private static final Logger logger = LoggerFactory.getLogger(KMeansRowSplitter.class);

    private final int clusters;
    private final int maxIterations;
    private final long seed;

    public KMeansRowSplitter() {
        this(2, 20, 17L);
    }

    public KMeansRowSplitter(int clusters, int maxIterations, long seed) {
        if (clusters < 2) {
            throw new IllegalArgumentException("clusters must be at least 2");
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive");
        }
        this.clusters = clusters;
        this.maxIterations = maxIterations;
        this.seed = seed;
    }

    @Override
    public List<SplitResult> split(DataSlice data, DatasetContext context, List<Integer> scope) {
        int n = data.numRows();
        if (n < clusters) {
            return Collections.singletonList(new SplitResult(data, scope, 1.0));
        }

        double[][] points = new double[n][];
        for (int r = 0; r < n; r++) {
            points[r] = data.row(r);
        }

        double[][] centers = initialCenters(points);
        int[] assignment = new int[n];
        int iterations = 0;
        boolean changed = true;

        while (changed && iterations < maxIterations) {
            changed = false;

            // Assign points to nearest center
            for (int r = 0; r < n; r++) {
                int nearest = nearestCenter(points[r], centers);
                if (nearest != assignment[r]) {
                    assignment[r] = nearest;
                    changed = true;
                }
            }

            // Update centers, empty clusters keep their previous center
            double[][] sums = new double[clusters][data.numCols()];
            int[] counts = new int[clusters];
            for (int r = 0; r < n; r++) {
                int k = assignment[r];
                counts[k]++;
                for (int c = 0; c < points[r].length; c++) {
                    sums[k][c] += points[r][c];
                }
            }
            for (int k = 0; k < clusters; k++) {
                if (counts[k] > 0) {
                    for (int c = 0; c < sums[k].length; c++) {
                        centers[k][c] = sums[k][c] / counts[k];
                    }
                }
            }
            iterations++;
        }

        List<SplitResult> result = new ArrayList<>();
        for (int k = 0; k < clusters; k++) {
            int size = 0;
            for (int r = 0; r < n; r++) {
                if (assignment[r] == k)
                    size++;
            }
            if (size == 0) {
                continue;
            }
            int[] members = new int[size];
            int i = 0;
            for (int r = 0; r < n; r++) {
                if (assignment[r] == k)
                    members[i++] = r;
            }
            result.add(new SplitResult(data.selectRows(members), scope, (double) size / n));
        }

        if (result.size() == 1) {
            // one populated cluster, hand back the slice untouched
            result = Collections.singletonList(new SplitResult(data, scope, 1.0));
        }

        logger.trace("k-means on {} converged after {} iterations into {} clusters", data.shape(), iterations,
                result.size());
        return result;
    }

    private double[][] initialCenters(double[][] points) {
        Random random = new Random(seed);
        double[][] centers = new double[clusters][];
        centers[0] = points[random.nextInt(points.length)].clone();

        double[] minDist = new double[points.length];
        for (int r = 0; r < points.length; r++) {
            minDist[r] = squaredDistance(points[r], centers[0]);
        }
        for (int k = 1; k < clusters; k++) {
            int farthest = 0;
            for (int r = 1; r < points.length; r++) {
                if (minDist[r] > minDist[farthest]) {
                    farthest = r;
                }
            }
            centers[k] = points[farthest].clone();
            for (int r = 0; r < points.length; r++) {
                minDist[r] = Math.min(minDist[r], squaredDistance(points[r], centers[k]));
            }
        }
        return centers;
    }

    private static int nearestCenter(double[] point, double[][] centers) {
        int nearest = 0;
        double best = Double.MAX_VALUE;
        for (int k = 0; k < centers.length; k++) {
            double d = squaredDistance(point, centers[k]);
            if (d < best) {
                best = d;
                nearest = k;
            }
        }
        return nearest;
    }

    private static double squaredDistance(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return sum;
    }
}
