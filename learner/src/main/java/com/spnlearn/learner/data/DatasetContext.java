package com.spnlearn.learner.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-dataset descriptor handed to splitters and leaf factories. The structure
 * learner passes it along without looking inside.
 */
public class DatasetContext {

    private final List<String> featureNames;
    // [column][0] = min, [column][1] = max over the full dataset
    private final double[][] domains;

    public DatasetContext(List<String> featureNames, double[][] domains) {
        if (featureNames == null || domains == null || featureNames.size() != domains.length) {
            throw new IllegalArgumentException("feature names and domains must be present and of equal length");
        }
        this.featureNames = Collections.unmodifiableList(new ArrayList<>(featureNames));
        this.domains = domains;
    }

    /**
     * Builds a context from the full dataset, naming columns {@code x0, x1, ...}.
     */
    public static DatasetContext fromData(DataSlice data) {
        List<String> names = new ArrayList<>();
        for (int c = 0; c < data.numCols(); c++) {
            names.add("x" + c);
        }
        return fromData(data, names);
    }

    public static DatasetContext fromData(DataSlice data, List<String> featureNames) {
        double[][] domains = new double[data.numCols()][2];
        for (int c = 0; c < data.numCols(); c++) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (int r = 0; r < data.numRows(); r++) {
                double v = data.get(r, c);
                if (v < min)
                    min = v;
                if (v > max)
                    max = v;
            }
            domains[c][0] = min;
            domains[c][1] = max;
        }
        return new DatasetContext(featureNames, domains);
    }

    public int numFeatures() {
        return featureNames.size();
    }

    public String getFeatureName(int column) {
        return featureNames.get(column);
    }

    public double getDomainMin(int column) {
        return domains[column][0];
    }

    public double getDomainMax(int column) {
        return domains[column][1];
    }
}
