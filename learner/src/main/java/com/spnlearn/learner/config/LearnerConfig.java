package com.spnlearn.learner.config;

/**
 * JSON-bound learner settings. Every field is optional; unset values fall back
 * to the defaults applied in {@link StructureLearnerFactory}.
 */
public class LearnerConfig {

    public static class RowSplitConfig {
        public String type; // "kmeans"
        public Integer clusters;
        public Integer maxIterations;
        public Long seed;
    }

    public static class ColumnSplitConfig {
        public String type; // "correlation"
        public Double threshold;
    }

    public static class LeafConfig {
        public String type; // "histogram"
        public Integer bins;
        public Double smoothingAlpha;
    }

    public Integer minInstancesSlice;
    public Boolean clusterFirst;
    public Boolean clusterUnivariate;
    public RowSplitConfig rowSplit;
    public ColumnSplitConfig columnSplit;
    public LeafConfig leaf;
}
