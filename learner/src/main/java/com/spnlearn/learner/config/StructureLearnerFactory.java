package com.spnlearn.learner.config;

import com.spnlearn.learner.learning.ColumnSplitter;
import com.spnlearn.learner.learning.DefaultOperationPolicy;
import com.spnlearn.learner.learning.LeafFactory;
import com.spnlearn.learner.learning.RowSplitter;
import com.spnlearn.learner.learning.StructureLearner;
import com.spnlearn.learner.leaves.HistogramLeafFactory;
import com.spnlearn.learner.splitting.CorrelationColumnSplitter;
import com.spnlearn.learner.splitting.KMeansRowSplitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires a {@link StructureLearner} from a {@link LearnerConfig}. Unknown
 * component types fall back to the default implementation.
 */
public class StructureLearnerFactory {

    private static final Logger logger = LoggerFactory.getLogger(StructureLearnerFactory.class);

    private StructureLearnerFactory() {
    }

    public static StructureLearner create() {
        return create(LearnerConfigLoader.load());
    }

    public static StructureLearner create(LearnerConfig config) {
        if (config == null) {
            config = new LearnerConfig();
        }
        DefaultOperationPolicy policy = createPolicy(config);
        RowSplitter rows = createRowSplitter(config.rowSplit);
        ColumnSplitter cols = createColumnSplitter(config.columnSplit);
        LeafFactory leaves = createLeafFactory(config.leaf);

        logger.info("Structure learner configured: policy={}, rows={}, columns={}, leaves={}", policy,
                rows.getClass().getSimpleName(), cols.getClass().getSimpleName(),
                leaves.getClass().getSimpleName());
        return new StructureLearner(rows, cols, leaves, policy);
    }

    public static DefaultOperationPolicy createPolicy(LearnerConfig config) {
        int minInstances = config.minInstancesSlice != null ? config.minInstancesSlice
                : DefaultOperationPolicy.DEFAULT_MIN_INSTANCES_SLICE;
        boolean clusterFirst = config.clusterFirst != null ? config.clusterFirst : true;
        boolean clusterUnivariate = config.clusterUnivariate != null ? config.clusterUnivariate : false;
        return new DefaultOperationPolicy(minInstances, clusterFirst, clusterUnivariate);
    }

    public static RowSplitter createRowSplitter(LearnerConfig.RowSplitConfig cfg) {
        String type = typeOrDefault(cfg != null ? cfg.type : null, "kmeans", "row split");
        switch (type) {
            case "kmeans":
                break;
            default:
                logger.warn("Unknown row split type '{}', defaulting to 'kmeans'", type);
        }
        int clusters = cfg != null && cfg.clusters != null ? cfg.clusters : 2;
        int maxIterations = cfg != null && cfg.maxIterations != null ? cfg.maxIterations : 20;
        long seed = cfg != null && cfg.seed != null ? cfg.seed : 17L;
        return new KMeansRowSplitter(clusters, maxIterations, seed);
    }

    public static ColumnSplitter createColumnSplitter(LearnerConfig.ColumnSplitConfig cfg) {
        String type = typeOrDefault(cfg != null ? cfg.type : null, "correlation", "column split");
        switch (type) {
            case "correlation":
                break;
            default:
                logger.warn("Unknown column split type '{}', defaulting to 'correlation'", type);
        }
        double threshold = cfg != null && cfg.threshold != null ? cfg.threshold : 0.3;
        return new CorrelationColumnSplitter(threshold);
    }

    public static LeafFactory createLeafFactory(LearnerConfig.LeafConfig cfg) {
        String type = typeOrDefault(cfg != null ? cfg.type : null, "histogram", "leaf");
        switch (type) {
            case "histogram":
                break;
            default:
                logger.warn("Unknown leaf type '{}', defaulting to 'histogram'", type);
        }
        int bins = cfg != null && cfg.bins != null ? cfg.bins : 10;
        double alpha = cfg != null && cfg.smoothingAlpha != null ? cfg.smoothingAlpha : 1.0;
        return new HistogramLeafFactory(bins, alpha);
    }

    private static String typeOrDefault(String type, String fallback, String what) {
        if (type == null || type.trim().isEmpty()) {
            logger.debug("No {} type specified, defaulting to '{}'", what, fallback);
            return fallback;
        }
        return type.trim().toLowerCase();
    }
}
