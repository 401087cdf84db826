package com.spnlearn.learner.learning;

import com.spnlearn.learner.data.ColumnDataSlicer;
import com.spnlearn.learner.data.DataSlice;
import com.spnlearn.learner.data.DataSlicer;
import com.spnlearn.learner.data.DatasetContext;
import com.spnlearn.learner.structure.InvalidStructureException;
import com.spnlearn.learner.structure.LeafNode;
import com.spnlearn.learner.structure.ProductNode;
import com.spnlearn.learner.structure.SpnNode;
import com.spnlearn.learner.structure.StructureOps;
import com.spnlearn.learner.structure.StructurePruner;
import com.spnlearn.learner.structure.StructureValidator;
import com.spnlearn.learner.structure.SumNode;
import com.spnlearn.learner.structure.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Learns a sum-product network top-down. Pending slices are kept in a FIFO
 * worklist; each one is resolved by the {@link OperationPolicy} into a new
 * inner node (whose children become new tasks), a leaf, or a retry of the same
 * slice with one more splitter marked as failed.
 *
 * <p>
 * Every task fills exactly one placeholder slot of its parent. The seed task
 * fills the only slot of a synthetic product wrapper that is dropped once the
 * worklist is empty.
 */
public class StructureLearner {

    private static final Logger logger = LoggerFactory.getLogger(StructureLearner.class);

    private final RowSplitter rowSplitter;
    private final ColumnSplitter columnSplitter;
    private final LeafFactory leafFactory;
    private final OperationPolicy policy;
    private final DataSlicer slicer;
    private final StructurePruner pruner;
    private final StructureValidator validator;

    public StructureLearner(RowSplitter rowSplitter, ColumnSplitter columnSplitter, LeafFactory leafFactory,
            OperationPolicy policy) {
        this(rowSplitter, columnSplitter, leafFactory, policy, new ColumnDataSlicer());
    }

    public StructureLearner(RowSplitter rowSplitter, ColumnSplitter columnSplitter, LeafFactory leafFactory,
            OperationPolicy policy, DataSlicer slicer) {
        if (rowSplitter == null || columnSplitter == null || leafFactory == null || policy == null
                || slicer == null) {
            throw new IllegalArgumentException("row splitter, column splitter, leaf factory, policy and slicer are required");
        }
        this.rowSplitter = rowSplitter;
        this.columnSplitter = columnSplitter;
        this.leafFactory = leafFactory;
        this.policy = policy;
        this.slicer = slicer;
        this.validator = new StructureValidator();
        this.pruner = new StructurePruner(validator);
    }

    public SpnNode learnStructure(DataSlice dataset, DatasetContext context) {
        return learnStructure(dataset, context, null);
    }

    /**
     * @param initialScope original column ids of the dataset's columns, or
     *                     {@code null} for {@code 0..numCols-1}
     * @return the validated, pruned root with ids assigned
     */
    public SpnNode learnStructure(DataSlice dataset, DatasetContext context, List<Integer> initialScope) {
        if (dataset == null) {
            throw new IllegalArgumentException("dataset is required");
        }
        if (context == null) {
            throw new IllegalArgumentException("dataset context is required");
        }
        List<Integer> scope = resolveScope(dataset, initialScope);

        long startTime = System.currentTimeMillis();
        logger.info("Learning structure on {} slice with scope {}", dataset.shape(), scope);

        ProductNode wrapper = new ProductNode(scope);
        int rootSlot = wrapper.addPlaceholder();

        Deque<LearningTask> tasks = new ArrayDeque<>();
        tasks.add(new LearningTask(dataset, wrapper, rootSlot, scope, false, false));

        int iterations = 0;
        while (!tasks.isEmpty()) {
            LearningTask task = tasks.poll();
            iterations++;

            OperationDecision decision = policy.nextOperation(task.getData(), task.getScope(), task.isNoClusters(),
                    task.isNoIndependencies(), task.getParent() == wrapper);
            if (decision == null) {
                throw new IllegalStateException("operation policy returned no decision for " + task);
            }

            logger.debug("OP: {} on slice {} (remaining tasks {})", decision, task.getData().shape(), tasks.size());

            switch (decision.getOperation()) {
                case REMOVE_UNINFORMATIVE_FEATURES:
                    removeUninformativeFeatures(task, decision.getColumnPositions(), tasks);
                    break;
                case SPLIT_ROWS:
                    splitRows(task, context, tasks);
                    break;
                case SPLIT_COLUMNS:
                    splitColumns(task, context, tasks);
                    break;
                case NAIVE_FACTORIZATION:
                    naiveFactorization(task, tasks);
                    break;
                case CREATE_LEAF:
                    createLeaf(task, context);
                    break;
                default:
                    throw new IllegalStateException("Invalid operation: " + decision.getOperation());
            }
        }

        SpnNode root = wrapper.getChildren().get(rootSlot);
        StructureOps.assignIds(root);

        root = pruner.prune(root);

        ValidationResult result = validator.validate(root);
        if (!result.isValid()) {
            throw new InvalidStructureException("invalid spn: " + result.getMessage());
        }

        long duration = System.currentTimeMillis() - startTime;
        logger.info("Structure learned in {} ms after {} tasks: {}", duration, iterations,
                StructureOps.getStats(root));
        return root;
    }

    private List<Integer> resolveScope(DataSlice dataset, List<Integer> initialScope) {
        if (dataset.numCols() == 0) {
            throw new IllegalArgumentException("dataset must have at least one column");
        }
        if (initialScope == null) {
            List<Integer> scope = new ArrayList<>();
            for (int c = 0; c < dataset.numCols(); c++) {
                scope.add(c);
            }
            return scope;
        }
        if (initialScope.size() != dataset.numCols()) {
            throw new IllegalArgumentException("initial scope " + initialScope + " does not match "
                    + dataset.numCols() + " dataset columns");
        }
        Set<Integer> seen = new HashSet<>();
        for (Integer s : initialScope) {
            if (s == null || s < 0 || !seen.add(s)) {
                throw new IllegalArgumentException("initial scope entries must be distinct non-negative column ids: "
                        + initialScope);
            }
        }
        return new ArrayList<>(initialScope);
    }

    private void removeUninformativeFeatures(LearningTask task, List<Integer> uninformative,
            Deque<LearningTask> tasks) {
        List<Integer> scope = task.getScope();
        ProductNode node = new ProductNode(scope);
        task.getParent().setChild(task.getSlot(), node);

        Set<Integer> uninformativeSet = new HashSet<>(uninformative);
        for (int col : uninformative) {
            int slot = node.addPlaceholder();
            tasks.add(new LearningTask(slicer.slice(task.getData(), Collections.singletonList(col)), node, slot,
                    Collections.singletonList(scope.get(col)), true, true));
        }

        // remaining informative columns stay together, in their original order
        List<Integer> restPositions = new ArrayList<>();
        List<Integer> restScope = new ArrayList<>();
        for (int pos = 0; pos < scope.size(); pos++) {
            if (!uninformativeSet.contains(pos)) {
                restPositions.add(pos);
                restScope.add(scope.get(pos));
            }
        }

        boolean nextFinal = restPositions.size() == 1;
        int slot = node.addPlaceholder();
        tasks.add(new LearningTask(slicer.slice(task.getData(), restPositions), node, slot, restScope, nextFinal,
                nextFinal));
    }

    private void splitRows(LearningTask task, DatasetContext context, Deque<LearningTask> tasks) {
        long splitStart = System.nanoTime();
        List<SplitResult> slices = rowSplitter.split(task.getData(), context, task.getScope());
        long splitEnd = System.nanoTime();
        checkSplitResults(slices, "row");
        logger.debug("\tfound {} row clusters (in {} ms)", slices.size(), (splitEnd - splitStart) / 1_000_000.0);

        if (slices.size() == 1) {
            tasks.add(task.withNoClusters());
            return;
        }

        SumNode node = new SumNode(task.getScope());
        task.getParent().setChild(task.getSlot(), node);

        for (SplitResult part : slices) {
            int slot = node.addPlaceholder(part.getProportion());
            tasks.add(new LearningTask(part.getSlice(), node, slot, task.getScope(), false, false));
        }
    }

    private void splitColumns(LearningTask task, DatasetContext context, Deque<LearningTask> tasks) {
        long splitStart = System.nanoTime();
        List<SplitResult> slices = columnSplitter.split(task.getData(), context, task.getScope());
        long splitEnd = System.nanoTime();
        checkSplitResults(slices, "column");
        logger.debug("\tfound {} col clusters (in {} ms)", slices.size(), (splitEnd - splitStart) / 1_000_000.0);

        if (slices.size() == 1) {
            tasks.add(task.withNoIndependencies());
            return;
        }

        Set<Integer> parentScope = new HashSet<>(task.getScope());
        for (SplitResult part : slices) {
            if (part.getScope().isEmpty() || !parentScope.containsAll(part.getScope())) {
                throw new IllegalStateException("column split scope " + part.getScope()
                        + " is not a non-empty subset of " + task.getScope());
            }
            if (part.getScope().size() != part.getSlice().numCols()) {
                throw new IllegalStateException("column split scope " + part.getScope() + " does not match slice "
                        + part.getSlice().shape());
            }
        }

        ProductNode node = new ProductNode(task.getScope());
        task.getParent().setChild(task.getSlot(), node);

        for (SplitResult part : slices) {
            int slot = node.addPlaceholder();
            tasks.add(new LearningTask(part.getSlice(), node, slot, part.getScope(), false, false));
        }
    }

    private void naiveFactorization(LearningTask task, Deque<LearningTask> tasks) {
        List<Integer> scope = task.getScope();
        ProductNode node = new ProductNode(scope);
        task.getParent().setChild(task.getSlot(), node);

        long start = System.nanoTime();
        for (int col = 0; col < scope.size(); col++) {
            int slot = node.addPlaceholder();
            tasks.add(new LearningTask(slicer.slice(task.getData(), Collections.singletonList(col)), node, slot,
                    Collections.singletonList(scope.get(col)), true, true));
        }
        long end = System.nanoTime();
        logger.debug("\tsplit {} columns (in {} ms)", scope.size(), (end - start) / 1_000_000.0);
    }

    private void createLeaf(LearningTask task, DatasetContext context) {
        long start = System.nanoTime();
        LeafNode leaf = leafFactory.createLeaf(task.getData(), context, task.getScope());
        if (leaf == null) {
            throw new IllegalStateException("leaf factory returned null for scope " + task.getScope());
        }
        task.getParent().setChild(task.getSlot(), leaf);
        long end = System.nanoTime();
        logger.debug("\tcreated leaf {} for scope={} (in {} ms)", leaf.getClass().getSimpleName(), task.getScope(),
                (end - start) / 1_000_000.0);
    }

    private static void checkSplitResults(List<SplitResult> slices, String kind) {
        if (slices == null || slices.isEmpty()) {
            throw new IllegalStateException(kind + " splitter must return at least one slice");
        }
        for (SplitResult part : slices) {
            if (part == null || part.getSlice() == null || part.getScope() == null) {
                throw new IllegalStateException(kind + " splitter returned a malformed slice: " + part);
            }
        }
    }
}
