package com.spnlearn.learner.learning;

import com.spnlearn.learner.config.LearnerConfig;
import com.spnlearn.learner.config.StructureLearnerFactory;
import com.spnlearn.learner.data.DataSlice;
import com.spnlearn.learner.data.DatasetContext;
import com.spnlearn.learner.inference.LogLikelihood;
import com.spnlearn.learner.structure.LeafNode;
import com.spnlearn.learner.structure.ProductNode;
import com.spnlearn.learner.structure.SpnNode;
import com.spnlearn.learner.structure.StructureOps;
import com.spnlearn.learner.structure.StructureValidator;
import com.spnlearn.learner.structure.SumNode;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class StructureLearnerIntegrationTest {

    // Two well separated populations over three informative columns plus one constant column.
    private static DataSlice mixture() {
        double[][] values = new double[400][4];
        for (int r = 0; r < 400; r++) {
            boolean second = r >= 200;
            double x = (r % 20) / 10.0;
            values[r][0] = (second ? 10.0 : 0.0) + x;
            values[r][1] = (second ? 20.0 : 0.0) + 2.0 * x + (r % 3) * 0.01;
            values[r][2] = (second ? 3.0 : 0.0) + (r % 7) * 0.1;
            values[r][3] = 5.0;
        }
        return DataSlice.of(values);
    }

    @Test
    public void testLearnsValidModelWithDefaultComponents() {
        DataSlice data = mixture();
        DatasetContext context = DatasetContext.fromData(data);
        StructureLearner learner = StructureLearnerFactory.create(new LearnerConfig());

        SpnNode root = learner.learnStructure(data, context);

        assertTrue(new StructureValidator().validate(root).isValid());
        assertTrue(root instanceof ProductNode, "constant column should be factored out at the root");

        // every column is covered by at least one leaf
        Set<Integer> covered = new HashSet<>();
        for (LeafNode leaf : StructureOps.getNodesByType(root, LeafNode.class)) {
            covered.addAll(leaf.getScope());
        }
        assertEquals(Set.of(0, 1, 2, 3), covered);

        // the two populations end up as a mixture
        assertFalse(StructureOps.getNodesByType(root, SumNode.class).isEmpty());
        for (SumNode sum : StructureOps.getNodesByType(root, SumNode.class)) {
            assertEquals(sum.getChildren().size(), sum.getWeights().size());
        }

        for (double ll : LogLikelihood.evaluate(root, data)) {
            assertFalse(Double.isNaN(ll));
            assertFalse(Double.isInfinite(ll));
        }
    }

    @Test
    public void testMixtureFitsBetterThanNaiveFactorization() {
        DataSlice data = mixture();
        DatasetContext context = DatasetContext.fromData(data);
        LearnerConfig config = new LearnerConfig();

        SpnNode learned = StructureLearnerFactory.create(config).learnStructure(data, context);

        // a floor above the row count forces a single naive factorization
        config.minInstancesSlice = 1000;
        SpnNode naive = StructureLearnerFactory.create(config).learnStructure(data, context);
        assertTrue(StructureOps.getNodesByType(naive, SumNode.class).isEmpty());

        assertTrue(LogLikelihood.mean(learned, data) > LogLikelihood.mean(naive, data));
    }
}
