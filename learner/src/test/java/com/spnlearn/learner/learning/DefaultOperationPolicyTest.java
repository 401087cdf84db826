package com.spnlearn.learner.learning;

import com.spnlearn.learner.data.DataSlice;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DefaultOperationPolicyTest {

    private final DefaultOperationPolicy policy = new DefaultOperationPolicy(100);

    // columns vary with the row unless listed as constant
    private static DataSlice data(int rows, int cols, int... constantCols) {
        double[][] values = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                values[r][c] = (r * (c + 3)) % 17;
            }
            for (int c : constantCols) {
                values[r][c] = 4.0;
            }
        }
        return DataSlice.of(values);
    }

    private static List<Integer> scope(int n) {
        Integer[] s = new Integer[n];
        for (int i = 0; i < n; i++) {
            s[i] = i;
        }
        return Arrays.asList(s);
    }

    @Test
    public void testSingleColumnSmallSliceIsLeafForAnyFlags() {
        DataSlice small = data(100, 1);
        boolean[] flags = { false, true };
        for (boolean noClusters : flags) {
            for (boolean noIndependencies : flags) {
                for (boolean isFirst : flags) {
                    OperationDecision d = policy.decide(small, scope(1), noClusters, noIndependencies, isFirst, true,
                            true);
                    assertEquals(Operation.CREATE_LEAF, d.getOperation());
                    assertNull(d.getColumnPositions());
                }
            }
        }
    }

    @Test
    public void testSingleColumnLargeSlice() {
        DataSlice large = data(101, 1);

        assertEquals(Operation.CREATE_LEAF,
                policy.decide(large, scope(1), false, false, false, true, false).getOperation());
        assertEquals(Operation.SPLIT_ROWS,
                policy.decide(large, scope(1), false, false, false, true, true).getOperation());
        // clustering already failed
        assertEquals(Operation.CREATE_LEAF,
                policy.decide(large, scope(1), true, false, false, true, true).getOperation());
    }

    @Test
    public void testUnivariateClusteringFromConstructor() {
        DefaultOperationPolicy univariate = new DefaultOperationPolicy(10, true, true);
        assertEquals(Operation.SPLIT_ROWS,
                univariate.nextOperation(data(50, 1), scope(1), false, false, false).getOperation());
    }

    @Test
    public void testAllZeroVarianceIsNaiveFactorization() {
        OperationDecision d = policy.nextOperation(data(500, 3, 0, 1, 2), scope(3), false, false, true);
        assertEquals(Operation.NAIVE_FACTORIZATION, d.getOperation());
        assertNull(d.getColumnPositions());
    }

    @Test
    public void testSomeZeroVarianceRemovesThemInAscendingOrder() {
        OperationDecision d = policy.nextOperation(data(500, 5, 3, 1), scope(5), false, false, true);
        assertEquals(Operation.REMOVE_UNINFORMATIVE_FEATURES, d.getOperation());
        assertEquals(Arrays.asList(1, 3), d.getColumnPositions());
    }

    @Test
    public void testZeroVarianceCheckedBeforeFlags() {
        OperationDecision d = policy.nextOperation(data(20, 2, 0), scope(2), true, true, false);
        assertEquals(OperationDecision.removeUninformative(Collections.singletonList(0)), d);
    }

    @Test
    public void testSingleRowSliceIsNaiveFactorization() {
        assertEquals(Operation.NAIVE_FACTORIZATION,
                policy.nextOperation(data(1, 4), scope(4), false, false, true).getOperation());
    }

    @Test
    public void testMinimalInstancesOrBothFailed() {
        assertEquals(Operation.NAIVE_FACTORIZATION,
                policy.nextOperation(data(100, 3), scope(3), false, false, true).getOperation());
        assertEquals(Operation.NAIVE_FACTORIZATION,
                policy.nextOperation(data(300, 3), scope(3), true, true, false).getOperation());
    }

    @Test
    public void testOneFailedSplitterPicksTheOther() {
        DataSlice large = data(300, 3);
        assertEquals(Operation.SPLIT_ROWS, policy.nextOperation(large, scope(3), false, true, false).getOperation());
        assertEquals(Operation.SPLIT_COLUMNS,
                policy.nextOperation(large, scope(3), true, false, false).getOperation());
        // failure flags win over the opening move
        assertEquals(Operation.SPLIT_COLUMNS,
                policy.nextOperation(large, scope(3), true, false, true).getOperation());
    }

    @Test
    public void testOpeningMoveAndDefault() {
        DataSlice large = data(300, 3);
        assertEquals(Operation.SPLIT_ROWS,
                policy.decide(large, scope(3), false, false, true, true, false).getOperation());
        assertEquals(Operation.SPLIT_COLUMNS,
                policy.decide(large, scope(3), false, false, true, false, false).getOperation());
        assertEquals(Operation.SPLIT_COLUMNS,
                policy.decide(large, scope(3), false, false, false, true, false).getOperation());
    }

    @Test
    public void testDeterministic() {
        DataSlice large = data(300, 4, 2);
        OperationDecision first = policy.nextOperation(large, scope(4), false, false, true);
        OperationDecision second = policy.nextOperation(large, scope(4), false, false, true);
        assertEquals(first, second);
    }

    @Test
    public void testNegativeFloorRejected() {
        assertThrows(IllegalArgumentException.class, () -> new DefaultOperationPolicy(-1));
    }
}
