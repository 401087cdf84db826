package com.spnlearn.learner.learning;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class OperationDecision {
    private final Operation operation;
    // zero-variance column positions, only for REMOVE_UNINFORMATIVE_FEATURES
    private final List<Integer> columnPositions;

    private OperationDecision(Operation operation, List<Integer> columnPositions) {
        this.operation = operation;
        this.columnPositions = columnPositions;
    }

    public static OperationDecision of(Operation operation) {
        if (operation == Operation.REMOVE_UNINFORMATIVE_FEATURES) {
            throw new IllegalArgumentException("REMOVE_UNINFORMATIVE_FEATURES needs column positions");
        }
        return new OperationDecision(operation, null);
    }

    public static OperationDecision removeUninformative(List<Integer> columnPositions) {
        if (columnPositions == null || columnPositions.isEmpty()) {
            throw new IllegalArgumentException("at least one uninformative column position is required");
        }
        return new OperationDecision(Operation.REMOVE_UNINFORMATIVE_FEATURES,
                Collections.unmodifiableList(columnPositions));
    }

    public Operation getOperation() {
        return operation;
    }

    public List<Integer> getColumnPositions() {
        return columnPositions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof OperationDecision))
            return false;
        OperationDecision that = (OperationDecision) o;
        return operation == that.operation && Objects.equals(columnPositions, that.columnPositions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operation, columnPositions);
    }

    @Override
    public String toString() {
        return columnPositions == null ? operation.toString() : operation + columnPositions.toString();
    }
}
