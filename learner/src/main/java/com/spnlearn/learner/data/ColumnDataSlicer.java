package com.spnlearn.learner.data;

import java.util.List;

public class ColumnDataSlicer implements DataSlicer {

    @Override
    public DataSlice slice(DataSlice data, List<Integer> columnPositions) {
        if (columnPositions == null || columnPositions.isEmpty()) {
            throw new IllegalArgumentException("at least one column position is required");
        }
        return data.selectColumns(columnPositions);
    }
}
