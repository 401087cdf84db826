package com.spnlearn.learner.learning;

public enum Operation {
    CREATE_LEAF,
    SPLIT_COLUMNS,
    SPLIT_ROWS,
    NAIVE_FACTORIZATION,
    REMOVE_UNINFORMATIVE_FEATURES
}
