package com.spnlearn.learner.structure;

public class StructureStats {
    private final int nodes;
    private final int sums;
    private final int products;
    private final int leaves;
    private final int edges;
    private final int depth;

    public StructureStats(int nodes, int sums, int products, int leaves, int edges, int depth) {
        this.nodes = nodes;
        this.sums = sums;
        this.products = products;
        this.leaves = leaves;
        this.edges = edges;
        this.depth = depth;
    }

    public int getNodes() {
        return nodes;
    }

    public int getSums() {
        return sums;
    }

    public int getProducts() {
        return products;
    }

    public int getLeaves() {
        return leaves;
    }

    public int getEdges() {
        return edges;
    }

    public int getDepth() {
        return depth;
    }

    @Override
    public String toString() {
        return "StructureStats{" +
                "nodes=" + nodes +
                ", sums=" + sums +
                ", products=" + products +
                ", leaves=" + leaves +
                ", edges=" + edges +
                ", depth=" + depth +
                '}';
    }
}
