package org.neuralchilli.symdag.domain;

import javax.annotation.Nonnull;

/**
 * Shape of a DAG: node and edge counts, sources, sinks and Kahn layering.
 * For an expression graph the single source is the root and the sinks are its leaves.
 */
public record DagStatistics(
        int totalNodes,
        int totalEdges,
        int rootNodes,
        int leafNodes,
        int levels,
        int maxWidth
) {
    public DagStatistics {
        if (totalNodes < 0) {
            throw new IllegalArgumentException("Total nodes cannot be negative");
        }
        if (totalEdges < 0) {
            throw new IllegalArgumentException("Total edges cannot be negative");
        }
        if (rootNodes < 0) {
            throw new IllegalArgumentException("Root nodes cannot be negative");
        }
        if (leafNodes < 0) {
            throw new IllegalArgumentException("Leaf nodes cannot be negative");
        }
        if (levels < 0) {
            throw new IllegalArgumentException("Levels cannot be negative");
        }
        if (maxWidth < 0) {
            throw new IllegalArgumentException("Max width cannot be negative");
        }
    }

    public static DagStatistics empty() {
        return new DagStatistics(0, 0, 0, 0, 0, 0);
    }

    /**
     * Number of layers from the root down to the deepest leaf
     */
    public int depth() {
        return levels;
    }

    /**
     * Check if every level holds a single node (a chain such as neg(neg(x)))
     */
    public boolean isLinear() {
        return maxWidth == 1;
    }

    /**
     * Check if some node is reached through more than one edge, i.e. a subexpression is shared
     */
    public boolean hasSharing() {
        return totalNodes > 0 && totalEdges > totalNodes - rootNodes;
    }

    @Nonnull
    @Override
    public String toString() {
        return String.format(
                "DagStatistics[nodes=%d, edges=%d, levels=%d, max_width=%d, roots=%d, leaves=%d]",
                totalNodes, totalEdges, levels, maxWidth, rootNodes, leafNodes
        );
    }
}
