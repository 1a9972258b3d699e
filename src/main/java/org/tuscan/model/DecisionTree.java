package org.tuscan.model;

/**
 * An immutable binary decision tree stored as parallel arrays.
 * <p>
 * Node 0 is the root. An internal node sends a row to {@code left[n]} when
 * {@code row[feature[n]] <= threshold[n]} and to {@code right[n]} otherwise. A node with
 * {@code feature[n] < 0} is a leaf whose output is {@code value[n]}.
 * <p>
 * Children always have a higher index than their parent, which the constructor checks; this
 * guarantees that evaluation terminates.
 */
public final class DecisionTree {

    /** Marker in {@code feature} for leaf nodes. */
    public static final int LEAF = -1;

    private final int[] feature;
    private final double[] threshold;
    private final int[] left;
    private final int[] right;
    private final double[] value;

    /**
     * Creates a tree from node arrays of equal length.
     *
     * @throws IllegalArgumentException if the arrays differ in length, are empty, or a child
     *                                  index does not point forward to an existing node.
     */
    public DecisionTree(int[] feature, double[] threshold, int[] left, int[] right, double[] value) {
        int size = feature.length;
        if (size == 0) {
            throw new IllegalArgumentException("Tree must have at least one node");
        }
        if (threshold.length != size || left.length != size || right.length != size || value.length != size) {
            throw new IllegalArgumentException("Tree node arrays must all have length " + size);
        }
        for (int n = 0; n < size; n++) {
            if (feature[n] == LEAF) {
                continue;
            }
            if (feature[n] < 0) {
                throw new IllegalArgumentException("Node " + n + " has negative feature index " + feature[n]);
            }
            checkChild(n, left[n], size);
            checkChild(n, right[n], size);
        }
        this.feature = feature.clone();
        this.threshold = threshold.clone();
        this.left = left.clone();
        this.right = right.clone();
        this.value = value.clone();
    }

    private static void checkChild(int parent, int child, int size) {
        if (child <= parent || child >= size) {
            throw new IllegalArgumentException(
                "Node " + parent + " has invalid child index " + child + " (tree size " + size + ")");
        }
    }

    /**
     * Walks the tree for one row.
     *
     * @param row the feature vector.
     * @return the value of the leaf the row lands in.
     */
    public double evaluate(double[] row) {
        int node = 0;
        while (feature[node] != LEAF) {
            node = row[feature[node]] <= threshold[node] ? left[node] : right[node];
        }
        return value[node];
    }

    /**
     * @return the highest feature index referenced by any internal node, or -1 for a lone leaf.
     */
    public int maxFeatureIndex() {
        int max = -1;
        for (int f : feature) {
            max = Math.max(max, f);
        }
        return max;
    }

    /** @return the number of nodes. */
    public int size() {
        return feature.length;
    }
}
