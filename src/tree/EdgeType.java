package tree;

/**
 * Structural type of the edge above a node, derived from its own branch
 * length and the lengths of its children's edges.
 */
public enum EdgeType {
    LEAF,
    FULL,       // own length > 0, every child length 0
    PARTIAL,    // own length > 0, some child lengths 0
    ANTI,       // own length 0, every child length > 0
    NONE;

    public static EdgeType classify(TreeNode node) {
        if (node.isLeaf()) {
            return LEAF;
        }
        boolean allZero = true;
        boolean anyZero = false;
        for (var child : ((InternalNode) node).childs) {
            if (child.length == 0) {
                anyZero = true;
            } else {
                allZero = false;
            }
        }
        if (node.length > 0 && allZero) return FULL;
        if (node.length > 0 && anyZero) return PARTIAL;
        if (node.length == 0 && !anyZero) return ANTI;
        return NONE;
    }

    /**
     * FULL and PARTIAL edges are the ones compared between two trees.
     */
    public boolean isSEdge() {
        return this == FULL || this == PARTIAL;
    }
}
