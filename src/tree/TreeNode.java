package tree;

/**
 * Node of an arena-backed {@link Tree}. A node is either a {@link LeafNode}
 * carrying a taxon or an {@link InternalNode} carrying an ordered child list.
 *
 * The index is the node's slot in the owning tree's arena; the length is the
 * branch length of the edge above the node.
 */
public abstract class TreeNode {

    public int index;
    public double length;
    public InternalNode parent;

    public TreeNode setIndex(int index) {
        this.index = index;
        return this;
    }

    public TreeNode setLength(double length) {
        this.length = length;
        return this;
    }

    public TreeNode setParent(InternalNode parent) {
        this.parent = parent;
        return this;
    }

    public abstract boolean isLeaf();

    /**
     * Label written to Newick output, empty for unlabelled internal nodes.
     */
    public abstract String getLabel();

    public boolean isRoot() {
        return parent == null;
    }
}
