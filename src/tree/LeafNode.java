package tree;

import taxon.Taxon;

public class LeafNode extends TreeNode {

    public final Taxon taxon;

    public LeafNode(Taxon taxon) {
        this.taxon = taxon;
    }

    @Override
    public boolean isLeaf() {
        return true;
    }

    @Override
    public String getLabel() {
        return taxon.label;
    }

    @Override
    public String toString() {
        return taxon.label + ":" + length;
    }
}
