package tree;

import java.util.ArrayList;

public class InternalNode extends TreeNode {

    public String label;
    public ArrayList<TreeNode> childs;

    public InternalNode(ArrayList<TreeNode> childs, String label) {
        this.childs = childs;
        this.label = label == null ? "" : label;
    }

    @Override
    public boolean isLeaf() {
        return false;
    }

    @Override
    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return "InternalNode[index=" + index + ", children=" + childs.size() + ", length=" + length + "]";
    }
}
