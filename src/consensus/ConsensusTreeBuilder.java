package consensus;

import java.util.ArrayList;

import tree.InternalNode;
import tree.Split;
import tree.Tree;
import tree.TreeNode;
import utils.Config;

/**
 * Builds the four intermediate trees between two consecutive trees.
 *
 * Both ramp trees keep the topology of their source tree and carry the mean
 * length on shared splits and 0 on unique ones. The collapse trees remove the
 * unique internal edges of their source tree altogether. Every result is a
 * fresh copy; the two input trees are never modified.
 */
public class ConsensusTreeBuilder {

    private final Tree first;
    private final Tree second;
    private final SplitLengthTable table;

    public ConsensusTreeBuilder(Tree first, Tree second) {
        this.first = first;
        this.second = second;
        this.table = new SplitLengthTable(first, second);
    }

    /**
     * Topology of the first tree, unique splits shrunk to length 0.
     */
    public Tree rampDown() {
        return ramp(first);
    }

    /**
     * Topology of the second tree, unique splits shrunk to length 0.
     */
    public Tree rampUp() {
        return ramp(second);
    }

    /**
     * The first tree without its unique internal edges.
     */
    public Tree collapseFirst() {
        return collapse(first);
    }

    /**
     * The second tree without its unique internal edges.
     */
    public Tree collapseSecond() {
        return collapse(second);
    }

    private Tree ramp(Tree source) {
        Tree tree = source.copy();
        Split[] splits = tree.computeSplits();
        for (TreeNode node : tree.topSortedNodes) {
            node.setLength(table.consensusLength(splits[node.index]));
        }
        return tree;
    }

    private Tree collapse(Tree source) {
        Tree tree = ramp(source);
        Split[] splits = tree.computeSplits();
        // Post-order: a unique node's children are final before it is dissolved
        ArrayList<TreeNode> order = new ArrayList<>(tree.topSortedNodes);
        int removed = 0;
        for (TreeNode node : order) {
            if (node.isLeaf() || node.isRoot()) {
                continue;
            }
            if (!table.isShared(splits[node.index])) {
                tree.collapseEdge((InternalNode) node);
                removed++;
            }
        }
        if (Config.VERBOSE && removed > 0) {
            System.out.println("Collapsed " + removed + " unique edge(s)");
        }
        return tree.copy();
    }
}
