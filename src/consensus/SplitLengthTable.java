package consensus;

import java.util.HashMap;
import java.util.Map;
import java.util.TreeSet;

import tree.Split;
import tree.Tree;
import tree.TreeNode;

/**
 * Branch lengths of two trees keyed by split. A split is shared when both
 * trees contain a node with exactly that leaf set.
 */
public class SplitLengthTable {

    private final Map<Split, Double> lengthsA;
    private final Map<Split, Double> lengthsB;

    public SplitLengthTable(Tree a, Tree b) {
        this.lengthsA = collect(a);
        this.lengthsB = collect(b);
    }

    private static Map<Split, Double> collect(Tree tree) {
        Split[] splits = tree.computeSplits();
        Map<Split, Double> lengths = new HashMap<>();
        for (TreeNode node : tree.topSortedNodes) {
            if (lengths.put(splits[node.index], node.length) != null) {
                throw new IllegalStateException("Duplicate split " + splits[node.index]
                        + " (unary node?)");
            }
        }
        return lengths;
    }

    public boolean isShared(Split split) {
        return lengthsA.containsKey(split) && lengthsB.containsKey(split);
    }

    /**
     * Mean of the two lengths of a shared split, 0 for a unique one.
     */
    public double consensusLength(Split split) {
        if (!isShared(split)) {
            return 0.0;
        }
        return (lengthsA.get(split) + lengthsB.get(split)) / 2.0;
    }

    public TreeSet<Split> sharedSplits() {
        TreeSet<Split> shared = new TreeSet<>();
        for (Split split : lengthsA.keySet()) {
            if (lengthsB.containsKey(split)) {
                shared.add(split);
            }
        }
        return shared;
    }
}
