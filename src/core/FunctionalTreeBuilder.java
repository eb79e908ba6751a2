package core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import tree.EdgeType;
import tree.InternalNode;
import tree.Split;
import tree.Tree;
import tree.TreeNode;

/**
 * Builds a {@link FunctionalTree} in a single post-order pass.
 *
 * The arm of a child is the child itself when its edge has a length or it is
 * a leaf; a zero-length internal child is transparent and contributes the
 * arms of its own children.
 */
public class FunctionalTreeBuilder {

    public static FunctionalTree build(Tree tree) {
        Split[] splits = tree.computeSplits();
        ComponentSet[] armOf = new ComponentSet[tree.nodes.size()];

        List<Split> sEdges = new ArrayList<>();
        Map<Split, EdgeType> edgeTypes = new HashMap<>();
        Map<Split, Split> ancestorEdges = new HashMap<>();
        Map<Split, List<ComponentSet>> arms = new HashMap<>();

        for (TreeNode node : tree.topSortedNodes) {
            Split id = splits[node.index];
            EdgeType type = EdgeType.classify(node);
            if (edgeTypes.put(id, type) != null) {
                throw new IllegalStateException("Duplicate node identity " + id);
            }
            if (type.isSEdge()) {
                sEdges.add(id);
            }

            if (node.isLeaf() || node.length != 0) {
                armOf[node.index] = ComponentSet.of(id);
            } else {
                ComponentSet merged = ComponentSet.EMPTY;
                for (var child : ((InternalNode) node).childs) {
                    merged = merged.union(armOf[child.index]);
                }
                armOf[node.index] = merged;
            }

            if (!node.isLeaf()) {
                List<ComponentSet> edgeArms = new ArrayList<>();
                for (var child : ((InternalNode) node).childs) {
                    edgeArms.add(armOf[child.index]);
                    if (ancestorEdges.put(splits[child.index], id) != null) {
                        throw new IllegalStateException("Duplicate node identity " + splits[child.index]);
                    }
                }
                arms.put(id, edgeArms);
            }
        }

        Collections.sort(sEdges);
        return new FunctionalTree(sEdges, edgeTypes, ancestorEdges, arms);
    }
}
