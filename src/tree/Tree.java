package tree;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Comparator;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Stack;

import taxon.Taxon;
import utils.Config;

/**
 * Tree: arena-backed phylogenetic tree.
 *
 * Every node lives in the {@code nodes} list and knows its slot through
 * {@link TreeNode#index}, so per-node data (splits, first leaf ids) is kept in
 * plain arrays indexed by that slot. Trees are treated as values by the
 * pipeline: consensus construction and pruning always work on a fresh arena
 * obtained from {@link #copy()}, so a synthesized tree never aliases the tree
 * it was derived from.
 *
 * All traversals are stack-based; tree depth never turns into call depth.
 */
public class Tree {

    // Core tree structure
    public ArrayList<TreeNode> nodes;               // All nodes in the arena (internal + leaves)
    public ArrayList<TreeNode> topSortedNodes;      // Reachable nodes in post-order

    public TreeNode root;                           // Root node of the tree
    public Map<String, Taxon> taxaMap;              // Mapping from taxon names to Taxon objects

    public LeafNode[] leaves;                       // Leaf nodes by taxon ID, null when absent
    public int leavesCount;                         // Number of leaves in tree

    private String source;                          // Newick text while parsing
    private int pos;                                // Parse cursor

    public LeafNode addLeaf(Taxon taxon, double length) {
        LeafNode nd = new LeafNode(taxon);
        nd.setIndex(nodes.size()).setLength(length);
        nodes.add(nd);
        return nd;
    }

    public InternalNode addInternalNode(ArrayList<TreeNode> children, String label, double length) {
        InternalNode nd = new InternalNode(children, label);
        nd.setIndex(nodes.size()).setLength(length);
        nodes.add(nd);
        for (var x : children)
            x.setParent(nd);
        return nd;
    }

    /**
     * Parses a tree with a fixed taxon mapping; an unknown leaf label is an error.
     */
    public Tree(String newickLine, Map<String, Taxon> taxaMap) {
        this(newickLine, taxaMap, false);
    }

    /**
     * Parses a tree. With {@code registerTaxa} set, leaf labels missing from
     * the mapping are added to it with the next free id, which numbers the
     * leaves of the first tree in document order.
     */
    public Tree(String newickLine, Map<String, Taxon> taxaMap, boolean registerTaxa) {
        this.taxaMap = taxaMap;
        parseFromNewick(newickLine, registerTaxa);
    }

    public Tree() {
        taxaMap = null;
        nodes = new ArrayList<>();
    }

    /**
     * Stack-based Newick parser. An open parenthesis pushes a null sentinel;
     * a close parenthesis pops everything down to the sentinel and turns it
     * into the children of a new internal node.
     */
    private void parseFromNewick(String newickLine, boolean registerTaxa) {
        nodes = new ArrayList<>();
        Stack<TreeNode> stack = new Stack<>();
        source = newickLine;
        pos = 0;

        int n = source.length();
        int depth = 0;
        boolean nodeClosed = false;
        boolean terminated = false;

        while (!terminated) {
            skipBlank();
            if (pos >= n) break;
            char curr = source.charAt(pos);
            if (curr == '(') {
                if (nodeClosed) {
                    throw new RuntimeException("Invalid tree: unexpected '(' at position " + pos);
                }
                stack.push(null);
                depth++;
                pos++;
            }
            else if (curr == ')') {
                if (depth == 0 || !nodeClosed) {
                    throw new RuntimeException("Invalid tree: unexpected ')' at position " + pos);
                }
                ArrayList<TreeNode> children = new ArrayList<>();
                while (stack.peek() != null) {
                    children.add(stack.pop());
                }
                stack.pop();
                depth--;
                Collections.reverse(children);
                pos++;
                String label = readLabel();
                double length = readLength();
                stack.push(addInternalNode(children, label, length));
                nodeClosed = true;
            }
            else if (curr == ',') {
                if (depth == 0 || !nodeClosed) {
                    throw new RuntimeException("Invalid tree: unexpected ',' at position " + pos);
                }
                nodeClosed = false;
                pos++;
            }
            else if (curr == ';') {
                terminated = true;
                pos++;
            }
            else {
                if (nodeClosed) {
                    throw new RuntimeException("Invalid tree: unexpected label at position " + pos);
                }
                String label = readLabel();
                if (label.isEmpty()) {
                    throw new RuntimeException("Invalid tree: unexpected '" + curr + "' at position " + pos);
                }
                Taxon taxon = taxaMap.get(label);
                if (taxon == null) {
                    if (!registerTaxa) {
                        throw new RuntimeException("Unknown taxon: " + label);
                    }
                    taxon = new Taxon(taxaMap.size(), label);
                    taxaMap.put(label, taxon);
                }
                stack.push(addLeaf(taxon, readLength()));
                nodeClosed = true;
            }
        }

        skipBlank();
        if (pos < n) {
            throw new RuntimeException("Invalid tree: trailing text after ';' at position " + pos);
        }
        if (depth != 0) {
            throw new RuntimeException("Invalid tree: " + depth + " unclosed '('");
        }
        if (stack.size() != 1) {
            throw new RuntimeException("Invalid tree: expected one root, found " + stack.size());
        }
        source = null;

        root = stack.pop();
        collapseRootWrapper();
        spliceUnaryNodes();
        filterLeaves();
    }

    private void skipBlank() {
        int n = source.length();
        while (pos < n) {
            char c = source.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '[') {
                int end = source.indexOf(']', pos);
                if (end < 0) {
                    throw new RuntimeException("Invalid tree: unclosed comment at position " + pos);
                }
                pos = end + 1;
            } else {
                break;
            }
        }
    }

    private String readLabel() {
        skipBlank();
        int n = source.length();
        StringBuilder sb = new StringBuilder();
        if (pos < n && source.charAt(pos) == '\'') {
            pos++;
            while (true) {
                if (pos >= n) {
                    throw new RuntimeException("Invalid tree: unclosed quoted label");
                }
                char c = source.charAt(pos++);
                if (c == '\'') {
                    if (pos < n && source.charAt(pos) == '\'') {
                        sb.append('\'');
                        pos++;
                    } else {
                        break;
                    }
                } else {
                    sb.append(c);
                }
            }
            return sb.toString();
        }
        while (pos < n) {
            char c = source.charAt(pos);
            if (c == '(' || c == ')' || c == ',' || c == ':' || c == ';' || c == '['
                    || Character.isWhitespace(c)) {
                break;
            }
            sb.append(c);
            pos++;
        }
        return sb.toString();
    }

    private double readLength() {
        skipBlank();
        int n = source.length();
        if (pos >= n || source.charAt(pos) != ':') {
            return Config.DEFAULT_BRANCH_LENGTH;
        }
        pos++;
        skipBlank();
        int start = pos;
        while (pos < n) {
            char c = source.charAt(pos);
            if (c == ',' || c == ')' || c == ';' || c == '[' || Character.isWhitespace(c)) {
                break;
            }
            pos++;
        }
        String text = source.substring(start, pos);
        double length;
        try {
            length = Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new RuntimeException("Invalid branch length '" + text + "' at position " + start);
        }
        if (length < 0 || Double.isNaN(length) || Double.isInfinite(length)) {
            throw new RuntimeException("Invalid branch length '" + text + "' at position " + start);
        }
        return length;
    }

    /**
     * Replaces a root that has a single child by that child, repeatedly.
     */
    private void collapseRootWrapper() {
        while (!root.isLeaf() && ((InternalNode) root).childs.size() == 1) {
            root = ((InternalNode) root).childs.get(0);
            root.setParent(null);
        }
    }

    /**
     * Splices out every non-root internal node with a single child. The child
     * takes the node's place and keeps its own branch length.
     */
    private void spliceUnaryNodes() {
        for (var node : topSort()) {
            if (node != root && !node.isLeaf() && ((InternalNode) node).childs.size() == 1) {
                collapseEdge((InternalNode) node);
            }
        }
    }

    /**
     * Creates the fast-access array for leaf nodes indexed by taxon ID.
     */
    private void filterLeaves() {
        this.leaves = new LeafNode[this.taxaMap.size()];
        int count = 0;
        for (var x : topSort()) {
            if (x.isLeaf()) {
                LeafNode leaf = (LeafNode) x;
                if (this.leaves[leaf.taxon.id] != null) {
                    throw new RuntimeException("Duplicate taxon: " + leaf.taxon.label);
                }
                this.leaves[leaf.taxon.id] = leaf;
                count++;
            }
        }
        this.leavesCount = count;
    }

    /**
     * Reachable nodes in post-order (children left to right, then the parent).
     * Uses two explicit stacks instead of recursion.
     */
    public ArrayList<TreeNode> topSort() {
        ArrayList<TreeNode> reversed = new ArrayList<>();
        Stack<TreeNode> stack = new Stack<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TreeNode node = stack.pop();
            reversed.add(node);
            if (!node.isLeaf()) {
                for (var x : ((InternalNode) node).childs) {
                    stack.push(x);
                }
            }
        }
        Collections.reverse(reversed);
        this.topSortedNodes = reversed;
        return reversed;
    }

    /**
     * Computes the split of every reachable node, indexed by arena slot.
     */
    public Split[] computeSplits() {
        BitSet[] clusters = new BitSet[nodes.size()];
        Split[] splits = new Split[nodes.size()];
        for (var node : topSort()) {
            BitSet cluster = new BitSet(taxaMap.size());
            if (node.isLeaf()) {
                cluster.set(((LeafNode) node).taxon.id);
            } else {
                for (var child : ((InternalNode) node).childs) {
                    cluster.or(clusters[child.index]);
                }
            }
            clusters[node.index] = cluster;
            splits[node.index] = new Split(cluster);
        }
        return splits;
    }

    /**
     * Orders the children of every internal node by their smallest leaf id,
     * so that trees differing only by child rotation become identical.
     */
    public void sortByLeafOrder() {
        int[] firstLeaf = new int[nodes.size()];
        for (var node : topSort()) {
            if (node.isLeaf()) {
                firstLeaf[node.index] = ((LeafNode) node).taxon.id;
            } else {
                var childs = ((InternalNode) node).childs;
                childs.sort(Comparator.comparingInt(c -> firstLeaf[c.index]));
                firstLeaf[node.index] = firstLeaf[childs.get(0).index];
            }
        }
    }

    /**
     * Deep copy into a fresh, compact arena. Only nodes reachable from the
     * root are copied; the taxon mapping is shared since taxa are immutable.
     */
    public Tree copy() {
        Tree tree = new Tree();
        tree.taxaMap = this.taxaMap;
        TreeNode[] copies = new TreeNode[nodes.size()];
        for (var node : topSort()) {
            if (node.isLeaf()) {
                copies[node.index] = tree.addLeaf(((LeafNode) node).taxon, node.length);
            } else {
                InternalNode internal = (InternalNode) node;
                ArrayList<TreeNode> children = new ArrayList<>(internal.childs.size());
                for (var child : internal.childs) {
                    children.add(copies[child.index]);
                }
                copies[node.index] = tree.addInternalNode(children, internal.label, node.length);
            }
        }
        tree.root = copies[root.index];
        tree.filterLeaves();
        return tree;
    }

    /**
     * Removes an internal edge: the node's children take its place in the
     * parent's child list, in order. Returns the number of children moved.
     */
    public int collapseEdge(InternalNode node) {
        InternalNode parent = node.parent;
        if (parent == null) {
            throw new IllegalArgumentException("Cannot collapse the root edge");
        }
        int position = parent.childs.indexOf(node);
        parent.childs.remove(position);
        parent.childs.addAll(position, node.childs);
        for (var child : node.childs) {
            child.setParent(parent);
        }
        int moved = node.childs.size();
        node.childs = new ArrayList<>();
        node.setParent(null);
        return moved;
    }

    /**
     * Returns a copy of this tree without the given taxa. A node left with a
     * single child is spliced out, and a root left with a single child is
     * replaced by it. Branch lengths of the surviving nodes are unchanged.
     */
    public Tree removeLeaves(Collection<Integer> taxonIds) {
        Tree pruned = copy();
        for (int id : taxonIds) {
            LeafNode leaf = pruned.leaves[id];
            if (leaf == null) {
                continue;
            }
            InternalNode parent = leaf.parent;
            if (parent == null) {
                throw new IllegalArgumentException("Cannot remove the last leaf of a tree");
            }
            parent.childs.remove(leaf);
            leaf.setParent(null);
            pruned.leaves[id] = null;
            pruned.dissolveUnderfull(parent);
        }
        return pruned.copy();
    }

    private void dissolveUnderfull(InternalNode node) {
        InternalNode current = node;
        while (current != null && current.childs.size() < 2) {
            InternalNode parent = current.parent;
            if (parent == null) {
                if (current.childs.size() == 1) {
                    root = current.childs.get(0);
                    root.setParent(null);
                }
                return;
            }
            collapseEdge(current);
            current = parent;
        }
    }

    public boolean isTaxonPresent(int id) {
        return id < this.leaves.length && this.leaves[id] != null;
    }

    /**
     * Ids of the taxa present in this tree, ascending.
     */
    public List<Integer> getTaxonIds() {
        List<Integer> ids = new ArrayList<>();
        for (int i = 0; i < leaves.length; ++i) {
            if (leaves[i] != null) {
                ids.add(i);
            }
        }
        return ids;
    }

    public String getNewickFormat() {
        if (root == null) return "";
        StringBuilder sb = new StringBuilder();
        Stack<TreeNode> stack = new Stack<>();
        Stack<Integer> cursor = new Stack<>();
        stack.push(root);
        cursor.push(0);
        while (!stack.isEmpty()) {
            TreeNode node = stack.peek();
            int next = cursor.pop();
            if (node.isLeaf()) {
                appendNode(sb, node);
                stack.pop();
                continue;
            }
            var childs = ((InternalNode) node).childs;
            if (next == 0) {
                sb.append('(');
            }
            if (next < childs.size()) {
                if (next > 0) {
                    sb.append(',');
                }
                cursor.push(next + 1);
                stack.push(childs.get(next));
                cursor.push(0);
            } else {
                sb.append(')');
                appendNode(sb, node);
                stack.pop();
            }
        }
        return sb.append(';').toString();
    }

    private static void appendNode(StringBuilder sb, TreeNode node) {
        String label = node.getLabel();
        if (needsQuotes(label)) {
            sb.append('\'').append(label.replace("'", "''")).append('\'');
        } else {
            sb.append(label);
        }
        sb.append(':').append(node.length);
    }

    private static boolean needsQuotes(String label) {
        for (int i = 0; i < label.length(); ++i) {
            char c = label.charAt(i);
            if ("()[]':;,".indexOf(c) >= 0 || Character.isWhitespace(c)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return getNewickFormat();
    }
}
