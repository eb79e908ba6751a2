package tree;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import taxon.Taxon;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parsing, copying and editing of arena trees.
 */
class TreeTest {

    static Map<String, Taxon> taxa(String... labels) {
        Map<String, Taxon> map = new LinkedHashMap<>();
        for (String label : labels) {
            map.put(label, new Taxon(map.size(), label));
        }
        return map;
    }

    @Test
    void parses_leaves_in_document_order_with_lengths() {
        Map<String, Taxon> map = new LinkedHashMap<>();
        Tree tree = new Tree("((A:1,B:2):3,C:4);", map, true);

        assertEquals(List.of("A", "B", "C"), List.copyOf(map.keySet()));
        assertEquals(3, tree.leavesCount);
        assertEquals(2.0, tree.leaves[1].length);
        assertEquals(3.0, ((InternalNode) tree.root).childs.get(0).length);
        assertEquals(4.0, tree.leaves[2].length);
    }

    @Test
    void missing_lengths_default_to_one() {
        Tree tree = new Tree("(A,B,(C,D));", new LinkedHashMap<>(), true);

        assertEquals(1.0, tree.root.length);
        for (TreeNode node : tree.topSort()) {
            assertEquals(1.0, node.length);
        }
    }

    @Test
    void single_child_root_wrapper_is_collapsed() {
        Tree tree = new Tree("((A:1,B:1,C:1):2);", new LinkedHashMap<>(), true);

        assertFalse(tree.root.isLeaf());
        assertEquals(3, ((InternalNode) tree.root).childs.size());
        assertEquals(2.0, tree.root.length);
        assertNull(tree.root.parent);
    }

    @Test
    void single_child_internal_nodes_are_spliced_out() {
        Map<String, Taxon> map = taxa("A", "B", "C", "D");
        Tree tree = new Tree("(((A:1):2):3,(B:1,C:1):1,D:1);", map);

        assertEquals(4, tree.leavesCount);
        assertSame(tree.root, tree.leaves[0].parent);
        assertEquals(1.0, tree.leaves[0].length);
        assertEquals("(A:1.0,(B:1.0,C:1.0):1.0,D:1.0):1.0;", tree.getNewickFormat());
    }

    @Test
    void quoted_labels_keep_special_characters() {
        Map<String, Taxon> map = new LinkedHashMap<>();
        Tree tree = new Tree("('A b':1,'it''s':2,C:3);", map, true);

        assertTrue(map.containsKey("A b"));
        assertTrue(map.containsKey("it's"));
        assertEquals("('A b':1.0,'it''s':2.0,C:3.0):1.0;", tree.getNewickFormat());
    }

    @Test
    void comments_inside_newick_are_ignored() {
        Tree tree = new Tree("[&R] (A:1,[inner] B:2);", new LinkedHashMap<>(), true);

        assertEquals(2, tree.leavesCount);
        assertEquals("(A:1.0,B:2.0):1.0;", tree.getNewickFormat());
    }

    @Test
    void malformed_newick_is_rejected() {
        assertThrows(RuntimeException.class, () -> new Tree("((A,B);", new LinkedHashMap<>(), true));
        assertThrows(RuntimeException.class, () -> new Tree("(A,,B);", new LinkedHashMap<>(), true));
        assertThrows(RuntimeException.class, () -> new Tree("(A,B));", new LinkedHashMap<>(), true));
        assertThrows(RuntimeException.class, () -> new Tree("(A,B); (C,D);", new LinkedHashMap<>(), true));
        assertThrows(RuntimeException.class, () -> new Tree("(A:x,B);", new LinkedHashMap<>(), true));
        assertThrows(RuntimeException.class, () -> new Tree("(A:-1,B);", new LinkedHashMap<>(), true));
    }

    @Test
    void duplicate_and_unknown_taxa_are_rejected() {
        assertThrows(RuntimeException.class, () -> new Tree("(A,A,B);", new LinkedHashMap<>(), true));
        assertThrows(RuntimeException.class, () -> new Tree("(A,B,X);", taxa("A", "B", "C")));
    }

    @Test
    void newick_output_round_trips() {
        Map<String, Taxon> map = taxa("A", "B", "C");
        Tree tree = new Tree("((A:0.5,B:1.5):2.0,C:3.0);", map);
        String newick = tree.getNewickFormat();

        assertEquals("((A:0.5,B:1.5):2.0,C:3.0):1.0;", newick);
        assertEquals(newick, new Tree(newick, map).getNewickFormat());
    }

    @Test
    void sort_by_leaf_order_puts_children_in_canonical_order() {
        Tree tree = new Tree("((D,C),(B,A));", taxa("A", "B", "C", "D"));
        tree.sortByLeafOrder();

        assertEquals("((A:1.0,B:1.0):1.0,(C:1.0,D:1.0):1.0):1.0;", tree.getNewickFormat());
    }

    @Test
    void copy_does_not_alias_the_source() {
        Tree tree = new Tree("((A:1,B:1):1,C:1);", taxa("A", "B", "C"));
        Tree copy = tree.copy();
        copy.leaves[0].setLength(7.0);

        assertEquals(1.0, tree.leaves[0].length);
        assertNotSame(tree.root, copy.root);
        assertEquals(tree.leavesCount, copy.leavesCount);
    }

    @Test
    void collapsing_an_edge_moves_its_children_into_the_parent() {
        Tree tree = new Tree("((A,B,C),D);", taxa("A", "B", "C", "D"));
        InternalNode root = (InternalNode) tree.root;
        InternalNode inner = (InternalNode) root.childs.get(0);

        int moved = tree.collapseEdge(inner);

        assertEquals(3, moved);
        assertEquals(4, root.childs.size());
        assertEquals("(A:1.0,B:1.0,C:1.0,D:1.0):1.0;", tree.getNewickFormat());
        for (TreeNode child : root.childs) {
            assertSame(root, child.parent);
        }
    }

    @Test
    void collapsing_the_root_is_rejected() {
        Tree tree = new Tree("(A,B);", taxa("A", "B"));
        assertThrows(IllegalArgumentException.class, () -> tree.collapseEdge((InternalNode) tree.root));
    }

    @Test
    void removing_a_leaf_splices_out_its_parent() {
        Tree tree = new Tree("((A,B),(C,D));", taxa("A", "B", "C", "D"));
        Tree pruned = tree.removeLeaves(List.of(1));

        assertEquals(3, pruned.leavesCount);
        assertFalse(pruned.isTaxonPresent(1));
        assertEquals(List.of(0, 2, 3), pruned.getTaxonIds());
        assertEquals("(A:1.0,(C:1.0,D:1.0):1.0):1.0;", pruned.getNewickFormat());
        assertEquals(4, tree.leavesCount);
    }

    @Test
    void removing_leaves_collapses_a_single_child_root() {
        Tree tree = new Tree("((A:1,B:1):2,C:1);", taxa("A", "B", "C"));
        Tree pruned = tree.removeLeaves(List.of(2));

        assertEquals("(A:1.0,B:1.0):2.0;", pruned.getNewickFormat());
    }

    @Test
    void splits_are_indexed_by_arena_slot() {
        Tree tree = new Tree("((A,B),C);", taxa("A", "B", "C"));
        Split[] splits = tree.computeSplits();

        assertEquals(Split.of(0, 1, 2), splits[tree.root.index]);
        assertEquals(Split.of(0, 1), splits[((InternalNode) tree.root).childs.get(0).index]);
        assertEquals(Split.of(2), splits[tree.leaves[2].index]);
    }
}
