package core;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import preprocessing.TreeSequence;
import taxon.Taxon;
import tree.Tree;
import tree.UnaryTrees;
import utils.Config;

import static org.junit.jupiter.api.Assertions.*;

class JumpTaxaFinderTest {

    private static JumpTaxaResult findFirstPair(String text) {
        TreeSequence sequence = TreeSequence.decode(text, null);
        return new JumpTaxaFinder(sequence.taxonIdToLabel).find(0, sequence.trees.get(0), sequence.trees.get(1));
    }

    @Test
    void identical_trees_have_no_jumping_taxa() {
        JumpTaxaResult result = findFirstPair("(A,B,(C,D));\n(A,B,(C,D));\n");

        assertTrue(result.taxa.isEmpty());
        assertEquals(1, result.rounds);
        assertFalse(result.failed);
    }

    @Test
    void child_rotation_is_not_a_jump() {
        JumpTaxaResult result = findFirstPair("(A,B,(C,D));\n((D,C),B,A);\n");

        assertTrue(result.taxa.isEmpty());
    }

    @Test
    void simple_exchange_reports_one_exchanged_leaf_and_never_the_fixed_ones() {
        JumpTaxaResult result = findFirstPair("(A,B,(C,D));\n(A,C,(B,D));\n");

        assertFalse(result.failed);
        assertFalse(result.taxa.contains("A"));
        assertFalse(result.taxa.contains("D"));
        assertEquals(List.of("B"), result.taxa);
        assertEquals(List.of(1), result.taxonIds);
        assertEquals(1, result.rounds);
    }

    @Test
    void swapped_cherries_report_all_four_moved_leaves() {
        JumpTaxaResult result = findFirstPair("(((A,B),(C,D)),E,F);\n(((A,C),(B,D)),E,F);\n");

        assertEquals(List.of("A", "B", "C", "D"), result.taxa);
        assertEquals(1, result.rounds);
    }

    @Test
    void rounds_stay_within_leaf_count_minus_three() {
        String text = "((((A,B),C),(D,E)),((F,G),H));\n((((A,H),C),(D,G)),((F,E),B));\n";
        TreeSequence sequence = TreeSequence.decode(text, null);
        JumpTaxaFinder finder = new JumpTaxaFinder(sequence.taxonIdToLabel);

        JumpTaxaResult result = finder.find(0, sequence.trees.get(0), sequence.trees.get(1));
        JumpTaxaResult again = finder.find(0, sequence.trees.get(0), sequence.trees.get(1));

        assertTrue(result.rounds <= 8 - 3);
        assertEquals(result.taxa, again.taxa);
        assertEquals(result.rounds, again.rounds);
        assertTrue(sequence.getLeafOrder().containsAll(result.taxa));
    }

    @Test
    void later_rounds_prune_and_accumulate_taxa() {
        String text = "((A,(B,(C,(D,(E,(F,G)))))),H);\n((G,(F,(E,(D,(C,(B,A)))))),H);\n";
        TreeSequence sequence = TreeSequence.decode(text, null);
        JumpTaxaFinder finder = new JumpTaxaFinder(sequence.taxonIdToLabel);

        JumpTaxaResult result = finder.find(0, sequence.trees.get(0), sequence.trees.get(1));
        JumpTaxaResult again = finder.find(0, sequence.trees.get(0), sequence.trees.get(1));

        assertFalse(result.failed);
        assertEquals(5, result.rounds);
        assertEquals(List.of("A", "B", "C", "D", "E"), result.taxa);
        assertEquals(List.of(0, 1, 2, 3, 4), result.taxonIds);
        assertEquals(result.taxa, again.taxa);
        assertEquals(result.rounds, again.rounds);
    }

    @Test
    void round_limit_is_capped() {
        assertEquals(1, JumpTaxaFinder.roundLimit(3));
        assertEquals(1, JumpTaxaFinder.roundLimit(4));
        assertEquals(7, JumpTaxaFinder.roundLimit(10));

        int saved = Config.MAX_PRUNING_ROUNDS;
        try {
            Config.MAX_PRUNING_ROUNDS = 3;
            assertEquals(3, JumpTaxaFinder.roundLimit(10));
        } finally {
            Config.MAX_PRUNING_ROUNDS = saved;
        }
    }

    @Test
    void invariant_violation_marks_the_pair_as_failed() {
        Map<String, Taxon> map = FunctionalTreeBuilderTest.taxa("A", "B", "C", "D");
        Tree unary = UnaryTrees.wrapLeaf(new Tree("(A:1,B:1,C:1,D:1);", map), "A", 1);
        Tree flat = new Tree("(A:1,B:1,C:1,D:1);", map);
        String[] labels = {"A", "B", "C", "D"};

        JumpTaxaResult result = new JumpTaxaFinder(labels).find(3, unary, flat);

        assertTrue(result.failed);
        assertNotNull(result.message);
        assertTrue(result.taxa.isEmpty());
        assertEquals(3, result.pairIndex);
    }

    @Test
    void source_trees_are_not_modified() {
        TreeSequence sequence = TreeSequence.decode("(A,B,(C,D),E);\n(A,C,(B,D),E);\n", null);
        String before = sequence.trees.get(0).getNewickFormat();

        new JumpTaxaFinder(sequence.taxonIdToLabel).find(0, sequence.trees.get(0), sequence.trees.get(1));

        assertEquals(before, sequence.trees.get(0).getNewickFormat());
        assertEquals(5, sequence.trees.get(0).leavesCount);
    }
}
