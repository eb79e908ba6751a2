package preprocessing;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

class TreeSequenceTest {

    @Test
    void first_tree_defines_the_leaf_order() {
        TreeSequence sequence = TreeSequence.decode("(A,B,(C,D));\n\n(A,C,(B,D));\n", null);

        assertFalse(sequence.isEmpty());
        assertEquals(2, sequence.size());
        assertEquals(4, sequence.realTaxaCount);
        assertEquals(List.of("A", "B", "C", "D"), sequence.getLeafOrder());
        assertNull(sequence.errorMessage);
    }

    @Test
    void valid_user_order_replaces_document_order() {
        TreeSequence sequence = TreeSequence.decode("((D,C),(B,A));", List.of("A", "B", "C", "D"));

        assertEquals(List.of("A", "B", "C", "D"), sequence.getLeafOrder());
        assertEquals(0, sequence.taxaMap.get("A").id);
        assertEquals("((A:1.0,B:1.0):1.0,(C:1.0,D:1.0):1.0):1.0;", sequence.trees.get(0).getNewickFormat());
    }

    @Test
    void invalid_user_order_falls_back_to_document_order() {
        TreeSequence sequence = TreeSequence.decode("(A,B,(C,D));", List.of("A", "B", "C", "X"));

        assertEquals(List.of("A", "B", "C", "D"), sequence.getLeafOrder());
    }

    @Test
    void order_check_rejects_duplicates() {
        List<String> parsed = List.of("A", "B", "C");

        assertSame(parsed, TreeSequence.checkOrderValidity(List.of("A", "B", "C", "C"), parsed));
        assertEquals(List.of("C", "B", "A"), TreeSequence.checkOrderValidity(List.of("C", "B", "A"), parsed));
    }

    @Test
    void malformed_input_gives_an_empty_sequence() {
        TreeSequence sequence = TreeSequence.decode("(A,B;", null);

        assertTrue(sequence.isEmpty());
        assertNotNull(sequence.errorMessage);
        assertTrue(TreeSequence.decode("   \n", null).isEmpty());
        assertTrue(TreeSequence.decode(null, null).isEmpty());
    }

    @Test
    void every_tree_must_have_the_same_leaves() {
        assertTrue(TreeSequence.decode("(A,B,C);\n(A,B);", null).isEmpty());
        assertTrue(TreeSequence.decode("(A,B,C);\n(A,B,D);", null).isEmpty());
        assertTrue(TreeSequence.decode("(A,B,C);\n(A,B,C,C);", null).isEmpty());
    }

    @Test
    void children_are_sorted_by_smallest_leaf() {
        TreeSequence sequence = TreeSequence.decode("(A,B,(C,D));\n((D,C),B,A);", null);

        assertEquals(sequence.trees.get(0).getNewickFormat(), sequence.trees.get(1).getNewickFormat());
    }

    @Test
    void selection_keeps_every_step_and_the_last_tree() {
        List<String> lines = List.of("t1", "t2", "t3", "t4", "t5", "t6");

        assertEquals(List.of("t2", "t4", "t6"), TreeSequence.select(lines, 2, 2));
        assertEquals(List.of("t1", "t5", "t6"), TreeSequence.select(lines, 1, 4));
        assertEquals(lines, TreeSequence.select(lines, 1, 1));
        assertEquals(List.of(), TreeSequence.select(lines, 7, 1));
        assertThrows(IllegalArgumentException.class, () -> TreeSequence.select(lines, 0, 1));
    }

    @Test
    void sampling_applies_to_decoding() {
        String text = "(A,B,C);\n((A,B),C);\n(A,(B,C));\n((A,C),B);\n";
        TreeSequence sequence = TreeSequence.decode(text, null, 2, 2);

        assertEquals(2, sequence.size());
        assertEquals("((A:1.0,B:1.0):1.0,C:1.0):1.0;", sequence.trees.get(0).getNewickFormat());
    }

    @Test
    void decodes_nexus_documents() {
        TreeSequence sequence = TreeSequence.decode(NexusReaderTest.NEXUS, null);

        assertEquals(2, sequence.size());
        assertEquals(List.of("A", "B", "C c"), sequence.getLeafOrder());
    }

    @Test
    void reads_leaf_order_file(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("order.txt");
        Files.writeString(file, "B\n\n  A \nC\n");

        assertEquals(List.of("B", "A", "C"), TreeSequence.readLeafOrder(file));
    }
}
