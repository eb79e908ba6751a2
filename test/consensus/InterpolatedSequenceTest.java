package consensus;

import java.util.List;

import org.junit.jupiter.api.Test;

import preprocessing.TreeSequence;
import tree.Tree;

import static org.junit.jupiter.api.Assertions.*;

class InterpolatedSequenceTest {

    @Test
    void inserts_four_trees_between_each_pair() {
        TreeSequence input = TreeSequence.decode("(A,B,(C,D));\n(A,C,(B,D));\n((A,B),C,D);\n", null);
        InterpolatedSequence sequence = InterpolatedSequence.build(input.trees);

        assertEquals(11, sequence.size());
        for (int i = 0; i < input.size(); i++) {
            Tree tree = sequence.get(InterpolatedSequence.positionOfInput(i));
            assertEquals(input.trees.get(i).getNewickFormat(), tree.getNewickFormat());
            assertNotSame(input.trees.get(i), tree);
        }
        for (Tree tree : sequence.getTrees()) {
            assertEquals(4, tree.leavesCount);
        }
    }

    @Test
    void ramp_trees_sit_next_to_their_source() {
        TreeSequence input = TreeSequence.decode("(A,B,(C,D));\n(A,C,(B,D));\n", null);
        List<Tree> trees = InterpolatedSequence.build(input.trees).getTrees();

        assertEquals("(A:1.0,B:1.0,(C:1.0,D:1.0):0.0):1.0;", trees.get(1).getNewickFormat());
        assertEquals("(A:1.0,B:1.0,C:1.0,D:1.0):1.0;", trees.get(2).getNewickFormat());
        // spliced in at the position of the removed (B,D) node
        assertEquals("(A:1.0,B:1.0,D:1.0,C:1.0):1.0;", trees.get(3).getNewickFormat());
        assertEquals("(A:1.0,(B:1.0,D:1.0):0.0,C:1.0):1.0;", trees.get(4).getNewickFormat());
    }

    @Test
    void single_tree_is_returned_alone() {
        TreeSequence input = TreeSequence.decode("(A,B,C);", null);

        assertEquals(1, InterpolatedSequence.build(input.trees).size());
    }
}
