package consensus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import tree.Tree;
import utils.Config;

/**
 * The animation sequence: every input tree followed by the four intermediate
 * trees leading to the next one.
 *
 * <pre>
 * [T0, rampDown, collapseFirst, collapseSecond, rampUp, T1, rampDown, ...]
 * </pre>
 *
 * n input trees give 5(n-1)+1 trees.
 */
public class InterpolatedSequence {

    public static final int STRIDE = Config.CONSENSUS_TREES_PER_PAIR + 1;

    private final List<Tree> trees;

    private InterpolatedSequence(List<Tree> trees) {
        this.trees = trees;
    }

    public static InterpolatedSequence build(List<Tree> inputTrees) {
        List<Tree> result = new ArrayList<>();
        for (int i = 0; i < inputTrees.size(); i++) {
            result.add(inputTrees.get(i).copy());
            if (i + 1 < inputTrees.size()) {
                ConsensusTreeBuilder builder = new ConsensusTreeBuilder(inputTrees.get(i), inputTrees.get(i + 1));
                result.add(builder.rampDown());
                result.add(builder.collapseFirst());
                result.add(builder.collapseSecond());
                result.add(builder.rampUp());
            }
        }
        if (Config.VERBOSE) {
            System.out.println("Interpolated " + inputTrees.size() + " trees into " + result.size());
        }
        return new InterpolatedSequence(result);
    }

    public List<Tree> getTrees() {
        return Collections.unmodifiableList(trees);
    }

    public int size() {
        return trees.size();
    }

    /**
     * Position of input tree i in the interpolated list.
     */
    public static int positionOfInput(int inputIndex) {
        return inputIndex * STRIDE;
    }

    public Tree get(int position) {
        return trees.get(position);
    }
}
