package core;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

import consensus.ConsensusTreeBuilder;
import tree.Tree;
import utils.Config;

/**
 * Iterated jump-taxa search for one pair of trees.
 *
 * Each round votes on the ramp trees of the current pair, adds the found
 * leaves to the result and removes them from both trees. The search stops
 * when a round finds nothing, when fewer than
 * {@link Config#MIN_REMAINING_LEAVES} leaves would remain, or after
 * min({@link Config#MAX_PRUNING_ROUNDS}, n - 3) rounds.
 */
public class JumpTaxaFinder {

    private final String[] taxonIdToLabel;

    public JumpTaxaFinder(String[] taxonIdToLabel) {
        this.taxonIdToLabel = taxonIdToLabel;
    }

    public static int roundLimit(int leafCount) {
        return Math.max(1, Math.min(Config.MAX_PRUNING_ROUNDS, leafCount - 3));
    }

    /**
     * Never throws for a bad pair; the failure is reported in the result.
     */
    public JumpTaxaResult find(int pairIndex, Tree first, Tree second) {
        try {
            return search(pairIndex, first, second);
        } catch (IllegalStateException | IllegalArgumentException e) {
            System.err.println("Error: Jumping taxa search failed for pair " + pairIndex + ": " + e.getMessage());
            return JumpTaxaResult.failure(pairIndex, e.getMessage());
        }
    }

    private JumpTaxaResult search(int pairIndex, Tree first, Tree second) {
        Tree a = first.copy();
        Tree b = second.copy();
        if (a.leavesCount != b.leavesCount) {
            throw new IllegalArgumentException("Trees have different leaf counts: "
                    + a.leavesCount + " and " + b.leavesCount);
        }

        int limit = roundLimit(a.leavesCount);
        BitSet found = new BitSet();
        int rounds = 0;

        while (rounds < limit) {
            rounds++;
            ConsensusTreeBuilder builder = new ConsensusTreeBuilder(a, b);
            FunctionalTree rampDown = FunctionalTreeBuilder.build(builder.rampDown());
            FunctionalTree rampUp = FunctionalTreeBuilder.build(builder.rampUp());
            BitSet roundTaxa = new JumpTaxaVoter(rampDown, rampUp).vote();
            found.or(roundTaxa);

            if (Config.VERBOSE) {
                System.out.println("Pair " + pairIndex + ", round " + rounds + ": " + roundTaxa.cardinality()
                        + " taxa found, " + a.leavesCount + " leaves");
            }

            if (roundTaxa.isEmpty() || a.leavesCount - roundTaxa.cardinality() < Config.MIN_REMAINING_LEAVES) {
                break;
            }
            List<Integer> ids = toList(roundTaxa);
            a = a.removeLeaves(ids);
            b = b.removeLeaves(ids);
        }

        List<Integer> ids = toList(found);
        List<String> labels = new ArrayList<>(ids.size());
        for (int id : ids) {
            labels.add(taxonIdToLabel[id]);
        }
        return JumpTaxaResult.success(pairIndex, ids, labels, rounds);
    }

    private static List<Integer> toList(BitSet bits) {
        List<Integer> ids = new ArrayList<>(bits.cardinality());
        for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
            ids.add(i);
        }
        return ids;
    }
}
