package core;

import java.util.Collections;
import java.util.List;

/**
 * Jumping taxa of one pair of consecutive trees.
 */
public class JumpTaxaResult {

    public final int pairIndex;
    public final List<Integer> taxonIds;    // Ascending canonical ids
    public final List<String> taxa;         // Labels in the same order
    public final int rounds;                // Pruning rounds performed
    public final boolean failed;
    public final String message;            // Failure reason, null otherwise

    private JumpTaxaResult(int pairIndex, List<Integer> taxonIds, List<String> taxa,
                           int rounds, boolean failed, String message) {
        this.pairIndex = pairIndex;
        this.taxonIds = Collections.unmodifiableList(taxonIds);
        this.taxa = Collections.unmodifiableList(taxa);
        this.rounds = rounds;
        this.failed = failed;
        this.message = message;
    }

    public static JumpTaxaResult success(int pairIndex, List<Integer> taxonIds, List<String> taxa, int rounds) {
        return new JumpTaxaResult(pairIndex, taxonIds, taxa, rounds, false, null);
    }

    public static JumpTaxaResult failure(int pairIndex, String message) {
        return new JumpTaxaResult(pairIndex, Collections.emptyList(), Collections.emptyList(), 0, true, message);
    }

    @Override
    public String toString() {
        if (failed) {
            return "Pair " + pairIndex + ": failed (" + message + ")";
        }
        return "Pair " + pairIndex + ": " + taxa + " after " + rounds + " round(s)";
    }
}
