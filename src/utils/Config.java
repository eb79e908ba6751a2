package utils;

/**
 * Configuration class for the tree-movie pipeline.
 * This class holds global configuration parameters used throughout the
 * decoder, the consensus builder and the jumping-taxa search.
 */
public class Config {

    /**
     * Enable progress output on stdout
     */
    public static boolean VERBOSE = false;

    /**
     * Branch length used when a Newick node carries no ":length" suffix
     */
    public static double DEFAULT_BRANCH_LENGTH = 1.0;

    /**
     * Pruning never reduces a tree pair below this many leaves
     */
    public static int MIN_REMAINING_LEAVES = 4;

    /**
     * Hard cap on pruning rounds per tree pair.
     * The effective cap is min(MAX_PRUNING_ROUNDS, leafCount - 3).
     */
    public static int MAX_PRUNING_ROUNDS = 1000;

    /**
     * Number of synthesized trees inserted between two input trees
     */
    public static final int CONSENSUS_TREES_PER_PAIR = 4;

    /**
     * Print current configuration
     */
    public static void printConfig() {
        System.out.println("Configuration:");
        System.out.println("  Default branch length: " + DEFAULT_BRANCH_LENGTH);
        System.out.println("  Min remaining leaves: " + MIN_REMAINING_LEAVES);
        System.out.println("  Max pruning rounds: " + MAX_PRUNING_ROUNDS);
        System.out.println("  Verbose output: " + VERBOSE);
    }
}
