package preprocessing;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import taxon.Taxon;
import tree.Tree;
import utils.Config;

/**
 * TreeSequence: the decoded, time-ordered list of input trees.
 *
 * Decoding turns Newick lines or a NEXUS document into trees that share one
 * canonical leaf index:
 *
 * 1. Comments are stripped and one Newick string is taken per tree
 * 2. The requested sub-sequence is selected (start position and step size)
 * 3. Leaf names of the first tree, in document order, define the leaf ids,
 *    unless a user-supplied order names exactly the same leaves
 * 4. Every tree is parsed against that mapping and must contain all leaves
 * 5. Children are put in canonical order (by smallest leaf id)
 *
 * Decoding never throws: malformed input produces an empty sequence whose
 * {@link #errorMessage} says what went wrong.
 */
public class TreeSequence {

    // Core data structures
    public ArrayList<Tree> trees;                   // Parsed trees in input order
    public String[] taxonIdToLabel;                 // ID to label mapping for output
    public Taxon[] taxa;                            // Array of all taxa (indexed by ID)
    public Map<String, Taxon> taxaMap;              // Label to Taxon mapping
    public int realTaxaCount;                       // Total number of taxa
    public String errorMessage;                     // Why decoding produced nothing, null on success

    private TreeSequence() {
        this.trees = new ArrayList<>();
        this.taxaMap = new LinkedHashMap<>();
        this.taxonIdToLabel = new String[0];
        this.taxa = new Taxon[0];
    }

    public static TreeSequence empty(String errorMessage) {
        TreeSequence sequence = new TreeSequence();
        sequence.errorMessage = errorMessage;
        return sequence;
    }

    public boolean isEmpty() {
        return trees.isEmpty();
    }

    public int size() {
        return trees.size();
    }

    public List<String> getLeafOrder() {
        List<String> order = new ArrayList<>(taxonIdToLabel.length);
        Collections.addAll(order, taxonIdToLabel);
        return order;
    }

    public static TreeSequence decode(String text, List<String> leafOrder) {
        return decode(text, leafOrder, 1, 1);
    }

    /**
     * Decodes Newick or NEXUS text.
     *
     * @param text Newick trees, one per line, or a NEXUS document
     * @param leafOrder Optional user leaf order; ignored with a warning unless
     *                  it names exactly the leaves of the first tree
     * @param start 1-based position of the first tree to keep
     * @param step Keep every step-th tree from start on; the last tree is always kept
     * @return the decoded sequence, empty if the input is malformed
     */
    public static TreeSequence decode(String text, List<String> leafOrder, int start, int step) {
        try {
            TreeSequence sequence = new TreeSequence();
            sequence.readTrees(text, leafOrder, start, step);
            if (Config.VERBOSE) {
                System.out.println("Decoded " + sequence.size() + " trees over "
                        + sequence.realTaxaCount + " taxa");
            }
            return sequence;
        } catch (RuntimeException e) {
            System.err.println("Error: Could not decode trees: " + e.getMessage());
            return empty(e.getMessage());
        }
    }

    private void readTrees(String text, List<String> leafOrder, int start, int step) {
        if (text == null || text.isBlank()) {
            throw new RuntimeException("Input is empty");
        }
        List<String> lines = NexusReader.isNexus(text) ? NexusReader.readTrees(text) : purify(text);
        lines = select(lines, start, step);
        if (lines.isEmpty()) {
            throw new RuntimeException("No trees found in input");
        }

        // First tree: register leaves in document order
        Map<String, Taxon> parsedMap = new LinkedHashMap<>();
        Tree first = new Tree(lines.get(0), parsedMap, true);
        List<String> parsedOrder = new ArrayList<>(parsedMap.keySet());

        List<String> order = parsedOrder;
        if (leafOrder != null && !leafOrder.isEmpty()) {
            order = checkOrderValidity(leafOrder, parsedOrder);
        }
        if (order == parsedOrder) {
            this.taxaMap = parsedMap;
        } else {
            this.taxaMap = new LinkedHashMap<>();
            for (String label : order) {
                taxaMap.put(label, new Taxon(taxaMap.size(), label));
            }
            first = new Tree(lines.get(0), taxaMap);
        }

        this.realTaxaCount = taxaMap.size();
        this.taxonIdToLabel = new String[realTaxaCount];
        this.taxa = new Taxon[realTaxaCount];
        for (var x : taxaMap.values()) {
            taxonIdToLabel[x.id] = x.label;
            taxa[x.id] = x;
        }

        trees.add(first);
        for (int i = 1; i < lines.size(); i++) {
            Tree tree;
            try {
                tree = new Tree(lines.get(i), taxaMap);
            } catch (RuntimeException e) {
                throw new RuntimeException("Tree " + (i + 1) + ": " + e.getMessage(), e);
            }
            if (tree.leavesCount != realTaxaCount) {
                throw new RuntimeException("Tree " + (i + 1) + " has " + tree.leavesCount
                        + " leaves, expected " + realTaxaCount);
            }
            trees.add(tree);
        }

        for (Tree tree : trees) {
            tree.sortByLeafOrder();
        }
    }

    /**
     * Strips comments and returns the non-empty lines, one tree per line.
     */
    static List<String> purify(String newickText) {
        List<String> lines = new ArrayList<>();
        for (String line : NexusReader.stripComments(newickText).split("\\R")) {
            if (!line.trim().isEmpty()) {
                lines.add(line.trim());
            }
        }
        return lines;
    }

    /**
     * Keeps the trees at positions start-1, start-1+step, ... and always the last one.
     */
    static List<String> select(List<String> lines, int start, int step) {
        if (start < 1 || step < 1) {
            throw new IllegalArgumentException("Start and step must be positive, got start="
                    + start + ", step=" + step);
        }
        List<String> selected = new ArrayList<>();
        for (int i = start - 1; i < lines.size(); i++) {
            if ((i - (start - 1)) % step == 0 || i == lines.size() - 1) {
                selected.add(lines.get(i));
            }
        }
        return selected;
    }

    /**
     * Checks whether a user-specified leaf order fits the parsed leaves.
     *
     * @return the given order if it names exactly the parsed leaves, the parsed
     *         order otherwise
     */
    public static List<String> checkOrderValidity(List<String> givenOrder, List<String> parsedOrder) {
        Set<String> given = new HashSet<>(givenOrder);
        Set<String> parsed = new HashSet<>(parsedOrder);
        if (!given.equals(parsed) || given.size() != givenOrder.size()) {
            Set<String> difference = new TreeSet<>(given);
            difference.addAll(parsed);
            Set<String> common = new HashSet<>(given);
            common.retainAll(parsed);
            difference.removeAll(common);
            System.err.println("Warning: Invalid leaf order, using the order of the first tree. Check leaf(s): "
                    + (difference.isEmpty() ? "duplicate entries" : difference));
            return parsedOrder;
        }
        return givenOrder;
    }

    /**
     * Reads a newline-separated leaf order file; blank lines are ignored.
     */
    public static List<String> readLeafOrder(Path path) throws IOException {
        List<String> order = new ArrayList<>();
        for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            if (!line.trim().isEmpty()) {
                order.add(line.trim());
            }
        }
        return order;
    }
}
