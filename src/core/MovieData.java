package core;

import java.util.Collections;
import java.util.List;

import tree.Tree;

/**
 * Everything produced for one input: the interpolated trees, the jumping
 * taxa of every consecutive pair and the leaf order they refer to.
 */
public class MovieData {

    public final String fileName;
    public final List<Tree> trees;                  // Interpolated sequence, stride 5
    public final int inputTreeCount;
    public final List<JumpTaxaResult> jumpTaxa;     // One per consecutive pair
    public final List<String> leafOrder;
    public final DistanceReport distances;          // Null without a calculator
    public final double[][] embedding;              // Null without a generator
    public final String errorMessage;               // Null on success

    public MovieData(String fileName, List<Tree> trees, int inputTreeCount, List<JumpTaxaResult> jumpTaxa,
                     List<String> leafOrder, DistanceReport distances, double[][] embedding) {
        this(fileName, trees, inputTreeCount, jumpTaxa, leafOrder, distances, embedding, null);
    }

    private MovieData(String fileName, List<Tree> trees, int inputTreeCount, List<JumpTaxaResult> jumpTaxa,
                      List<String> leafOrder, DistanceReport distances, double[][] embedding, String errorMessage) {
        this.fileName = fileName;
        this.trees = Collections.unmodifiableList(trees);
        this.inputTreeCount = inputTreeCount;
        this.jumpTaxa = Collections.unmodifiableList(jumpTaxa);
        this.leafOrder = Collections.unmodifiableList(leafOrder);
        this.distances = distances;
        this.embedding = embedding;
        this.errorMessage = errorMessage;
    }

    public static MovieData empty(String fileName, String errorMessage) {
        return new MovieData(fileName, Collections.emptyList(), 0, Collections.emptyList(),
                Collections.emptyList(), null, null, errorMessage);
    }

    public boolean isEmpty() {
        return trees.isEmpty();
    }
}
