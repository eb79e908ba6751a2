package core;

import java.util.ArrayList;
import java.util.List;

import consensus.InterpolatedSequence;
import preprocessing.TreeSequence;
import tree.Tree;
import utils.Config;

/**
 * Runs the whole pipeline on one input text: decoding, interpolation, the
 * jumping-taxa search for every consecutive pair and the optional distance
 * and embedding collaborators.
 */
public class TreeMovieBuilder {

    private final DistanceCalculator distanceCalculator;
    private final EmbeddingGenerator embeddingGenerator;

    public TreeMovieBuilder() {
        this(null, null);
    }

    public TreeMovieBuilder(DistanceCalculator distanceCalculator, EmbeddingGenerator embeddingGenerator) {
        this.distanceCalculator = distanceCalculator;
        this.embeddingGenerator = embeddingGenerator;
    }

    public MovieData build(String text, String fileName, List<String> leafOrder) {
        return build(text, fileName, leafOrder, 1, 1);
    }

    public MovieData build(String text, String fileName, List<String> leafOrder, int start, int step) {
        TreeSequence sequence = TreeSequence.decode(text, leafOrder, start, step);
        if (sequence.isEmpty()) {
            return MovieData.empty(fileName, sequence.errorMessage);
        }

        List<Tree> trees = sequence.trees;
        InterpolatedSequence interpolated;
        try {
            interpolated = InterpolatedSequence.build(trees);
        } catch (IllegalStateException e) {
            System.err.println("Error: Could not interpolate trees: " + e.getMessage());
            return MovieData.empty(fileName, e.getMessage());
        }

        JumpTaxaFinder finder = new JumpTaxaFinder(sequence.taxonIdToLabel);
        List<JumpTaxaResult> jumpTaxa = new ArrayList<>();
        for (int i = 0; i + 1 < trees.size(); i++) {
            JumpTaxaResult result = finder.find(i, trees.get(i), trees.get(i + 1));
            if (Config.VERBOSE) {
                System.out.println(result);
            }
            jumpTaxa.add(result);
        }

        DistanceReport distances = null;
        double[][] embedding = null;
        if (distanceCalculator != null) {
            distances = distanceCalculator.compute(trees);
            if (embeddingGenerator != null && distances != null) {
                embedding = embeddingGenerator.embed(distances.matrix);
            }
        }

        return new MovieData(fileName, interpolated.getTrees(), trees.size(), jumpTaxa,
                sequence.getLeafOrder(), distances, embedding);
    }
}
