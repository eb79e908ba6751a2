package core;

import java.util.List;

import tree.Tree;

/**
 * Tree-to-tree distances (Robinson-Foulds and weighted variants) for the
 * input trees of a movie.
 */
public interface DistanceCalculator {

    DistanceReport compute(List<Tree> trees);
}
