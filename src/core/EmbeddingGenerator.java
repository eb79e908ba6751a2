package core;

/**
 * Low-dimensional embedding of trees from their distance matrix, one point
 * per tree.
 */
public interface EmbeddingGenerator {

    double[][] embed(double[][] distanceMatrix);
}
