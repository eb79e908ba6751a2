package core;

/**
 * Distances between consecutive trees and the full pairwise matrix.
 */
public class DistanceReport {

    public final double[] consecutive;
    public final double[][] matrix;

    public DistanceReport(double[] consecutive, double[][] matrix) {
        this.consecutive = consecutive;
        this.matrix = matrix;
    }
}
