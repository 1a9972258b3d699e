package org.tuscan.model;

/**
 * A trained model that scores feature vectors.
 * <p>
 * Implementations are loaded once before scanning starts and shared read-only by every
 * scoring worker, so {@link #predict(double[][])} must be safe to call concurrently and must
 * not mutate model state.
 */
public interface IScoringModel {

    /**
     * Scores a batch of feature vectors.
     *
     * @param rows the feature matrix, one row per candidate.
     * @return one score per row, in row order.
     * @throws ModelException if a row does not have {@link #featureCount()} columns.
     */
    double[] predict(double[][] rows);

    /**
     * @return the number of columns every row must have.
     */
    int featureCount();
}
