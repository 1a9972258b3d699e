package org.tuscan.model;

import java.util.List;

import org.tuscan.features.ScoringMode;

/**
 * A random forest that averages the outputs of its trees.
 * <p>
 * In {@link ScoringMode#REGRESSION} the score is the mean leaf value. In
 * {@link ScoringMode#CLASSIFICATION} leaves hold the positive-class probability and the score
 * is the predicted label: {@code 1.0} when the mean probability is strictly above 0.5,
 * otherwise {@code 0.0}.
 * <p>
 * Immutable and safe for concurrent use.
 */
public final class RandomForestModel implements IScoringModel {

    private static final double DECISION_THRESHOLD = 0.5;

    private final ScoringMode mode;
    private final int featureCount;
    private final List<DecisionTree> trees;

    /**
     * @param mode         the scoring mode the forest was trained for.
     * @param featureCount expected row width.
     * @param trees        the trees; must not be empty.
     * @throws ModelException if the forest is empty or a tree reads past {@code featureCount}.
     */
    public RandomForestModel(ScoringMode mode, int featureCount, List<DecisionTree> trees) {
        if (trees.isEmpty()) {
            throw new ModelException("Random forest has no trees");
        }
        for (int t = 0; t < trees.size(); t++) {
            int maxFeature = trees.get(t).maxFeatureIndex();
            if (maxFeature >= featureCount) {
                throw new ModelException(String.format(
                    "Tree %d reads feature %d but the model has only %d features", t, maxFeature, featureCount));
            }
        }
        this.mode = mode;
        this.featureCount = featureCount;
        this.trees = List.copyOf(trees);
    }

    @Override
    public double[] predict(double[][] rows) {
        double[] scores = new double[rows.length];
        for (int r = 0; r < rows.length; r++) {
            double[] row = rows[r];
            if (row.length != featureCount) {
                throw new ModelException(String.format(
                    "Row %d has %d features, model expects %d", r, row.length, featureCount));
            }
            double sum = 0;
            for (DecisionTree tree : trees) {
                sum += tree.evaluate(row);
            }
            double mean = sum / trees.size();
            scores[r] = mode == ScoringMode.CLASSIFICATION
                ? (mean > DECISION_THRESHOLD ? 1.0 : 0.0)
                : mean;
        }
        return scores;
    }

    @Override
    public int featureCount() {
        return featureCount;
    }

    public ScoringMode mode() {
        return mode;
    }

    public int treeCount() {
        return trees.size();
    }
}
