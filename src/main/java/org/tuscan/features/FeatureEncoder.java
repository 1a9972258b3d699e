package org.tuscan.features;

import java.util.List;

import org.tuscan.features.FeatureTables.PositionalBase;
import org.tuscan.features.FeatureTables.PositionalDinucleotide;
import org.tuscan.sequence.Candidate;
import org.tuscan.sequence.Nucleotides;

/**
 * Turns a 28-nt candidate window into the numeric feature vector a model was trained on.
 * <p>
 * Pure and stateless; a single instance can be shared by all scoring workers.
 *
 * @see FeatureLayout for the column order
 */
public class FeatureEncoder {

    /**
     * Encodes one window.
     *
     * @param window the 28-character window.
     * @param mode   the model family whose layout to produce.
     * @return a new vector of {@code mode.layout().width()} values.
     * @throws IllegalArgumentException if the window is not exactly 28 characters long.
     */
    public double[] encode(String window, ScoringMode mode) {
        if (window.length() != Candidate.WINDOW_LENGTH) {
            throw new IllegalArgumentException(
                "Window must be " + Candidate.WINDOW_LENGTH + " nt, got " + window.length());
        }
        FeatureLayout layout = mode.layout();
        double[] features = new double[layout.width()];

        int[] counts = new int[Nucleotides.BASES.length()];
        for (int i = 0; i < window.length(); i++) {
            int index = Nucleotides.indexOf(window.charAt(i));
            if (index >= 0) {
                counts[index]++;
            }
        }
        features[0] = gcPercent(counts[1] + counts[2], window.length());
        for (int b = 0; b < counts.length; b++) {
            features[1 + b] = counts[b];
        }

        List<String> dinucleotides = layout.dinucleotides();
        int column = layout.dinucleotideOffset();
        for (String dinucleotide : dinucleotides) {
            if (window.contains(dinucleotide)) {
                features[column] = 1;
            }
            column++;
        }

        for (PositionalBase entry : layout.positionalBases()) {
            if (window.charAt(entry.position() - 1) == entry.base()) {
                features[column] = 1;
            }
            column++;
        }

        for (PositionalDinucleotide entry : layout.positionalDinucleotides()) {
            if (window.startsWith(entry.dinucleotide(), entry.position() - 1)) {
                features[column] = 1;
            }
            column++;
        }

        if (layout.pamTail() != null) {
            int start = Candidate.ANCHOR_INDEX - 1;
            if (window.startsWith(layout.pamTail(), start)) {
                features[layout.pamTailIndex()] = 1;
            }
        }
        return features;
    }

    /**
     * Encodes a batch of candidates into a row-major feature matrix.
     *
     * @param candidates the candidates, in row order.
     * @param mode       the model family whose layout to produce.
     * @return one row per candidate.
     */
    public double[][] encodeBatch(List<Candidate> candidates, ScoringMode mode) {
        double[][] matrix = new double[candidates.size()][];
        for (int i = 0; i < matrix.length; i++) {
            matrix[i] = encode(candidates.get(i).window(), mode);
        }
        return matrix;
    }

    /**
     * Percentage of G and C bases, rounded to two decimals.
     */
    static double gcPercent(int gcCount, int length) {
        return Math.round(100.0 * gcCount / length * 100.0) / 100.0;
    }
}
