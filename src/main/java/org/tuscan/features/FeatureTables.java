package org.tuscan.features;

import java.util.List;

/**
 * Reference tables that fix the feature layout of the trained models.
 * <p>
 * Order matters: each entry owns one column of the feature vector, in list order. Changing,
 * reordering or adding entries silently changes predictions of an existing model.
 * Positions are 1-based and relative to the start of the 28-nt window.
 */
public final class FeatureTables {

    /**
     * A base expected at a given position.
     *
     * @param base     the nucleotide.
     * @param position 1-based window position.
     */
    public record PositionalBase(char base, int position) {
        /** @return the column label, e.g. {@code T3}. */
        public String label() {
            return String.valueOf(base) + position;
        }
    }

    /**
     * A dinucleotide expected to start at a given position.
     *
     * @param dinucleotide the two bases.
     * @param position     1-based window position of the first base.
     */
    public record PositionalDinucleotide(String dinucleotide, int position) {
        /** @return the column label, e.g. {@code AG1}. */
        public String label() {
            return dinucleotide + position;
        }
    }

    /** Dinucleotide presence columns of the regression model. */
    public static final List<String> REGRESSION_DINUCLEOTIDES = List.of("CA", "CT", "GC", "TC", "TG", "TT");

    /** Dinucleotide presence columns of the classification model: all 16, {@code AA..TT}. */
    public static final List<String> CLASSIFICATION_DINUCLEOTIDES = List.of(
        "AA", "AC", "AG", "AT",
        "CA", "CC", "CG", "CT",
        "GA", "GC", "GG", "GT",
        "TA", "TC", "TG", "TT");

    public static final List<PositionalBase> REGRESSION_BASES = List.of(
        new PositionalBase('T', 3),
        new PositionalBase('A', 5),
        new PositionalBase('C', 8),
        new PositionalBase('G', 11),
        new PositionalBase('A', 13),
        new PositionalBase('T', 14),
        new PositionalBase('C', 16),
        new PositionalBase('G', 17),
        new PositionalBase('A', 20),
        new PositionalBase('C', 21),
        new PositionalBase('G', 24),
        new PositionalBase('T', 24),
        new PositionalBase('C', 28));

    public static final List<PositionalDinucleotide> REGRESSION_DINUCLEOTIDE_POSITIONS = List.of(
        new PositionalDinucleotide("AG", 1),
        new PositionalDinucleotide("CT", 2),
        new PositionalDinucleotide("GA", 3),
        new PositionalDinucleotide("TT", 4),
        new PositionalDinucleotide("AC", 5),
        new PositionalDinucleotide("GG", 5),
        new PositionalDinucleotide("CA", 6),
        new PositionalDinucleotide("TC", 7),
        new PositionalDinucleotide("AT", 8),
        new PositionalDinucleotide("GC", 9),
        new PositionalDinucleotide("TA", 10),
        new PositionalDinucleotide("CG", 11),
        new PositionalDinucleotide("AA", 12),
        new PositionalDinucleotide("GT", 12),
        new PositionalDinucleotide("TG", 13),
        new PositionalDinucleotide("CC", 14),
        new PositionalDinucleotide("AG", 15),
        new PositionalDinucleotide("TC", 15),
        new PositionalDinucleotide("GA", 16),
        new PositionalDinucleotide("CT", 17),
        new PositionalDinucleotide("AC", 18),
        new PositionalDinucleotide("TT", 18),
        new PositionalDinucleotide("GG", 19),
        new PositionalDinucleotide("CA", 20),
        new PositionalDinucleotide("AT", 20),
        new PositionalDinucleotide("TA", 21),
        new PositionalDinucleotide("GC", 21),
        new PositionalDinucleotide("CG", 22),
        new PositionalDinucleotide("AA", 23),
        new PositionalDinucleotide("TG", 23),
        new PositionalDinucleotide("GT", 24),
        new PositionalDinucleotide("CC", 24),
        new PositionalDinucleotide("AG", 25),
        new PositionalDinucleotide("TG", 25),
        new PositionalDinucleotide("CG", 25),
        new PositionalDinucleotide("GA", 27),
        new PositionalDinucleotide("GT", 27));

    public static final List<PositionalBase> CLASSIFICATION_BASES = List.of(
        new PositionalBase('A', 2),
        new PositionalBase('C', 4),
        new PositionalBase('T', 6),
        new PositionalBase('G', 9),
        new PositionalBase('A', 12),
        new PositionalBase('T', 15),
        new PositionalBase('C', 17),
        new PositionalBase('G', 18),
        new PositionalBase('A', 21),
        new PositionalBase('T', 22),
        new PositionalBase('C', 23),
        new PositionalBase('G', 25));

    public static final List<PositionalDinucleotide> CLASSIFICATION_DINUCLEOTIDE_POSITIONS = List.of(
        new PositionalDinucleotide("TA", 3),
        new PositionalDinucleotide("GC", 6),
        new PositionalDinucleotide("AT", 9),
        new PositionalDinucleotide("CG", 11),
        new PositionalDinucleotide("TT", 13),
        new PositionalDinucleotide("AC", 14),
        new PositionalDinucleotide("GA", 16),
        new PositionalDinucleotide("CT", 19),
        new PositionalDinucleotide("TG", 20),
        new PositionalDinucleotide("AA", 22),
        new PositionalDinucleotide("GT", 23),
        new PositionalDinucleotide("CC", 24),
        new PositionalDinucleotide("TG", 25));

    /** Bases 25-28 of the window that mark the regression model's PAM-tail column. */
    public static final String REGRESSION_PAM_TAIL = "TGGT";

    private FeatureTables() {
    }
}
