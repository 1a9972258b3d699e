package org.tuscan.sequence;

import java.util.Locale;

/**
 * Static helpers for nucleotide strings over the alphabet {@code A, C, G, T}.
 * <p>
 * Any character outside that alphabet is treated as an ambiguous base and complemented to
 * {@code N}, so it can never take part in a candidate match on either strand.
 */
public final class Nucleotides {

    /** The canonical base order used by every feature table. */
    public static final String BASES = "ACGT";

    private Nucleotides() {
    }

    /**
     * Returns whether {@code c} is one of the four canonical upper-case bases.
     *
     * @param c the character to test.
     * @return {@code true} for {@code A}, {@code C}, {@code G} or {@code T}.
     */
    public static boolean isBase(char c) {
        return c == 'A' || c == 'C' || c == 'G' || c == 'T';
    }

    /**
     * Upper-cases a sequence before scanning.
     *
     * @param sequence the raw sequence.
     * @return the upper-case sequence.
     */
    public static String normalize(String sequence) {
        return sequence.toUpperCase(Locale.ROOT);
    }

    /**
     * Returns the complement of a single base, or {@code N} for anything else.
     *
     * @param base the base to complement.
     * @return the complementary base.
     */
    public static char complement(char base) {
        return switch (base) {
            case 'A' -> 'T';
            case 'C' -> 'G';
            case 'G' -> 'C';
            case 'T' -> 'A';
            default -> 'N';
        };
    }

    /**
     * Returns the reverse complement of a sequence.
     * <p>
     * For sequences over {@code A, C, G, T} this is an involution:
     * {@code reverseComplement(reverseComplement(s)).equals(s)}.
     *
     * @param sequence the sequence to reverse-complement.
     * @return the reverse complement, same length as the input.
     */
    public static String reverseComplement(String sequence) {
        int length = sequence.length();
        char[] out = new char[length];
        for (int i = 0; i < length; i++) {
            out[length - 1 - i] = complement(sequence.charAt(i));
        }
        return new String(out);
    }

    /**
     * Returns the index of {@code base} in {@link #BASES}, or {@code -1}.
     *
     * @param base the base to look up.
     * @return 0 for A, 1 for C, 2 for G, 3 for T, -1 otherwise.
     */
    public static int indexOf(char base) {
        return BASES.indexOf(base);
    }
}
