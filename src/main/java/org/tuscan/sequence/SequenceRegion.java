package org.tuscan.sequence;

import java.util.Objects;

/**
 * A labelled stretch of sequence together with its reference coordinates.
 * <p>
 * Coordinates follow the BED convention: {@code start} is the 0-based position of the first
 * base, {@code end} is exclusive (equivalently the 1-based position of the last base).
 * A sequence read from a FASTA file without coordinates is the region {@code [0, length)}.
 *
 * @param chromosome the chromosome or record label.
 * @param start      0-based start of {@code sequence} on the reference.
 * @param end        exclusive end of {@code sequence} on the reference.
 * @param sequence   the upper-case forward-strand sequence.
 */
public record SequenceRegion(String chromosome, long start, long end, String sequence) {

    /** Offset from a window start to the first protospacer base, in 1-based coordinates. */
    static final int FORWARD_SITE_SHIFT = 5;

    /** Offset from a reverse-strand window start to the last reported base. */
    static final int REVERSE_SITE_SHIFT = 4;

    /** Width of a reported site minus one (20-nt protospacer plus {@code NGG}). */
    public static final int SITE_SPAN = 22;

    public SequenceRegion {
        Objects.requireNonNull(chromosome, "chromosome");
        Objects.requireNonNull(sequence, "sequence");
        if (start < 0 || end < start) {
            throw new IllegalArgumentException(
                "Invalid region " + chromosome + ":" + start + "-" + end);
        }
    }

    /**
     * Creates a region for a bare sequence, starting at coordinate 0.
     *
     * @param label    the record label.
     * @param sequence the sequence.
     * @return a region spanning {@code [0, sequence.length())}.
     */
    public static SequenceRegion of(String label, String sequence) {
        return new SequenceRegion(label, 0, sequence.length(), sequence);
    }

    /**
     * Returns the 1-based inclusive start of the site reported for a match.
     *
     * @param strand the strand the match was found on.
     * @param offset the match offset within that strand.
     * @return the reported start coordinate.
     */
    public long siteStart(Strand strand, int offset) {
        return switch (strand) {
            case FORWARD -> start + offset + FORWARD_SITE_SHIFT;
            case REVERSE -> siteEnd(strand, offset) - SITE_SPAN;
        };
    }

    /**
     * Returns the 1-based inclusive end of the site reported for a match.
     *
     * @param strand the strand the match was found on.
     * @param offset the match offset within that strand.
     * @return the reported end coordinate.
     */
    public long siteEnd(Strand strand, int offset) {
        return switch (strand) {
            case FORWARD -> siteStart(strand, offset) + SITE_SPAN;
            case REVERSE -> end - offset - REVERSE_SITE_SHIFT;
        };
    }

    /**
     * @param strand the strand to read.
     * @return the forward sequence, or its reverse complement for {@link Strand#REVERSE}.
     */
    public String strandSequence(Strand strand) {
        return strand == Strand.FORWARD ? sequence : Nucleotides.reverseComplement(sequence);
    }
}
