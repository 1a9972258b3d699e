package org.tuscan.sequence;

import java.util.Objects;

/**
 * A 28-nt candidate window found by the {@link MotifScanner}.
 * <p>
 * Window layout (0-based): 0-3 upstream flank, 4-23 protospacer, 24 the {@code N} of
 * {@code NGG}, 25-26 the {@code GG} anchor, 27 one downstream base.
 * <p>
 * Candidates are compared by identity in the pipeline; the record equality is value based
 * and must not be used to match scores back to their origin.
 *
 * @param offset the 0-based match offset in the scanned strand.
 * @param window the 28-character window.
 * @param strand the strand that was scanned.
 */
public record Candidate(int offset, String window, Strand strand) {

    /** Length of every candidate window. */
    public static final int WINDOW_LENGTH = 28;

    /** 0-based index of the first {@code G} of the PAM anchor. */
    public static final int ANCHOR_INDEX = 25;

    public Candidate {
        Objects.requireNonNull(window, "window");
        Objects.requireNonNull(strand, "strand");
        if (window.length() != WINDOW_LENGTH) {
            throw new IllegalArgumentException(
                "Candidate window must be " + WINDOW_LENGTH + " nt, got " + window.length());
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Candidate offset cannot be negative: " + offset);
        }
    }
}
