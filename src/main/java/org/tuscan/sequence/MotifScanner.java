package org.tuscan.sequence;

import java.util.NoSuchElementException;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Finds every overlapping 28-nt candidate window on one strand.
 * <p>
 * A window at offset {@code i} matches when {@code seq[i+25..i+26] == "GG"} and all 28
 * characters are canonical bases. The scan is a plain index walk: each offset is tested
 * independently, so a {@code G} may serve as an anchor for one window while lying inside
 * the window of a neighbouring match.
 * <p>
 * Windows containing any character outside {@code A, C, G, T} are skipped silently.
 * To avoid re-testing the whole window at every offset, the scanner tracks the most recent
 * invalid position and rejects every window that still covers it.
 * <p>
 * Stateless and thread-safe; the cursors it hands out are not.
 */
public class MotifScanner {

    /**
     * Returns a lazy cursor over the ascending match offsets. Each call to
     * {@link IntIterator#nextInt()} scans only as far as the next match.
     *
     * @param sequence the upper-case strand to scan.
     * @return a single-use cursor; empty if the sequence is shorter than a window.
     */
    public IntIterator offsets(String sequence) {
        return new OffsetCursor(sequence);
    }

    /**
     * Returns the ascending offsets of all matching windows.
     *
     * @param sequence the upper-case strand to scan.
     * @return the match offsets; empty if the sequence is shorter than a window.
     */
    public IntList findOffsets(String sequence) {
        IntArrayList offsets = new IntArrayList();
        IntIterator cursor = offsets(sequence);
        while (cursor.hasNext()) {
            offsets.add(cursor.nextInt());
        }
        return offsets;
    }

    private static final class OffsetCursor implements IntIterator {

        private final String sequence;
        private final int lastOffset;
        // next offset to test
        private int offset;
        // most recent position holding a non-base character
        private int lastInvalid = -1;
        // pending match, or -1 once exhausted
        private int next = -1;

        OffsetCursor(String sequence) {
            this.sequence = sequence;
            this.lastOffset = sequence.length() - Candidate.WINDOW_LENGTH;
            if (lastOffset >= 0) {
                for (int i = 0; i < Candidate.WINDOW_LENGTH - 1; i++) {
                    if (!Nucleotides.isBase(sequence.charAt(i))) {
                        lastInvalid = i;
                    }
                }
                advance();
            }
        }

        private void advance() {
            next = -1;
            while (offset <= lastOffset) {
                int current = offset++;
                int windowEnd = current + Candidate.WINDOW_LENGTH - 1;
                if (!Nucleotides.isBase(sequence.charAt(windowEnd))) {
                    lastInvalid = windowEnd;
                }
                if (lastInvalid >= current) {
                    continue;
                }
                int anchor = current + Candidate.ANCHOR_INDEX;
                if (sequence.charAt(anchor) == 'G' && sequence.charAt(anchor + 1) == 'G') {
                    next = current;
                    return;
                }
            }
        }

        @Override
        public boolean hasNext() {
            return next >= 0;
        }

        @Override
        public int nextInt() {
            if (next < 0) {
                throw new NoSuchElementException();
            }
            int match = next;
            advance();
            return match;
        }
    }
}
