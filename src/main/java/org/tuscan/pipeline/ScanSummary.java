package org.tuscan.pipeline;

/**
 * Totals of one or more strand passes.
 *
 * @param candidates windows found by the scanner.
 * @param scored     candidates that came back from the model.
 * @param reported   scored candidates passed to the sink (after the score threshold).
 */
public record ScanSummary(long candidates, long scored, long reported) {

    public static final ScanSummary EMPTY = new ScanSummary(0, 0, 0);

    /**
     * @return the element-wise sum of this and {@code other}.
     */
    public ScanSummary plus(ScanSummary other) {
        return new ScanSummary(candidates + other.candidates, scored + other.scored, reported + other.reported);
    }
}
