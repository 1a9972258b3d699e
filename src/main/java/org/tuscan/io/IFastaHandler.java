package org.tuscan.io;

/**
 * Receives FASTA records line by line from {@link FastaReader#stream}.
 */
public interface IFastaHandler {

    /**
     * Called for every header line.
     *
     * @param label the record label.
     * @return {@code true} to receive the record's sequence lines, {@code false} to skip them.
     */
    boolean beginRecord(String label);

    /**
     * Called for each sequence line of an accepted record, in order.
     *
     * @param bases the normalized bases of one line.
     */
    void bases(String bases);

    /**
     * Called after the last sequence line of an accepted record.
     */
    default void endRecord() {
    }
}
