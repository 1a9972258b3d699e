package org.tuscan.io;

import org.tuscan.sequence.SequenceRegion;

/**
 * One FASTA record.
 *
 * @param label    the first whitespace-delimited token of the header line.
 * @param sequence the upper-case sequence.
 */
public record FastaRecord(String label, String sequence) {

    /**
     * @return the record as a region starting at coordinate 0.
     */
    public SequenceRegion toRegion() {
        return SequenceRegion.of(label, sequence);
    }
}
