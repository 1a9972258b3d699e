package org.tuscan.pipeline;

import org.tuscan.sequence.Candidate;
import org.tuscan.sequence.Strand;

/**
 * A candidate together with its reference coordinates and model score.
 *
 * @param candidate  the scored candidate (the same instance the scanner produced).
 * @param chromosome the chromosome label of the scanned region.
 * @param start      1-based inclusive start on the forward reference.
 * @param end        1-based inclusive end on the forward reference.
 * @param score      the model score.
 */
public record ScoredCandidate(Candidate candidate, String chromosome, long start, long end, double score) {

    public Strand strand() {
        return candidate.strand();
    }

    /** @return the 28-nt window as read on the candidate's strand. */
    public String sequence() {
        return candidate.window();
    }
}
