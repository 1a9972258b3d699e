package org.tuscan.pipeline;

import java.io.IOException;

/**
 * Receives scored candidates from the {@link ResultCollector}.
 * <p>
 * Only ever called from the collector thread.
 */
@FunctionalInterface
public interface IScoredCandidateSink {

    /**
     * Accepts one scored candidate.
     *
     * @param result the scored candidate.
     * @throws IOException if the result cannot be written.
     */
    void accept(ScoredCandidate result) throws IOException;
}
