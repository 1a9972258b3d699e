package org.tuscan.pipeline;

import org.tuscan.sequence.Candidate;

/**
 * An element of the candidate queue: either a candidate to score or the end-of-stream marker.
 * <p>
 * The producer enqueues exactly one {@link EndOfStream} per worker after its last candidate,
 * so every worker observes termination exactly once.
 */
public sealed interface WorkItem permits WorkItem.Next, WorkItem.EndOfStream {

    /**
     * A candidate to score.
     *
     * @param candidate the candidate.
     */
    record Next(Candidate candidate) implements WorkItem {}

    /**
     * No more candidates will follow.
     */
    record EndOfStream() implements WorkItem {
        /** Shared marker instance. */
        public static final EndOfStream INSTANCE = new EndOfStream();
    }
}
