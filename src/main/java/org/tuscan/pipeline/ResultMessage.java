package org.tuscan.pipeline;

import java.util.List;

/**
 * An element of the results channel that workers send to the {@link ResultCollector}.
 */
public sealed interface ResultMessage permits ResultMessage.ScoredBatch, ResultMessage.WorkerDone, ResultMessage.Failure {

    /**
     * One flushed batch, in the order the worker received its candidates.
     *
     * @param results the scored candidates.
     */
    record ScoredBatch(List<ScoredCandidate> results) implements ResultMessage {}

    /**
     * A worker has flushed its last batch and exited.
     *
     * @param workerIndex the worker's index.
     */
    record WorkerDone(int workerIndex) implements ResultMessage {}

    /**
     * A pipeline thread failed; the pass must be aborted.
     *
     * @param threadName the name of the failed thread.
     * @param cause      the failure.
     */
    record Failure(String threadName, Throwable cause) implements ResultMessage {}
}
