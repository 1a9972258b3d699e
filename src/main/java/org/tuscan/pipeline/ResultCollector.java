package org.tuscan.pipeline;

import java.io.IOException;
import java.util.OptionalDouble;
import java.util.concurrent.BlockingQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fan-in of the results channel: forwards every scored candidate to the sink until all workers
 * have reported completion.
 * <p>
 * Records are forwarded in arrival order. Within a batch that is the worker's input order;
 * across batches and workers no order is guaranteed.
 */
public class ResultCollector {

    private static final Logger log = LoggerFactory.getLogger(ResultCollector.class);

    private final BlockingQueue<ResultMessage> results;
    private final int workerCount;
    private final IScoredCandidateSink sink;
    private final OptionalDouble minScore;

    private long received;
    private long reported;

    /**
     * @param results     the channel shared by all workers.
     * @param workerCount number of {@link ResultMessage.WorkerDone} markers that end collection.
     * @param sink        receives the reported candidates.
     * @param minScore    candidates scoring below this threshold are counted but not reported.
     */
    public ResultCollector(BlockingQueue<ResultMessage> results, int workerCount,
                           IScoredCandidateSink sink, OptionalDouble minScore) {
        this.results = results;
        this.workerCount = workerCount;
        this.sink = sink;
        this.minScore = minScore;
    }

    /**
     * Blocks until every worker has sent its done marker.
     *
     * @throws PipelineException    if a worker reports a failure or the sink cannot write.
     * @throws InterruptedException if the calling thread is interrupted while waiting.
     */
    public void collect() throws InterruptedException {
        int done = 0;
        while (done < workerCount) {
            ResultMessage message = results.take();
            if (message instanceof ResultMessage.ScoredBatch batch) {
                forward(batch);
            } else if (message instanceof ResultMessage.WorkerDone) {
                done++;
            } else if (message instanceof ResultMessage.Failure failure) {
                throw new PipelineException(
                    "Scoring failed in " + failure.threadName() + ": " + failure.cause().getMessage(),
                    failure.cause());
            }
        }
        log.debug("All {} workers done, {} scored, {} reported", workerCount, received, reported);
    }

    private void forward(ResultMessage.ScoredBatch batch) {
        for (ScoredCandidate result : batch.results()) {
            received++;
            if (minScore.isPresent() && result.score() < minScore.getAsDouble()) {
                continue;
            }
            try {
                sink.accept(result);
            } catch (IOException e) {
                throw new PipelineException("Failed to write scored site: " + e.getMessage(), e);
            }
            reported++;
        }
    }

    /** @return the number of scored candidates received so far. */
    public long received() {
        return received;
    }

    /** @return the number of candidates passed to the sink so far. */
    public long reported() {
        return reported;
    }
}
