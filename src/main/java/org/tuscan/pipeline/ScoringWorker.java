package org.tuscan.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tuscan.features.FeatureEncoder;
import org.tuscan.features.ScoringMode;
import org.tuscan.model.IScoringModel;
import org.tuscan.sequence.Candidate;
import org.tuscan.sequence.SequenceRegion;

/**
 * Drains candidates from the shared queue, scores them in batches and forwards the results.
 * <p>
 * <b>Protocol:</b>
 * <ol>
 *   <li>Take a {@link WorkItem}; a {@link WorkItem.Next} is appended to the local batch</li>
 *   <li>A full batch is encoded, scored in a single model call and sent as a
 *       {@link ResultMessage.ScoredBatch}</li>
 *   <li>On {@link WorkItem.EndOfStream} the pending partial batch is flushed, a
 *       {@link ResultMessage.WorkerDone} is sent and the worker exits</li>
 *   <li>Any exception is sent as a {@link ResultMessage.Failure} and ends the worker</li>
 * </ol>
 * <p>
 * An interrupt means the pass is being aborted: the worker exits without sending anything.
 */
final class ScoringWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ScoringWorker.class);

    private final int workerIndex;
    private final BlockingQueue<WorkItem> candidates;
    private final BlockingQueue<ResultMessage> results;
    private final FeatureEncoder encoder;
    private final IScoringModel model;
    private final ScoringMode mode;
    private final SequenceRegion region;
    private final int batchSize;

    private final List<Candidate> batch;
    private long scored;

    ScoringWorker(int workerIndex,
                  BlockingQueue<WorkItem> candidates,
                  BlockingQueue<ResultMessage> results,
                  FeatureEncoder encoder,
                  IScoringModel model,
                  ScoringMode mode,
                  SequenceRegion region,
                  int batchSize) {
        this.workerIndex = workerIndex;
        this.candidates = candidates;
        this.results = results;
        this.encoder = encoder;
        this.model = model;
        this.mode = mode;
        this.region = region;
        this.batchSize = batchSize;
        this.batch = new ArrayList<>(Math.min(batchSize, 1024));
    }

    @Override
    public void run() {
        try {
            while (true) {
                WorkItem item = candidates.take();
                if (item instanceof WorkItem.Next next) {
                    batch.add(next.candidate());
                    if (batch.size() >= batchSize) {
                        flush();
                    }
                } else {
                    flush();
                    results.put(new ResultMessage.WorkerDone(workerIndex));
                    log.debug("Worker {} done after scoring {} candidates", workerIndex, scored);
                    return;
                }
            }
        } catch (InterruptedException e) {
            log.debug("Worker {} interrupted, shutting down.", workerIndex);
            Thread.currentThread().interrupt();
        } catch (RuntimeException | Error e) {
            reportFailure(e);
        }
    }

    private void flush() throws InterruptedException {
        if (batch.isEmpty()) {
            return;
        }
        results.put(new ResultMessage.ScoredBatch(score(batch)));
        scored += batch.size();
        batch.clear();
    }

    /**
     * Scores one batch with a single model call.
     *
     * @param pending the candidates, in input order.
     * @return one scored candidate per input, in the same order.
     * @throws PipelineException if the model returns the wrong number of scores.
     */
    List<ScoredCandidate> score(List<Candidate> pending) {
        int size = pending.size();
        long[] starts = new long[size];
        long[] ends = new long[size];
        for (int i = 0; i < size; i++) {
            Candidate candidate = pending.get(i);
            starts[i] = region.siteStart(candidate.strand(), candidate.offset());
            ends[i] = region.siteEnd(candidate.strand(), candidate.offset());
        }

        double[][] matrix = encoder.encodeBatch(pending, mode);
        double[] scores = model.predict(matrix);
        if (scores == null || scores.length != size) {
            throw new PipelineException(String.format(
                "Model returned %d scores for a batch of %d candidates",
                scores == null ? 0 : scores.length, size));
        }
        log.debug("Worker {} scored batch of {} candidates", workerIndex, size);

        List<ScoredCandidate> scoredBatch = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            scoredBatch.add(new ScoredCandidate(pending.get(i), region.chromosome(), starts[i], ends[i], scores[i]));
        }
        return scoredBatch;
    }

    private void reportFailure(Throwable e) {
        String threadName = Thread.currentThread().getName();
        log.debug("Worker {} failed:", workerIndex, e);
        try {
            results.put(new ResultMessage.Failure(threadName, e));
        } catch (InterruptedException interrupted) {
            // pass already aborted by the collector
            Thread.currentThread().interrupt();
        }
    }
}
