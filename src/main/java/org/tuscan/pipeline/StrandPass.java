package org.tuscan.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tuscan.features.FeatureEncoder;
import org.tuscan.features.ScoringMode;
import org.tuscan.model.IScoringModel;
import org.tuscan.sequence.Candidate;
import org.tuscan.sequence.MotifScanner;
import org.tuscan.sequence.SequenceRegion;
import org.tuscan.sequence.Strand;

import it.unimi.dsi.fastutil.ints.IntIterator;

/**
 * One scan-and-score cycle over a single strand of a region.
 * <p>
 * Runs one producer thread, {@code N} scoring workers and the collector on the calling thread.
 * A pass is single-use: build a new instance for every strand.
 * <p>
 * <b>States:</b>
 * <ol>
 *   <li>{@code FILLING} - the producer scans and puts candidates into the bounded queue
 *       (capacity {@code N * queueCapacityPerWorker}); a full queue blocks the producer</li>
 *   <li>{@code DRAINING} - all candidates and one end-of-stream marker per worker are queued;
 *       workers flush their last batches</li>
 *   <li>{@code DONE} - the collector has received a done marker from every worker</li>
 *   <li>{@code FAILED} - a worker or the producer failed; every thread was interrupted and
 *       joined before the failure was rethrown</li>
 * </ol>
 */
public class StrandPass {

    private static final Logger log = LoggerFactory.getLogger(StrandPass.class);

    private static final long JOIN_TIMEOUT_MS = 5000;

    /**
     * Lifecycle of a pass.
     */
    public enum State {
        CREATED,
        FILLING,
        DRAINING,
        DONE,
        FAILED
    }

    private final SequenceRegion region;
    private final Strand strand;
    private final MotifScanner scanner;
    private final FeatureEncoder encoder;
    private final IScoringModel model;
    private final ScoringMode mode;
    private final PipelineSettings settings;

    private final AtomicReference<State> state = new AtomicReference<>(State.CREATED);
    private final AtomicLong candidateCount = new AtomicLong();
    private final List<Thread> threads = new ArrayList<>();

    public StrandPass(SequenceRegion region,
                      Strand strand,
                      MotifScanner scanner,
                      FeatureEncoder encoder,
                      IScoringModel model,
                      ScoringMode mode,
                      PipelineSettings settings) {
        this.region = region;
        this.strand = strand;
        this.scanner = scanner;
        this.encoder = encoder;
        this.model = model;
        this.mode = mode;
        this.settings = settings;
    }

    /**
     * Runs the pass to completion.
     *
     * @param sink receives every reported site, on the calling thread.
     * @return the pass totals.
     * @throws PipelineException    if any pipeline thread fails; no thread is left running.
     * @throws InterruptedException if the calling thread is interrupted; no thread is left running.
     * @throws IllegalStateException if the pass was already run.
     */
    public ScanSummary run(IScoredCandidateSink sink) throws InterruptedException {
        if (!state.compareAndSet(State.CREATED, State.FILLING)) {
            throw new IllegalStateException("Strand pass already run, state is " + state.get());
        }
        int workers = settings.threads();
        BlockingQueue<WorkItem> candidates = new ArrayBlockingQueue<>(settings.queueCapacity());
        BlockingQueue<ResultMessage> results = new ArrayBlockingQueue<>(settings.queueCapacity());
        String sequence = region.strandSequence(strand);

        log.debug("Starting {} strand pass over {} ({} nt) with {} workers",
            strand.symbol(), region.chromosome(), sequence.length(), workers);

        Thread producer = new Thread(() -> produce(sequence, candidates, results, workers), "candidate-producer");
        start(producer);
        for (int i = 0; i < workers; i++) {
            ScoringWorker worker = new ScoringWorker(
                i, candidates, results, encoder, model, mode, region, settings.batchSize());
            start(new Thread(worker, "scoring-worker-" + i));
        }

        ResultCollector collector = new ResultCollector(results, workers, sink, settings.minScore());
        try {
            collector.collect();
        } catch (PipelineException | InterruptedException e) {
            abort();
            throw e;
        } catch (RuntimeException e) {
            abort();
            throw new PipelineException("Strand pass failed: " + e.getMessage(), e);
        }

        joinAll();
        state.set(State.DONE);
        ScanSummary summary = new ScanSummary(candidateCount.get(), collector.received(), collector.reported());
        log.debug("Finished {} strand pass over {}: {}", strand.symbol(), region.chromosome(), summary);
        return summary;
    }

    private void start(Thread thread) {
        thread.setDaemon(true);
        threads.add(thread);
        thread.start();
    }

    private void produce(String sequence, BlockingQueue<WorkItem> candidates,
                         BlockingQueue<ResultMessage> results, int workers) {
        try {
            IntIterator offsets = scanner.offsets(sequence);
            while (offsets.hasNext()) {
                int offset = offsets.nextInt();
                String window = sequence.substring(offset, offset + Candidate.WINDOW_LENGTH);
                candidates.put(new WorkItem.Next(new Candidate(offset, window, strand)));
                candidateCount.incrementAndGet();
            }
            for (int i = 0; i < workers; i++) {
                candidates.put(WorkItem.EndOfStream.INSTANCE);
            }
            state.compareAndSet(State.FILLING, State.DRAINING);
        } catch (InterruptedException e) {
            log.debug("Candidate producer interrupted, shutting down.");
            Thread.currentThread().interrupt();
        } catch (RuntimeException | Error e) {
            log.debug("Candidate producer failed:", e);
            try {
                results.put(new ResultMessage.Failure(Thread.currentThread().getName(), e));
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void abort() {
        state.set(State.FAILED);
        for (Thread thread : threads) {
            thread.interrupt();
        }
        try {
            joinAll();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void joinAll() throws InterruptedException {
        for (Thread thread : threads) {
            thread.join(JOIN_TIMEOUT_MS);
            if (thread.isAlive()) {
                log.warn("{} did not stop within {} ms", thread.getName(), JOIN_TIMEOUT_MS);
            }
        }
    }

    public State getState() {
        return state.get();
    }

    /**
     * @return {@code true} if any thread started by this pass is still running.
     */
    public boolean hasLiveThreads() {
        return threads.stream().anyMatch(Thread::isAlive);
    }

    public Strand strand() {
        return strand;
    }
}
