package org.tuscan.pipeline;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tuscan.features.FeatureEncoder;
import org.tuscan.features.ScoringMode;
import org.tuscan.model.IScoringModel;
import org.tuscan.model.ModelException;
import org.tuscan.sequence.MotifScanner;
import org.tuscan.sequence.SequenceRegion;
import org.tuscan.sequence.Strand;

/**
 * Scans regions on both strands and scores every candidate.
 * <p>
 * For each region the forward strand is processed first, then the reverse complement. Each
 * strand runs in its own {@link StrandPass} that is fully drained before the next one starts,
 * so at most one producer and one set of workers exist at any time.
 * <p>
 * The model is handed in once and shared read-only by all workers of all passes.
 */
public class ScanOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ScanOrchestrator.class);

    private final IScoringModel model;
    private final ScoringMode mode;
    private final PipelineSettings settings;
    private final MotifScanner scanner = new MotifScanner();
    private final FeatureEncoder encoder = new FeatureEncoder();

    /**
     * @param model    the loaded model.
     * @param mode     the feature layout the model was trained on.
     * @param settings pipeline tuning.
     * @throws ModelException if the model's feature count does not match the mode's layout.
     */
    public ScanOrchestrator(IScoringModel model, ScoringMode mode, PipelineSettings settings) {
        this.model = Objects.requireNonNull(model, "model");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.settings = Objects.requireNonNull(settings, "settings");
        int width = mode.layout().width();
        if (model.featureCount() != width) {
            throw new ModelException(String.format(
                "Model expects %d features but %s vectors have %d", model.featureCount(), mode.displayName(), width));
        }
    }

    /**
     * Scans one region on both strands.
     *
     * @param region the region to scan.
     * @param sink   receives every reported site.
     * @return totals over both strands.
     * @throws PipelineException    if either pass fails; the reverse pass is not started after a
     *                              forward failure.
     * @throws InterruptedException if the calling thread is interrupted.
     */
    public ScanSummary scan(SequenceRegion region, IScoredCandidateSink sink) throws InterruptedException {
        ScanSummary total = ScanSummary.EMPTY;
        for (Strand strand : Strand.values()) {
            StrandPass pass = new StrandPass(region, strand, scanner, encoder, model, mode, settings);
            ScanSummary summary = pass.run(sink);
            log.info("{} strand of {}:{}-{}: {} candidates, {} reported",
                strand.symbol(), region.chromosome(), region.start(), region.end(),
                summary.candidates(), summary.reported());
            total = total.plus(summary);
        }
        return total;
    }

    /**
     * Scans regions one after another.
     *
     * @param regions the regions, scanned in list order.
     * @param sink    receives every reported site.
     * @return totals over all regions.
     * @throws PipelineException    if any pass fails; later regions are not scanned.
     * @throws InterruptedException if the calling thread is interrupted.
     */
    public ScanSummary scanAll(List<SequenceRegion> regions, IScoredCandidateSink sink) throws InterruptedException {
        log.info("Scanning {} region(s) in {} mode with {} workers, batch size {}",
            regions.size(), mode.displayName(), settings.threads(), settings.batchSize());
        ScanSummary total = ScanSummary.EMPTY;
        for (SequenceRegion region : regions) {
            total = total.plus(scan(region, sink));
        }
        log.info("Scan finished: {} candidates, {} scored, {} reported",
            total.candidates(), total.scored(), total.reported());
        return total;
    }

    public ScoringMode mode() {
        return mode;
    }

    public PipelineSettings settings() {
        return settings;
    }
}
