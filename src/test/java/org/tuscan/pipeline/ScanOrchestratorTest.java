package org.tuscan.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tuscan.features.ScoringMode;
import org.tuscan.io.ReportWriter;
import org.tuscan.model.ModelException;
import org.tuscan.sequence.SequenceRegion;
import org.tuscan.sequence.Strand;

@Tag("unit")
class ScanOrchestratorTest {

    // single GG at 28-29, no CC: exactly one forward window, at offset 3
    private static final String SINGLE_SITE = "ACTACTACTACTACTACTACTACTACTAGGACTACTACTA";

    @Test
    void reportsSingleForwardSiteWithReferenceCoordinates() throws Exception {
        SequenceRegion region = new SequenceRegion("chr1", 1000, 1040, SINGLE_SITE);
        ScanOrchestrator orchestrator = new ScanOrchestrator(
            new CountingModel(63, row -> 0.42), ScoringMode.REGRESSION, PipelineSettings.withThreads(2));
        List<ScoredCandidate> results = new ArrayList<>();

        ScanSummary summary = orchestrator.scan(region, results::add);

        assertThat(summary).isEqualTo(new ScanSummary(1, 1, 1));
        ScoredCandidate site = results.get(0);
        assertThat(site.chromosome()).isEqualTo("chr1");
        assertThat(site.start()).isEqualTo(1008);
        assertThat(site.end()).isEqualTo(1030);
        assertThat(site.strand()).isEqualTo(Strand.FORWARD);
        assertThat(site.sequence()).isEqualTo(SINGLE_SITE.substring(3, 31));
        assertThat(site.score()).isEqualTo(0.42);
    }

    @Test
    void scansReverseStrandAfterForward() throws Exception {
        // reverse complement of the single-site sequence: its only window is on the minus strand
        String reverse = "TAGTAGTAGTCCTAGTAGTAGTAGTAGTAGTAGTAGTAGT";
        SequenceRegion region = new SequenceRegion("chr1", 1000, 1040, reverse);
        ScanOrchestrator orchestrator = new ScanOrchestrator(
            new CountingModel(46, row -> 1.0), ScoringMode.CLASSIFICATION, PipelineSettings.withThreads(1));
        List<ScoredCandidate> results = new ArrayList<>();

        orchestrator.scan(region, results::add);

        assertThat(results).singleElement().satisfies(site -> {
            assertThat(site.strand()).isEqualTo(Strand.REVERSE);
            assertThat(site.start()).isEqualTo(1011);
            assertThat(site.end()).isEqualTo(1033);
            assertThat(site.sequence()).isEqualTo(SINGLE_SITE.substring(3, 31));
        });
    }

    @Test
    void sumsTotalsOverRegions() throws Exception {
        ScanOrchestrator orchestrator = new ScanOrchestrator(
            new CountingModel(63, row -> row[0]), ScoringMode.REGRESSION,
            PipelineSettings.withThreads(3).withMinScore(50.0));

        ScanSummary summary = orchestrator.scanAll(List.of(
            SequenceRegion.of("a", SINGLE_SITE),
            SequenceRegion.of("b", "G".repeat(30))), result -> { });

        // region b: three forward windows at 100% GC; its reverse strand is all C
        assertThat(summary.candidates()).isEqualTo(4);
        assertThat(summary.scored()).isEqualTo(4);
        assertThat(summary.reported()).isEqualTo(3);
    }

    @Test
    void failureInLaterRegionLeavesNoReportBehind(@TempDir Path tempDir) throws Exception {
        AtomicInteger calls = new AtomicInteger();
        ScanOrchestrator orchestrator = new ScanOrchestrator(
            new CountingModel(63, row -> {
                if (calls.incrementAndGet() > 3) {
                    throw new IllegalStateException("model crashed");
                }
                return 1.0;
            }),
            ScoringMode.REGRESSION, PipelineSettings.withThreads(1));
        Path report = tempDir.resolve("report.txt");

        // region a scores its three windows; the first row of region b fails
        assertThatThrownBy(() -> {
            try (ReportWriter writer = ReportWriter.open(report)) {
                orchestrator.scanAll(List.of(
                    SequenceRegion.of("a", "G".repeat(30)),
                    SequenceRegion.of("b", "G".repeat(30))), writer);
                writer.commit();
            }
        }).isInstanceOf(PipelineException.class).hasMessageContaining("model crashed");

        assertThat(report).doesNotExist();
        try (var files = Files.list(tempDir)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    void rejectsModelOfWrongWidth() {
        assertThatThrownBy(() -> new ScanOrchestrator(
            new CountingModel(46, row -> 0), ScoringMode.REGRESSION, PipelineSettings.withThreads(1)))
            .isInstanceOf(ModelException.class)
            .hasMessageContaining("46");
    }
}
