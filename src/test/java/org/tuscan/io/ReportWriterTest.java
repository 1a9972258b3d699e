package org.tuscan.io;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tuscan.pipeline.ScoredCandidate;
import org.tuscan.sequence.Candidate;
import org.tuscan.sequence.Strand;

@Tag("unit")
class ReportWriterTest {

    private static final String WINDOW = "A".repeat(25) + "GGA";

    @TempDir
    Path tempDir;

    @Test
    void formatsAlignedColumns() {
        ScoredCandidate result = new ScoredCandidate(new Candidate(3, WINDOW, Strand.REVERSE), "chr1", 1011, 1033, 0.5);

        String line = ReportWriter.format(result);

        assertThat(line).startsWith("chr1                \t1011        \t1033        \t-     \t" + WINDOW + "  \t0.5");
        assertThat(line).endsWith(System.lineSeparator());
    }

    @Test
    void writesHeaderEvenWithoutResults() throws Exception {
        StringWriter out = new StringWriter();

        try (ReportWriter writer = new ReportWriter(out)) {
            assertThat(writer.lines()).isZero();
        }

        assertThat(out.toString().strip().split("\\s+"))
            .containsExactly("Chromosome", "Start", "End", "Strand", "Sequence", "Score");
    }

    @Test
    void openCreatesParentDirectoriesAndWritesLines() throws Exception {
        Path report = tempDir.resolve("out/nested/report.txt");

        try (ReportWriter writer = ReportWriter.open(report)) {
            writer.accept(new ScoredCandidate(new Candidate(0, WINDOW, Strand.FORWARD), "seq", 6, 28, 1.0));
            writer.accept(new ScoredCandidate(new Candidate(1, WINDOW, Strand.FORWARD), "seq", 7, 29, 0.0));
            assertThat(writer.lines()).isEqualTo(2);
            writer.commit();
        }

        List<String> lines = Files.readAllLines(report);
        assertThat(lines).hasSize(3);
        assertThat(lines.get(1).split("\t")).extracting(String::strip)
            .containsExactly("seq", "6", "28", "+", WINDOW, "1.0");
    }

    @Test
    void reportOnlyAppearsOnCommit() throws Exception {
        Path report = tempDir.resolve("report.txt");

        try (ReportWriter writer = ReportWriter.open(report)) {
            writer.accept(new ScoredCandidate(new Candidate(0, WINDOW, Strand.FORWARD), "seq", 6, 28, 1.0));
            assertThat(report).doesNotExist();
            writer.commit();
            assertThat(report).exists();
        }

        try (var files = Files.list(tempDir)) {
            assertThat(files).containsExactly(report);
        }
    }

    @Test
    void closeWithoutCommitDiscardsStagedReport() throws Exception {
        Path report = tempDir.resolve("report.txt");

        try (ReportWriter writer = ReportWriter.open(report)) {
            writer.accept(new ScoredCandidate(new Candidate(0, WINDOW, Strand.FORWARD), "seq", 6, 28, 1.0));
        }

        assertThat(report).doesNotExist();
        try (var files = Files.list(tempDir)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    void abandonedReportKeepsPreviousFile() throws Exception {
        Path report = tempDir.resolve("report.txt");
        Files.writeString(report, "previous run");

        try (ReportWriter writer = ReportWriter.open(report)) {
            writer.accept(new ScoredCandidate(new Candidate(0, WINDOW, Strand.FORWARD), "seq", 6, 28, 1.0));
        }

        assertThat(report).hasContent("previous run");
    }

    @Test
    void commitReplacesExistingReport() throws Exception {
        Path report = tempDir.resolve("report.txt");
        Files.writeString(report, "previous run");

        try (ReportWriter writer = ReportWriter.open(report)) {
            writer.commit();
        }

        assertThat(Files.readAllLines(report)).singleElement().asString().startsWith("Chromosome");
    }
}
