package org.tuscan.io;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import org.tuscan.pipeline.IScoredCandidateSink;
import org.tuscan.pipeline.ScoredCandidate;

/**
 * Writes scored sites as a column-aligned report: one header line, then one line per site.
 * <p>
 * Line order follows the order in which the collector delivers sites, which is not sorted.
 * <p>
 * A writer created by {@link #open(Path)} stages the report in a hidden temp file next to the
 * target. The target only appears once {@link #commit()} succeeds; closing without a commit
 * deletes the temp file and leaves any previous report untouched.
 */
public class ReportWriter implements IScoredCandidateSink, AutoCloseable {

    /** Column layout shared by the header and every record line. */
    static final String LAYOUT = "%-20s\t%-12s\t%-12s\t%-6s\t%-30s\t%s%n";

    private final Writer writer;
    private final Path target;
    private final Path tempFile;
    private boolean committed;
    private long lines;

    /**
     * Wraps a writer and writes the header line.
     *
     * @param writer the destination; closed by {@link #close()}.
     * @throws IOException if the header cannot be written.
     */
    public ReportWriter(Writer writer) throws IOException {
        this(writer, null, null);
    }

    private ReportWriter(Writer writer, Path target, Path tempFile) throws IOException {
        this.writer = writer instanceof BufferedWriter ? writer : new BufferedWriter(writer);
        this.target = target;
        this.tempFile = tempFile;
        this.writer.write(String.format(LAYOUT, "Chromosome", "Start", "End", "Strand", "Sequence", "Score"));
    }

    /**
     * Starts a report that replaces {@code path} on {@link #commit()}.
     *
     * @param path the report file.
     * @return the writer, staged in a temp file in the same directory.
     * @throws IOException if the directory or temp file cannot be created.
     */
    public static ReportWriter open(Path path) throws IOException {
        Path target = path.toAbsolutePath();
        Path parent = target.getParent();
        Files.createDirectories(parent);
        Path tempFile = Files.createTempFile(parent, "." + target.getFileName(), ".part");
        try {
            return new ReportWriter(Files.newBufferedWriter(tempFile, StandardCharsets.UTF_8), target, tempFile);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
    }

    @Override
    public void accept(ScoredCandidate result) throws IOException {
        writer.write(format(result));
        lines++;
    }

    /**
     * Formats one record line, including the line separator.
     */
    static String format(ScoredCandidate result) {
        return String.format(LAYOUT,
            result.chromosome(),
            result.start(),
            result.end(),
            result.strand().symbol(),
            result.sequence(),
            Double.toString(result.score()));
    }

    /** @return the number of record lines written, not counting the header. */
    public long lines() {
        return lines;
    }

    /**
     * Flushes the report and moves the temp file onto the target, replacing any existing file.
     * A no-op for writers that were not created by {@link #open(Path)}.
     *
     * @throws IOException if the report cannot be flushed or moved.
     */
    public void commit() throws IOException {
        if (tempFile == null || committed) {
            return;
        }
        writer.close();
        try {
            Files.move(tempFile, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
        }
        committed = true;
    }

    @Override
    public void close() throws IOException {
        try {
            writer.close();
        } finally {
            if (tempFile != null && !committed) {
                Files.deleteIfExists(tempFile);
            }
        }
    }
}
