package org.tuscan.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tuscan.sequence.Nucleotides;

/**
 * Reads FASTA files.
 * <p>
 * Header lines start with {@code >}; the record label is the first whitespace-delimited
 * token after it. Sequence lines are concatenated and upper-cased. Lines containing
 * characters other than {@code A, C, G, T, N} are kept (the scanner skips windows that
 * cover them) but reported as a warning.
 */
public class FastaReader {

    private static final Logger log = LoggerFactory.getLogger(FastaReader.class);

    /**
     * Reads every record of a file.
     *
     * @param path the FASTA file.
     * @return the records in file order.
     * @throws IOException           if the file cannot be read.
     * @throws InputFormatException if the file contains no record.
     */
    public List<FastaRecord> read(Path path) throws IOException {
        return read(path, label -> true);
    }

    /**
     * Reads the records whose label passes {@code filter}; other records are skipped without
     * buffering their sequence.
     *
     * @param path   the FASTA file.
     * @param filter selects records by label.
     * @return the selected records in file order.
     * @throws IOException           if the file cannot be read.
     * @throws InputFormatException if the file contains no record at all.
     */
    public List<FastaRecord> read(Path path, Predicate<String> filter) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString(), filter);
        }
    }

    /**
     * Reads records from an open source.
     *
     * @param source      the FASTA text.
     * @param description name of the source for messages.
     * @param filter      selects records by label.
     * @return the selected records in source order.
     * @throws IOException           if reading fails.
     * @throws InputFormatException if the source contains no record at all.
     */
    public List<FastaRecord> read(Reader source, String description, Predicate<String> filter) throws IOException {
        List<FastaRecord> records = new ArrayList<>();
        stream(source, description, new IFastaHandler() {
            private String label;
            private final StringBuilder sequence = new StringBuilder();

            @Override
            public boolean beginRecord(String label) {
                this.label = label;
                sequence.setLength(0);
                return filter.test(label);
            }

            @Override
            public void bases(String bases) {
                sequence.append(bases);
            }

            @Override
            public void endRecord() {
                records.add(new FastaRecord(label, sequence.toString()));
            }
        });
        return records;
    }

    /**
     * Streams records from an open source to {@code handler} without buffering any sequence.
     *
     * @param source      the FASTA text.
     * @param description name of the source for messages.
     * @param handler     receives headers and the sequence lines of accepted records.
     * @throws IOException           if reading fails.
     * @throws InputFormatException if the source contains no record at all.
     */
    public void stream(Reader source, String description, IFastaHandler handler) throws IOException {
        BufferedReader reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
        boolean keep = false;
        boolean sawHeader = false;
        int lineNumber = 0;

        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            line = line.strip();
            if (line.isEmpty()) {
                continue;
            }
            if (line.charAt(0) == '>') {
                if (keep) {
                    handler.endRecord();
                }
                sawHeader = true;
                keep = handler.beginRecord(headerLabel(line, lineNumber));
                continue;
            }
            if (!sawHeader) {
                throw new InputFormatException(String.format(
                    "%s line %d: sequence data before the first '>' header", description, lineNumber));
            }
            if (keep) {
                String bases = Nucleotides.normalize(line);
                if (!isAcgtn(bases)) {
                    log.warn("{} line {} contains an invalid nucleotide", description, lineNumber);
                }
                handler.bases(bases);
            }
        }
        if (keep) {
            handler.endRecord();
        }
        if (!sawHeader) {
            throw new InputFormatException(description + " contains no FASTA record");
        }
    }

    private static String headerLabel(String header, int lineNumber) {
        String rest = header.substring(1).strip();
        if (rest.isEmpty()) {
            return "record" + lineNumber;
        }
        int space = indexOfWhitespace(rest);
        return space < 0 ? rest : rest.substring(0, space);
    }

    private static int indexOfWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isAcgtn(String bases) {
        for (int i = 0; i < bases.length(); i++) {
            char c = bases.charAt(i);
            if (!Nucleotides.isBase(c) && c != 'N') {
                return false;
            }
        }
        return true;
    }
}
