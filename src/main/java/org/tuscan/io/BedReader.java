package org.tuscan.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the first three columns ({@code chrom start end}) of a BED file.
 * <p>
 * Blank lines and {@code #}, {@code track} and {@code browser} lines are skipped. Columns may
 * be separated by tabs or spaces; extra columns are ignored.
 */
public class BedReader {

    /**
     * @param path the BED file.
     * @return the regions in file order.
     * @throws IOException           if the file cannot be read.
     * @throws InputFormatException if a line is malformed.
     */
    public List<BedRegion> read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        }
    }

    /**
     * @param source      the BED text.
     * @param description name of the source for messages.
     * @return the regions in source order.
     * @throws IOException           if reading fails.
     * @throws InputFormatException if a line is malformed.
     */
    public List<BedRegion> read(Reader source, String description) throws IOException {
        BufferedReader reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
        List<BedRegion> regions = new ArrayList<>();
        int lineNumber = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#") || trimmed.startsWith("track") || trimmed.startsWith("browser")) {
                continue;
            }
            String[] columns = trimmed.split("\\s+");
            if (columns.length < 3) {
                throw new InputFormatException(String.format(
                    "%s line %d: invalid bed line, must have at least 3 columns", description, lineNumber));
            }
            try {
                regions.add(new BedRegion(columns[0], Long.parseLong(columns[1]), Long.parseLong(columns[2])));
            } catch (NumberFormatException e) {
                throw new InputFormatException(String.format(
                    "%s line %d: start and end must be integers", description, lineNumber), e);
            } catch (InputFormatException e) {
                throw new InputFormatException(String.format("%s line %d: %s", description, lineNumber, e.getMessage()), e);
            }
        }
        return regions;
    }
}
