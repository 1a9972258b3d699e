package org.tuscan.io;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A region in BED coordinates: {@code start} is 0-based, {@code end} is exclusive.
 *
 * @param chromosome the chromosome name.
 * @param start      0-based start.
 * @param end        exclusive end.
 */
public record BedRegion(String chromosome, long start, long end) {

    private static final Pattern LOCATION = Pattern.compile("^([^:\\s]+):([\\d,]+)-([\\d,]+)$");

    public BedRegion {
        if (start < 0 || end <= start) {
            throw new InputFormatException(
                String.format("Invalid region %s:%d-%d, start must be >= 0 and below end", chromosome, start, end));
        }
    }

    /**
     * Parses a 1-based inclusive location such as {@code chr1:1,001-2,000}.
     *
     * @param location the location string.
     * @return the region in BED coordinates, e.g. {@code chr1 1000 2000}.
     * @throws InputFormatException if the string is not of the form {@code chr:start-end} or
     *                              the coordinates are out of order.
     */
    public static BedRegion parseLocation(String location) {
        Matcher matcher = LOCATION.matcher(location.strip());
        if (!matcher.matches()) {
            throw new InputFormatException(
                "Invalid location '" + location + "', expected chromosome:start-end (e.g. chr1:1001-2000)");
        }
        long first;
        long last;
        try {
            first = Long.parseLong(matcher.group(2).replace(",", ""));
            last = Long.parseLong(matcher.group(3).replace(",", ""));
        } catch (NumberFormatException e) {
            throw new InputFormatException("Invalid coordinates in location '" + location + "'", e);
        }
        if (first < 1) {
            throw new InputFormatException("Location start is 1-based and must be >= 1: '" + location + "'");
        }
        return new BedRegion(matcher.group(1), first - 1, last);
    }

    /** @return the region length in bases. */
    public long length() {
        return end - start;
    }
}
