package org.tuscan.io;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tuscan.sequence.SequenceRegion;

/**
 * The requested slices of a reference genome, used to cut out the regions to scan.
 * <p>
 * Loading streams the genome FASTA once and keeps only the bases that fall inside a requested
 * region, plus the length of every requested chromosome. Memory therefore grows with the total
 * region size, not with the chromosome size.
 */
public class ReferenceGenome {

    private static final Logger log = LoggerFactory.getLogger(ReferenceGenome.class);

    private final Map<String, Long> chromosomeLengths;
    private final Map<BedRegion, String> slices;

    ReferenceGenome(Map<String, Long> chromosomeLengths, Map<BedRegion, String> slices) {
        this.chromosomeLengths = Map.copyOf(chromosomeLengths);
        this.slices = Map.copyOf(slices);
    }

    /**
     * Loads the bases covered by {@code regions} from a genome FASTA file.
     *
     * @param genome  the genome FASTA file.
     * @param regions the regions that will be extracted.
     * @return the genome holding the requested slices.
     * @throws IOException           if the file cannot be read.
     * @throws InputFormatException if the file is not FASTA.
     */
    public static ReferenceGenome load(Path genome, Collection<BedRegion> regions) throws IOException {
        RegionSlicer slicer = new RegionSlicer(regions);
        try (Reader reader = Files.newBufferedReader(genome, StandardCharsets.UTF_8)) {
            new FastaReader().stream(reader, genome.toString(), slicer);
        }
        Map<BedRegion, String> slices = slicer.slices();
        log.info("Loaded {} region(s) on {} of {} requested chromosome(s) from {}",
            slices.size(), slicer.lengths.size(), slicer.byChromosome.size(), genome);
        return new ReferenceGenome(slicer.lengths, slices);
    }

    /**
     * Cuts out one region.
     *
     * @param region the region in BED coordinates.
     * @return the region with its sequence.
     * @throws InputFormatException     if the chromosome is unknown or the region runs past its end.
     * @throws IllegalArgumentException if the region was not passed to {@link #load}.
     */
    public SequenceRegion extract(BedRegion region) {
        Long length = chromosomeLengths.get(region.chromosome());
        if (length == null) {
            throw new InputFormatException("Chromosome '" + region.chromosome() + "' not found in genome");
        }
        if (region.end() > length) {
            throw new InputFormatException(String.format(
                "Region %s:%d-%d extends past the end of %s (%d nt)",
                region.chromosome(), region.start(), region.end(), region.chromosome(), length));
        }
        String sequence = slices.get(region);
        if (sequence == null) {
            throw new IllegalArgumentException("Region " + region + " was not requested when the genome was loaded");
        }
        return new SequenceRegion(region.chromosome(), region.start(), region.end(), sequence);
    }

    /**
     * @return the extracted regions, in input order.
     */
    public List<SequenceRegion> extractAll(Collection<BedRegion> regions) {
        List<SequenceRegion> extracted = new ArrayList<>(regions.size());
        for (BedRegion region : regions) {
            extracted.add(extract(region));
        }
        return extracted;
    }

    public boolean contains(String chromosome) {
        return chromosomeLengths.containsKey(chromosome);
    }

    /**
     * Copies the overlap of every FASTA line with the requested regions of its chromosome.
     */
    private static final class RegionSlicer implements IFastaHandler {

        private final Map<String, List<BedRegion>> byChromosome = new HashMap<>();
        private final Map<BedRegion, StringBuilder> buffers = new LinkedHashMap<>();
        private final Map<String, Long> lengths = new HashMap<>();

        private String chromosome;
        // regions of the current chromosome, sorted by start
        private List<BedRegion> active = List.of();
        // regions before this index end at or before the current position
        private int first;
        private long position;

        RegionSlicer(Collection<BedRegion> regions) {
            for (BedRegion region : regions) {
                if (buffers.putIfAbsent(region, new StringBuilder()) == null) {
                    byChromosome.computeIfAbsent(region.chromosome(), c -> new ArrayList<>()).add(region);
                }
            }
            byChromosome.values().forEach(list -> list.sort(Comparator.comparingLong(BedRegion::start)));
        }

        @Override
        public boolean beginRecord(String label) {
            List<BedRegion> wanted = byChromosome.get(label);
            // the first record of a name wins
            if (wanted == null || lengths.containsKey(label)) {
                return false;
            }
            chromosome = label;
            active = wanted;
            first = 0;
            position = 0;
            return true;
        }

        @Override
        public void bases(String bases) {
            long lineEnd = position + bases.length();
            while (first < active.size() && active.get(first).end() <= position) {
                first++;
            }
            for (int i = first; i < active.size() && active.get(i).start() < lineEnd; i++) {
                BedRegion region = active.get(i);
                long from = Math.max(position, region.start());
                long to = Math.min(lineEnd, region.end());
                if (from < to) {
                    buffers.get(region).append(bases, (int) (from - position), (int) (to - position));
                }
            }
            position = lineEnd;
        }

        @Override
        public void endRecord() {
            lengths.put(chromosome, position);
        }

        Map<BedRegion, String> slices() {
            Map<BedRegion, String> slices = new HashMap<>();
            buffers.forEach((region, buffer) -> {
                if (lengths.containsKey(region.chromosome())) {
                    slices.put(region, buffer.toString());
                }
            });
            return slices;
        }
    }
}
