package org.tuscan.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tuscan.cli.CommandLineInterface;
import org.tuscan.features.ScoringMode;
import org.tuscan.io.BedReader;
import org.tuscan.io.BedRegion;
import org.tuscan.io.FastaReader;
import org.tuscan.io.FastaRecord;
import org.tuscan.io.InputFormatException;
import org.tuscan.io.ReferenceGenome;
import org.tuscan.io.ReportWriter;
import org.tuscan.model.IScoringModel;
import org.tuscan.model.ModelException;
import org.tuscan.model.ModelLoader;
import org.tuscan.pipeline.PipelineException;
import org.tuscan.pipeline.PipelineSettings;
import org.tuscan.pipeline.ScanOrchestrator;
import org.tuscan.pipeline.ScanSummary;
import org.tuscan.sequence.SequenceRegion;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that scans sequences for candidate sites and scores them.
 * <p>
 * The sequence comes either from a FASTA file ({@code -s}) or from a reference genome
 * ({@code -g}) combined with a single location ({@code -l}) or a BED file ({@code -b}).
 * Both strands of every sequence are scanned.
 */
@Command(
    name = "scan",
    mixinStandardHelpOptions = true,
    description = "Scan a sequence or genome region for Cas9 target sites and score them"
)
public class ScanCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ScanCommand.class);

    /**
     * Mutually exclusive genome region options: either --location or --bed, but not both.
     */
    static class RegionOptions {
        @Option(
            names = {"-l", "--location"},
            description = "Genome location, 1-based inclusive (e.g. chr1:1001-2000)"
        )
        String location;

        @Option(
            names = {"-b", "--bed"},
            description = "BED file of genome regions"
        )
        Path bedFile;
    }

    @Option(
        names = {"-m", "--mode"},
        required = true,
        description = "Type of model: ${COMPLETION-CANDIDATES}"
    )
    private ScoringMode mode;

    @Option(
        names = {"-s", "--sequence"},
        description = "FASTA file with the sequence(s) to scan"
    )
    private Path sequenceFile;

    @Option(
        names = {"-g", "--genome"},
        description = "Reference genome FASTA file (requires --location or --bed)"
    )
    private Path genomeFile;

    @ArgGroup(exclusive = true, multiplicity = "0..1")
    RegionOptions regionOptions;

    @Option(
        names = {"-o", "--output"},
        description = "Output file (default: pipeline.output.default-file)"
    )
    private Path outputFile;

    @Option(
        names = {"-t", "--threads"},
        description = "Number of scoring workers (default: pipeline.threads, 0 = all cores)"
    )
    private Integer threads;

    @Option(
        names = {"--model"},
        description = "Model JSON file (default: model.regression / model.classification)"
    )
    private Path modelFile;

    @Option(
        names = {"--min-score"},
        description = "Only report sites scoring at least this value"
    )
    private Double minScore;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        String inputError = validateInput();
        if (inputError != null) {
            log.error(inputError);
            err.println("Error: " + inputError);
            return 1;
        }

        try {
            Config config = parent.getConfig();
            PipelineSettings settings = resolveSettings(config);
            IScoringModel model = new ModelLoader().load(resolveModelPath(config), mode);
            List<SequenceRegion> regions = loadRegions();
            Path output = outputFile != null ? outputFile : Path.of(config.getString("pipeline.output.default-file"));

            ScanOrchestrator orchestrator = new ScanOrchestrator(model, mode, settings);
            ScanSummary summary;
            try (ReportWriter writer = ReportWriter.open(output)) {
                summary = orchestrator.scanAll(regions, writer);
                writer.commit();
            }

            out.printf("Scored %d candidate site(s), wrote %d to %s%n", summary.scored(), summary.reported(), output);
            return 0;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Scan interrupted");
            err.println("Error: scan interrupted");
            return 1;
        } catch (PipelineException e) {
            log.error("Scan aborted: {}", e.getMessage());
            log.debug("Exception details:", e);
            err.println("Error: scan aborted: " + e.getMessage());
            return 1;
        } catch (ModelException | InputFormatException | ConfigException | IllegalArgumentException | IOException e) {
            log.error("Scan failed: {}", e.getMessage());
            log.debug("Exception details:", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    /**
     * @return a diagnostic if the input options do not name exactly one sequence source.
     */
    private String validateInput() {
        boolean hasRegion = regionOptions != null;
        if (sequenceFile == null && genomeFile == null) {
            return "No sequence supplied, use --sequence or --genome with --location/--bed";
        }
        if (sequenceFile != null && (genomeFile != null || hasRegion)) {
            return "--sequence cannot be combined with --genome, --location or --bed";
        }
        if (genomeFile != null && !hasRegion) {
            return "--genome requires --location or --bed";
        }
        return null;
    }

    private PipelineSettings resolveSettings(Config config) {
        PipelineSettings settings = PipelineSettings.fromConfig(config.getConfig("pipeline"));
        if (threads != null) {
            if (threads < 0) {
                throw new IllegalArgumentException("--threads cannot be negative, got " + threads);
            }
            settings = settings.withThreadCount(threads == 0 ? PipelineSettings.defaultThreads() : threads);
        }
        if (minScore != null) {
            settings = settings.withMinScore(minScore);
        }
        return settings;
    }

    private Path resolveModelPath(Config config) {
        if (modelFile != null) {
            return modelFile;
        }
        String key = "model." + mode.displayName().toLowerCase(Locale.ROOT);
        if (!config.hasPath(key)) {
            throw new ModelException("No " + mode.displayName() + " model configured, use --model or set " + key);
        }
        return Path.of(config.getString(key));
    }

    private List<SequenceRegion> loadRegions() throws IOException {
        if (sequenceFile != null) {
            List<SequenceRegion> regions = new ArrayList<>();
            for (FastaRecord record : new FastaReader().read(sequenceFile)) {
                regions.add(record.toRegion());
            }
            return regions;
        }
        List<BedRegion> bedRegions = regionOptions.location != null
            ? List.of(BedRegion.parseLocation(regionOptions.location))
            : new BedReader().read(regionOptions.bedFile);
        return ReferenceGenome.load(genomeFile, bedRegions).extractAll(bedRegions);
    }
}
