package phoenixcenter.defenceprofiler.cli;


import lombok.extern.log4j.Log4j2;
import phoenixcenter.defenceprofiler.DefenceProfiler;
import phoenixcenter.defenceprofiler.PatternExtractor;
import phoenixcenter.defenceprofiler.entity.CurationResult;
import phoenixcenter.defenceprofiler.entity.ProfileSummary;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

@Log4j2
@Command(name = "DPF", mixinStandardHelpOptions = true, version = "DPF 1.0",
        description = "DefenceProfiler: consensus defence system calls from PADLOC, DefenseFinder and bidirectional BLAST")
public class DefenceProfilerCommand implements Callable<Integer> {

    private DefenceProfiler defenceProfiler = new DefenceProfiler();

    private PatternExtractor patternExtractor = new PatternExtractor();

    @Command(name = "profile", description = "Create the defence profile of one genome")
    public int profile(
            @Option(names = "--padloc", description = "PADLOC CSV output file") String padloc,
            @Option(names = "--defensefinder", description = "DefenseFinder genes TSV output file") String defenseFinder,
            @Option(names = "--forward-blast", description = "Forward BLAST output file (genome vs reference)") String forwardBlast,
            @Option(names = "--reverse-blast", description = "Reverse BLAST output file (reference vs genome)") String reverseBlast,
            @Option(names = "--master-key", description = "Master tool key TSV file", required = true) String masterKey,
            @Option(names = "--output", description = "Output defence profile CSV file, default <genome>_defenceprofile.csv") String output,
            @Option(names = "--genome-id", description = "Genome id, derived from the PADLOC file name by default") String genomeId,
            @Option(names = "--skip-existing", defaultValue = "false",
                    description = "Leave an existing profile untouched, default false") boolean skipExisting,
            @Option(names = "--summary-json", description = "Also write the run summary as JSON") String summaryJson
    ) throws IOException {
        Path padlocFile = existingOrNull(padloc, "PADLOC");
        Path defenseFinderFile = existingOrNull(defenseFinder, "DefenseFinder");
        Path forwardBlastFile = existingOrNull(forwardBlast, "Forward BLAST");
        Path reverseBlastFile = existingOrNull(reverseBlast, "Reverse BLAST");
        Path masterKeyFile = existingOrNull(masterKey, "Master Tool Key");

        if (genomeId == null) {
            if (padlocFile == null) {
                throw new IllegalArgumentException("--genome-id is required when no PADLOC file is given");
            }
            genomeId = DefenceProfiler.genomeIdOf(padlocFile);
        }
        Path profileFile = output == null
                ? defenceProfiler.profileFileOf(Paths.get(""), genomeId)
                : Paths.get(output);
        if (skipExisting && Files.exists(profileFile)) {
            log.info("defence profile {} already exists, skipped", profileFile);
            return 0;
        }
        ProfileSummary summary = defenceProfiler.createProfile(padlocFile, defenseFinderFile,
                forwardBlastFile, reverseBlastFile, masterKeyFile, profileFile, genomeId);
        if (summaryJson != null) {
            defenceProfiler.writeSummary(summary, Paths.get(summaryJson));
        }
        return 0;
    }

    @Command(name = "patterns", description = "Extract unresolved annotation patterns for manual curation")
    public int patterns(
            @Option(names = "--consensus-dir", description = "Directory containing *_defenceprofile.csv files", required = true) String consensusDir,
            @Option(names = "--output", defaultValue = "unresolved_patterns.csv",
                    description = "Output CSV file for manual curation, default unresolved_patterns.csv") String output
    ) throws IOException {
        CurationResult result = patternExtractor.extract(Paths.get(consensusDir), Paths.get(output));
        if (result.getOutcome() == CurationResult.Outcome.NOTHING_TO_CURATE) {
            log.info("nothing to curate in {} ({} profile files)", consensusDir, result.getProfileFiles());
        } else {
            log.info("{} problematic proteins in {} patterns, fill in TYPE, SUBTYPE and OUTCOME of {}",
                    result.getProblematicProteins(), result.getPatterns().size(), result.getOutput());
        }
        return 0;
    }

    /**
     * An explicitly given input must exist.
     */
    private static Path existingOrNull(String file, String fileType) throws NoSuchFileException {
        if (file == null) {
            return null;
        }
        Path path = Paths.get(file);
        if (!Files.exists(path)) {
            throw new NoSuchFileException(file, null, fileType + " file not found");
        }
        return path;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new DefenceProfilerCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        CommandLine.usage(this, System.out);
        return 0;
    }
}
