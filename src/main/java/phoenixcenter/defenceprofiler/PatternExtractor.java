package phoenixcenter.defenceprofiler;

import lombok.extern.log4j.Log4j2;
import org.apache.commons.lang3.StringUtils;
import phoenixcenter.defenceprofiler.entity.BlastMetrics;
import phoenixcenter.defenceprofiler.entity.ConsensusStatus;
import phoenixcenter.defenceprofiler.entity.CurationResult;
import phoenixcenter.defenceprofiler.entity.UnresolvedPattern;
import phoenixcenter.defenceprofiler.io.DelimitedTable;
import phoenixcenter.defenceprofiler.io.DelimitedWriter;
import phoenixcenter.defenceprofiler.io.Delimiter;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Groups the MAPPING and CONFLICT proteins of many genome profiles by their raw evidence and writes
 * one curation row per distinct pattern, most frequent first.
 */
@Log4j2
public class PatternExtractor {

    private final String profileSuffix;

    private final int exampleLimit;

    private final int topReport;

    public PatternExtractor() {
        this(GlobalConfig.getValue("profile.file.suffix"),
                GlobalConfig.getIntValue("patterns.example.limit"),
                GlobalConfig.getIntValue("patterns.top.report"));
    }

    public PatternExtractor(String profileSuffix, int exampleLimit, int topReport) {
        this.profileSuffix = profileSuffix;
        this.exampleLimit = exampleLimit;
        this.topReport = topReport;
    }

    /**
     * @param consensusDir directory holding the {@code *_defenceprofile.csv} files
     * @param output       curation csv, written only when there is something to curate
     * @throws NoSuchFileException if the directory does not exist
     */
    public CurationResult extract(Path consensusDir, Path output) throws IOException {
        if (!Files.isDirectory(consensusDir)) {
            throw new NoSuchFileException(consensusDir.toString(), null, "consensus directory not found");
        }
        List<Path> profileFiles = findProfileFiles(consensusDir);
        if (profileFiles.isEmpty()) {
            log.warn("no defence profile files (*{}) found in {}, nothing to curate", profileSuffix, consensusDir);
            return CurationResult.nothingToCurate(0);
        }
        log.info("found {} defence profile files", profileFiles.size());

        List<Map<String, String>> problematic = new ArrayList<>();
        for (Path profileFile : profileFiles) {
            problematic.addAll(loadProblematicRows(profileFile));
        }
        if (problematic.isEmpty()) {
            log.info("no problematic genes found, all defence profiles are clean");
            return CurationResult.nothingToCurate(profileFiles.size());
        }
        logStatusBreakdown(problematic);

        List<UnresolvedPattern> patterns = groupByPattern(problematic);
        log.info("unique patterns found: {}", patterns.size());
        write(output, patterns);
        logTopPatterns(patterns);
        return new CurationResult(CurationResult.Outcome.WRITTEN, profileFiles.size(), problematic.size(),
                patterns, output);
    }

    /**
     * Group rows by (padloc original, deffind original, forward name, reverse name), ordered by
     * descending protein count; equal counts keep first-seen order.
     */
    public List<UnresolvedPattern> groupByPattern(List<Map<String, String>> rows) {
        Map<List<String>, UnresolvedPattern> patterns = new LinkedHashMap<>();
        for (Map<String, String> row : rows) {
            String padloc = orNoHit(row.get("padloc_original"));
            String defenseFinder = orNoHit(row.get("deffind_original"));
            String forward = blastName(row.get("fwd_blast"));
            String reverse = blastName(row.get("rev_blast"));
            String proteinId = row.get("protein_id");
            patterns.computeIfAbsent(Arrays.asList(padloc, defenseFinder, forward, reverse),
                            key -> new UnresolvedPattern(padloc, defenseFinder, forward, reverse))
                    .add(proteinId, genomeIdOf(proteinId));
        }
        return patterns.values().stream()
                .sorted(Comparator.comparingInt(UnresolvedPattern::getProteinCount).reversed())
                .collect(Collectors.toList());
    }

    /**
     * {@code genome@locus -> genome}; an id without '@' is its own genome.
     */
    public static String genomeIdOf(String proteinId) {
        int idx = proteinId.indexOf('@');
        return idx == -1 ? proteinId : proteinId.substring(0, idx);
    }

    private List<Path> findProfileFiles(Path consensusDir) throws IOException {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(consensusDir, "*" + profileSuffix)) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    files.add(file);
                }
            }
        }
        files.sort(Comparator.comparing(f -> f.getFileName().toString()));
        return files;
    }

    private List<Map<String, String>> loadProblematicRows(Path profileFile) {
        DelimitedTable table;
        try {
            table = DelimitedTable.read(profileFile, Delimiter.COMMA);
        } catch (IOException e) {
            log.warn("error processing {}: {}", profileFile, e.getMessage());
            return new ArrayList<>();
        }
        if (!table.isEmpty() && !table.hasColumns("protein_id", "status")) {
            log.warn("{} lacks protein_id or status column, skipped", profileFile);
            return new ArrayList<>();
        }
        return table.getRows().stream()
                .filter(row -> StringUtils.isNotBlank(row.get("protein_id")))
                .filter(row -> isProblematic(row.get("status")))
                .collect(Collectors.toList());
    }

    private static boolean isProblematic(String status) {
        try {
            return status != null && ConsensusStatus.valueOf(status.trim()).needsCuration();
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private void write(Path output, List<UnresolvedPattern> patterns) throws IOException {
        try (DelimitedWriter writer = new DelimitedWriter(output, Delimiter.COMMA)) {
            writer.writeRow(UnresolvedPattern.COLUMNS);
            for (UnresolvedPattern pattern : patterns) {
                writer.writeRow(pattern.toValues(exampleLimit));
            }
        }
        log.info("curation template saved: {}", output);
    }

    private static void logStatusBreakdown(List<Map<String, String>> problematic) {
        log.info("total problematic genes: {}", problematic.size());
        Map<ConsensusStatus, Long> byStatus = problematic.stream()
                .collect(Collectors.groupingBy(row -> ConsensusStatus.valueOf(row.get("status").trim()),
                        () -> new EnumMap<>(ConsensusStatus.class), Collectors.counting()));
        byStatus.forEach((status, count) -> log.info("  {}: {}", status, count));
    }

    private void logTopPatterns(List<UnresolvedPattern> patterns) {
        log.info("top {} most common patterns:", Math.min(topReport, patterns.size()));
        for (int i = 0; i < patterns.size() && i < topReport; i++) {
            UnresolvedPattern p = patterns.get(i);
            log.info(String.format("%2d. n=%4d genomes=%4d  PADLOC:%-15s DF:%-15s Fwd:%-15s Rev:%-15s",
                    i + 1, p.getProteinCount(), p.getGenomeIds().size(),
                    p.getPadloc(), p.getDefenseFinder(), p.getBlastForward(), p.getBlastReverse()));
        }
    }

    private static String orNoHit(String value) {
        return StringUtils.isBlank(value) ? BlastMetrics.NO_HIT : value.trim();
    }

    private static String blastName(String value) {
        return StringUtils.isBlank(value) ? BlastMetrics.NO_HIT
                : BlastMetrics.nameOf(value.trim()).orElse(BlastMetrics.NO_HIT);
    }
}
