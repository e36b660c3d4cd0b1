package phoenixcenter.defenceprofiler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.log4j.Log4j2;
import phoenixcenter.defenceprofiler.entity.Classification;
import phoenixcenter.defenceprofiler.entity.ConsensusResult;
import phoenixcenter.defenceprofiler.entity.ConsensusStatus;
import phoenixcenter.defenceprofiler.entity.ProfileRow;
import phoenixcenter.defenceprofiler.entity.ProfileSummary;
import phoenixcenter.defenceprofiler.entity.ProteinEvidence;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs one genome end to end: evidence aggregation, consensus, classification and the profile file.
 */
@Log4j2
public class DefenceProfiler {

    private final String profileSuffix = GlobalConfig.getValue("profile.file.suffix");

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final ConsensusEngine consensusEngine;

    private final ProfileWriter profileWriter = new ProfileWriter();

    public DefenceProfiler() {
        this(new ConsensusEngine());
    }

    public DefenceProfiler(ConsensusEngine consensusEngine) {
        this.consensusEngine = consensusEngine;
    }

    /**
     * @param padlocFile        PADLOC csv, may be null
     * @param defenseFinderFile DefenseFinder genes tsv, may be null
     * @param forwardBlastFile  forward BLAST outfmt 6, may be null
     * @param reverseBlastFile  reverse BLAST outfmt 6, may be null
     * @param masterKey         master tool key tsv
     * @param profileFile       output profile csv
     * @param genomeId          genome id reported in the summary
     */
    public ProfileSummary createProfile(Path padlocFile,
                                        Path defenseFinderFile,
                                        Path forwardBlastFile,
                                        Path reverseBlastFile,
                                        Path masterKey,
                                        Path profileFile,
                                        String genomeId) throws IOException {
        MappingTable mappingTable = MappingTable.load(masterKey);
        return createProfileWith(mappingTable, padlocFile, defenseFinderFile, forwardBlastFile, reverseBlastFile,
                profileFile, genomeId);
    }

    public ProfileSummary createProfileWith(MappingTable mappingTable,
                                            Path padlocFile,
                                            Path defenseFinderFile,
                                            Path forwardBlastFile,
                                            Path reverseBlastFile,
                                            Path profileFile,
                                            String genomeId) throws IOException {
        log.info("creating defence profile of genome {} into {}", genomeId, profileFile);
        Map<String, ProteinEvidence> evidence = new EvidenceAggregator(mappingTable)
                .aggregate(padlocFile, defenseFinderFile, forwardBlastFile, reverseBlastFile);
        ClassificationResolver resolver = new ClassificationResolver(mappingTable);

        ProfileSummary summary = new ProfileSummary();
        summary.setGenomeId(genomeId);
        summary.setTotalProteins(evidence.size());
        List<ProfileRow> rows = new ArrayList<>();
        for (ProteinEvidence proteinEvidence : evidence.values()) {
            ConsensusResult result = consensusEngine.decide(proteinEvidence);
            summary.countStatus(result.getStatus());
            if (result.isDropped()) {
                continue;
            }
            Classification classification = resolver.resolve(result.getFinalCall());
            rows.add(profileWriter.toRow(proteinEvidence, result, classification));
            ConsensusStatus status = result.getStatus();
            if (status == ConsensusStatus.RESOLVED || status == ConsensusStatus.CONFLICT || status == ConsensusStatus.BLAST) {
                log.debug("{}: {} -> {}", proteinEvidence.getProteinId(), status, result.getFinalName());
            }
        }
        profileWriter.write(profileFile, rows);
        summarize(summary, rows);
        logSummary(summary);
        log.info("defence profile saved: {}", profileFile);
        return summary;
    }

    /**
     * Genome id from a PADLOC output name, {@code 1004153.3_padloc.csv -> 1004153.3}.
     */
    public static String genomeIdOf(Path padlocFile) {
        String name = padlocFile.getFileName().toString();
        if (name.toLowerCase(Locale.ROOT).endsWith(".csv")) {
            name = name.substring(0, name.length() - 4);
        }
        return name.replace("_padloc", "");
    }

    /**
     * Default profile file of a genome inside {@code dir}.
     */
    public Path profileFileOf(Path dir, String genomeId) {
        return dir.resolve(genomeId + profileSuffix);
    }

    public void writeSummary(ProfileSummary summary, Path jsonFile) throws IOException {
        Path parent = jsonFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(jsonFile.toFile(), summary);
        log.info("profile summary saved: {}", jsonFile);
    }

    private static void summarize(ProfileSummary summary, List<ProfileRow> rows) {
        summary.setProfileRows(rows.size());
        List<ProfileRow> mapped = rows.stream()
                .filter(row -> !Classification.UNMAPPED_TYPE.equals(row.getFinalSystemType()))
                .collect(Collectors.toList());
        summary.setMappedRows(mapped.size());
        summary.setUnmappedRows(rows.size() - mapped.size());
        mapped.stream()
                .collect(Collectors.groupingBy(ProfileRow::getFinalSystemOutcome, Collectors.counting()))
                .entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .forEach(e -> summary.getOutcomeCounts().put(e.getKey(), e.getValue().intValue()));
    }

    private static void logSummary(ProfileSummary summary) {
        int total = summary.getTotalProteins();
        log.info("total proteins processed: {}, in final profile: {}, filtered out: {}",
                total, summary.getProfileRows(), summary.getStatusCount(ConsensusStatus.FILTERED));
        for (ConsensusStatus status : ConsensusStatus.values()) {
            int count = summary.getStatusCount(status);
            if (count > 0) {
                log.info("  {}: {} ({})", status, count, percent(count, total));
            }
        }
        if (summary.getProfileRows() > 0) {
            log.info("mapped to master key: {} ({}), unmapped: {} ({})",
                    summary.getMappedRows(), percent(summary.getMappedRows(), summary.getProfileRows()),
                    summary.getUnmappedRows(), percent(summary.getUnmappedRows(), summary.getProfileRows()));
            summary.getOutcomeCounts().forEach((outcome, count) -> log.info("  outcome {}: {}", outcome, count));
        }
    }

    private static String percent(int count, int total) {
        return String.format(Locale.ROOT, "%.1f%%", total == 0 ? 0.0 : count * 100.0 / total);
    }
}
