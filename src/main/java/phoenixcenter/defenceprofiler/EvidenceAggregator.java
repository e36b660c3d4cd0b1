package phoenixcenter.defenceprofiler;

import lombok.extern.log4j.Log4j2;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import phoenixcenter.defenceprofiler.entity.BlastHit;
import phoenixcenter.defenceprofiler.entity.BlastMetrics;
import phoenixcenter.defenceprofiler.entity.ProteinEvidence;
import phoenixcenter.defenceprofiler.entity.ToolCall;
import phoenixcenter.defenceprofiler.io.DelimitedTable;
import phoenixcenter.defenceprofiler.io.Delimiter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Collects the evidence of one genome from the PADLOC table, the DefenseFinder genes table and the
 * forward and reverse BLAST tables into one {@link ProteinEvidence} per protein.
 * <p>
 * A source that is not given, missing on disk or empty contributes nothing. Invalid rows are logged
 * and skipped.
 */
@Log4j2
public class EvidenceAggregator {

    public static final String PADLOC_ID_COLUMN = "target.name";

    public static final String PADLOC_CALL_COLUMN = "system";

    public static final String DEFENSE_FINDER_ID_COLUMN = "hit_id";

    public static final String DEFENSE_FINDER_CALL_COLUMN = "subtype";

    /**
     * BLAST outfmt "6 qseqid sseqid pident length mismatch gapopen qstart qend sstart send evalue
     * bitscore qcovs qlen slen"
     */
    public static final List<String> BLAST_COLUMNS = Collections.unmodifiableList(Arrays.asList(
            "qseqid", "sseqid", "pident", "length", "mismatch", "gapopen", "qstart", "qend",
            "sstart", "send", "evalue", "bitscore", "qcovs", "qlen", "slen"));

    private final MappingTable mappingTable;

    private final SystemNames systemNames;

    public EvidenceAggregator(MappingTable mappingTable) {
        this(mappingTable, new SystemNames());
    }

    public EvidenceAggregator(MappingTable mappingTable, SystemNames systemNames) {
        this.mappingTable = mappingTable;
        this.systemNames = systemNames;
    }

    /**
     * @param padlocFile        PADLOC csv whatever its extension, may be null
     * @param defenseFinderFile DefenseFinder genes tsv whatever its extension, may be null
     * @param forwardBlastFile  genome proteins vs reference set, may be null
     * @param reverseBlastFile  reference set vs genome proteins, may be null
     * @return evidence by protein id, sorted by protein id
     * @throws IOException           if an existing source cannot be read
     * @throws IllegalStateException if a classifier table lacks its id or call column
     */
    public Map<String, ProteinEvidence> aggregate(Path padlocFile,
                                                  Path defenseFinderFile,
                                                  Path forwardBlastFile,
                                                  Path reverseBlastFile) throws IOException {
        Map<String, ProteinEvidence> evidence = new TreeMap<>();
        addPadloc(evidence, padlocFile);
        addDefenseFinder(evidence, defenseFinderFile);
        addForwardBlast(evidence, forwardBlastFile);
        addReverseBlast(evidence, reverseBlastFile);
        log.info("{} proteins with evidence", evidence.size());
        return evidence;
    }

    public int addPadloc(Map<String, ProteinEvidence> evidence, Path padlocFile) throws IOException {
        return addClassifier(evidence, padlocFile, "PADLOC", Delimiter.COMMA,
                PADLOC_ID_COLUMN, PADLOC_CALL_COLUMN,
                mappingTable::padlocSubtype, ProteinEvidence::setPadloc);
    }

    public int addDefenseFinder(Map<String, ProteinEvidence> evidence, Path defenseFinderFile) throws IOException {
        return addClassifier(evidence, defenseFinderFile, "DefenseFinder", Delimiter.TAB,
                DEFENSE_FINDER_ID_COLUMN, DEFENSE_FINDER_CALL_COLUMN,
                mappingTable::defenseFinderSubtype, ProteinEvidence::setDefenseFinder);
    }

    /**
     * Forward hits are keyed by the query (genome protein); the subject names the system.
     */
    public int addForwardBlast(Map<String, ProteinEvidence> evidence, Path forwardBlastFile) throws IOException {
        Map<String, BlastHit> bestHits = readBlast(forwardBlastFile, "Forward BLAST", "qseqid", "sseqid", true);
        bestHits.values().forEach(hit -> evidenceOf(evidence, hit.getProteinId())
                .setForwardBlast(hit.getMetrics().toForwardSummary()));
        return bestHits.size();
    }

    /**
     * Reverse hits are keyed by the subject (genome protein); the query names the system.
     */
    public int addReverseBlast(Map<String, ProteinEvidence> evidence, Path reverseBlastFile) throws IOException {
        Map<String, BlastHit> bestHits = readBlast(reverseBlastFile, "Reverse BLAST", "sseqid", "qseqid", false);
        bestHits.values().forEach(hit -> evidenceOf(evidence, hit.getProteinId())
                .setReverseBlast(hit.getMetrics().toReverseSummary()));
        return bestHits.size();
    }

    private int addClassifier(Map<String, ProteinEvidence> evidence,
                              Path file,
                              String source,
                              Delimiter delimiter,
                              String idColumn,
                              String callColumn,
                              Function<String, Optional<String>> mapping,
                              BiConsumer<ProteinEvidence, ToolCall> setter) throws IOException {
        if (!hasContent(file, source)) {
            return 0;
        }
        DelimitedTable table = DelimitedTable.read(file, delimiter);
        if (table.getColumns().isEmpty()) {
            log.info("{} file {} has no content, no defence systems found", source, file);
            return 0;
        }
        if (!table.hasColumns(idColumn, callColumn)) {
            throw new IllegalStateException(source + " file " + file + " lacks required columns "
                    + idColumn + " and " + callColumn + ", found " + table.getColumns());
        }
        if (table.isEmpty()) {
            log.info("{} file {} has headers but no data rows, no defence systems found", source, file);
            return 0;
        }
        int processed = 0;
        for (Map<String, String> row : table.getRows()) {
            String proteinId = StringUtils.trimToNull(row.get(idColumn));
            if (proteinId == null) {
                log.warn("skipping {} row with invalid protein id: {}", source, row);
                continue;
            }
            String call = StringUtils.trimToNull(row.get(callColumn));
            String normalized = call == null ? null : StringUtils.trimToNull(systemNames.normalize(call));
            if (normalized == null) {
                log.warn("skipping {} row with invalid call {} for {}", source, call, proteinId);
                continue;
            }
            setter.accept(evidenceOf(evidence, proteinId), ToolCall.of(normalized, mapping.apply(normalized)));
            processed++;
        }
        log.info("{}: {} entries, {} valid hits", source, table.getRows().size(), processed);
        return processed;
    }

    /**
     * Best hit per genome protein by bit score; the first row wins a tie.
     */
    private Map<String, BlastHit> readBlast(Path file,
                                            String source,
                                            String proteinColumn,
                                            String systemColumn,
                                            boolean withLengths) throws IOException {
        Map<String, BlastHit> bestHits = new LinkedHashMap<>();
        if (!hasContent(file, source)) {
            return bestHits;
        }
        DelimitedTable table = DelimitedTable.read(file, Delimiter.TAB, BLAST_COLUMNS);
        int valid = 0;
        for (Map<String, String> row : table.getRows()) {
            String proteinId = StringUtils.trimToNull(row.get(proteinColumn));
            if (proteinId == null) {
                log.warn("skipping {} row with invalid protein id: {}", source, row);
                continue;
            }
            String systemId = StringUtils.trimToNull(row.get(systemColumn));
            if (systemId == null) {
                log.warn("skipping {} row with no reference id for {}", source, proteinId);
                continue;
            }
            BlastMetrics metrics;
            try {
                metrics = parseMetrics(row, withLengths);
            } catch (NumberFormatException e) {
                log.warn("skipping {} row with invalid numeric data for {}", source, proteinId);
                continue;
            }
            metrics.setSystemName(systemNames.fromBlastId(systemId));
            if (metrics.getSystemName().isEmpty()) {
                log.warn("skipping {} row with empty system name for {}", source, proteinId);
                continue;
            }
            valid++;
            BlastHit hit = new BlastHit(proteinId, metrics, NumberUtils.toDouble(StringUtils.trim(row.get("bitscore"))));
            BlastHit best = bestHits.get(proteinId);
            if (best == null || hit.getBitScore() > best.getBitScore()) {
                bestHits.put(proteinId, hit);
            }
        }
        log.info("{}: {} entries, {} valid hits, {} proteins", source, table.getRows().size(), valid, bestHits.size());
        return bestHits;
    }

    private static BlastMetrics parseMetrics(Map<String, String> row, boolean withLengths) {
        BlastMetrics.BlastMetricsBuilder builder = BlastMetrics.builder()
                .identity(Double.parseDouble(field(row, "pident")))
                .evalue(Double.parseDouble(field(row, "evalue")));
        if (withLengths) {
            builder.length(Integer.parseInt(field(row, "length")))
                    .queryLength(Integer.parseInt(field(row, "qlen")))
                    .subjectLength(Integer.parseInt(field(row, "slen")));
        }
        return builder.build();
    }

    private static String field(Map<String, String> row, String column) {
        String value = StringUtils.trimToNull(row.get(column));
        if (value == null) {
            throw new NumberFormatException("no " + column);
        }
        return value;
    }

    private static boolean hasContent(Path file, String source) throws IOException {
        if (file == null) {
            log.info("no {} file given", source);
            return false;
        }
        if (!Files.exists(file)) {
            log.info("{} file {} does not exist", source, file);
            return false;
        }
        if (Files.size(file) == 0) {
            log.info("{} file {} is empty (0 bytes), no hits", source, file);
            return false;
        }
        return true;
    }

    private static ProteinEvidence evidenceOf(Map<String, ProteinEvidence> evidence, String proteinId) {
        return evidence.computeIfAbsent(proteinId, ProteinEvidence::new);
    }
}
