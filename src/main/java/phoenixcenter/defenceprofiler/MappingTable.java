package phoenixcenter.defenceprofiler;

import lombok.extern.log4j.Log4j2;
import org.apache.commons.lang3.StringUtils;
import phoenixcenter.defenceprofiler.entity.Classification;
import phoenixcenter.defenceprofiler.entity.MappingEntry;
import phoenixcenter.defenceprofiler.io.DelimitedTable;
import phoenixcenter.defenceprofiler.io.Delimiter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The master tool key: PADLOC and DefenseFinder vocabularies mapped onto canonical subtypes, and
 * canonical subtypes onto their type and defence outcome. Immutable once built.
 */
@Log4j2
public class MappingTable {

    public static final String PADLOC_COLUMN = "PADLOC_systems";

    public static final String DEFENSE_FINDER_COLUMN = "DefenseFinder_subtypes";

    public static final String SUBTYPE_COLUMN = "Novel_subtypes";

    public static final String TYPE_COLUMN = "Novel_types";

    public static final String OUTCOME_COLUMN = "Defense_outcome";

    /**
     * "no mapping for this tool" in the master key
     */
    public static final String NO_MAPPING = "/";

    private final Map<String, String> padlocToSubtype;

    private final Map<String, String> defenseFinderToSubtype;

    private final Map<String, Classification> subtypeToClassification;

    private MappingTable(Map<String, String> padlocToSubtype,
                         Map<String, String> defenseFinderToSubtype,
                         Map<String, Classification> subtypeToClassification) {
        this.padlocToSubtype = Collections.unmodifiableMap(padlocToSubtype);
        this.defenseFinderToSubtype = Collections.unmodifiableMap(defenseFinderToSubtype);
        this.subtypeToClassification = Collections.unmodifiableMap(subtypeToClassification);
    }

    /**
     * Load the tab separated master key.
     *
     * @throws IOException           if the file cannot be read
     * @throws IllegalStateException if a required column is missing
     */
    public static MappingTable load(Path masterKey) throws IOException {
        log.info("loading master key {}", masterKey);
        DelimitedTable table = DelimitedTable.read(masterKey, Delimiter.TAB);
        if (!table.hasColumns(PADLOC_COLUMN, DEFENSE_FINDER_COLUMN, SUBTYPE_COLUMN, TYPE_COLUMN, OUTCOME_COLUMN)) {
            throw new IllegalStateException("master key " + masterKey + " lacks required columns, found "
                    + table.getColumns());
        }
        List<MappingEntry> entries = table.getRows().stream()
                .map(row -> MappingEntry.builder()
                        .padlocSystem(valueOrNull(row.get(PADLOC_COLUMN)))
                        .defenseFinderSubtype(valueOrNull(row.get(DEFENSE_FINDER_COLUMN)))
                        .novelSubtype(valueOrNull(row.get(SUBTYPE_COLUMN)))
                        .novelType(valueOrNull(row.get(TYPE_COLUMN)))
                        .defenceOutcome(valueOrNull(row.get(OUTCOME_COLUMN)))
                        .build())
                .collect(Collectors.toList());
        MappingTable mappingTable = build(entries);
        log.info("master key entries: {}, PADLOC mappings: {}, DefenseFinder mappings: {}, classification entries: {}",
                entries.size(), mappingTable.padlocToSubtype.size(), mappingTable.defenseFinderToSubtype.size(),
                mappingTable.subtypeToClassification.size());
        return mappingTable;
    }

    /**
     * Build the three lookups. Later entries win over earlier ones with the same key. An entry
     * without a canonical subtype is skipped.
     */
    public static MappingTable build(List<MappingEntry> entries) {
        Map<String, String> padloc = new HashMap<>();
        Map<String, String> defenseFinder = new HashMap<>();
        Map<String, Classification> classification = new HashMap<>();
        for (MappingEntry entry : entries) {
            String subtype = entry.getNovelSubtype();
            if (subtype == null) {
                if (entry.getPadlocSystem() != null || entry.getDefenseFinderSubtype() != null) {
                    log.warn("master key row {} / {} has no canonical subtype, skipped",
                            entry.getPadlocSystem(), entry.getDefenseFinderSubtype());
                }
                continue;
            }
            if (entry.getPadlocSystem() != null) {
                padloc.put(entry.getPadlocSystem(), subtype);
            }
            if (entry.getDefenseFinderSubtype() != null) {
                defenseFinder.put(entry.getDefenseFinderSubtype(), subtype);
            }
            classification.put(subtype, new Classification(
                    entry.getNovelType() == null ? Classification.UNMAPPED_TYPE : entry.getNovelType(),
                    entry.getDefenceOutcome() == null ? Classification.UNMAPPED_OUTCOME : entry.getDefenceOutcome()));
        }
        return new MappingTable(padloc, defenseFinder, classification);
    }

    public Optional<String> padlocSubtype(String padlocSystem) {
        return Optional.ofNullable(padlocToSubtype.get(padlocSystem));
    }

    public Optional<String> defenseFinderSubtype(String defenseFinderSubtype) {
        return Optional.ofNullable(defenseFinderToSubtype.get(defenseFinderSubtype));
    }

    /**
     * Type and outcome of a canonical subtype; unknown subtypes give {@link Classification#UNMAPPED}.
     */
    public Classification classify(String subtype) {
        Classification classification = subtypeToClassification.get(subtype);
        return classification == null ? Classification.UNMAPPED : classification;
    }

    public boolean isClassified(String subtype) {
        return subtypeToClassification.containsKey(subtype);
    }

    private static String valueOrNull(String value) {
        String trimmed = StringUtils.trimToNull(value);
        return trimmed == null || NO_MAPPING.equals(trimmed) ? null : trimmed;
    }
}
