package phoenixcenter.defenceprofiler.entity;

import lombok.Data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Problematic proteins sharing the same raw evidence: PADLOC and DefenseFinder calls as the tools
 * reported them, and the forward and reverse BLAST system names.
 */
@Data
public class UnresolvedPattern {

    public static final List<String> COLUMNS = Collections.unmodifiableList(Arrays.asList(
            "PADLOC", "DefenseFinder", "BLAST_fwd", "BLAST_rev", "protein_count", "example_proteins",
            "TYPE", "SUBTYPE", "OUTCOME"));

    private final String padloc;

    private final String defenseFinder;

    private final String blastForward;

    private final String blastReverse;

    private final List<String> proteinIds = new ArrayList<>();

    private final Set<String> genomeIds = new LinkedHashSet<>();

    public void add(String proteinId, String genomeId) {
        proteinIds.add(proteinId);
        genomeIds.add(genomeId);
    }

    public int getProteinCount() {
        return proteinIds.size();
    }

    /**
     * First {@code limit} protein ids joined by ", ", followed by ", ... (n more)" when some are left
     * out.
     */
    public String exampleProteins(int limit) {
        String examples = String.join(", ", proteinIds.subList(0, Math.min(limit, proteinIds.size())));
        if (proteinIds.size() > limit) {
            examples += ", ... (" + (proteinIds.size() - limit) + " more)";
        }
        return examples;
    }

    /**
     * Curation row in {@link #COLUMNS} order; TYPE, SUBTYPE and OUTCOME are left for the curator.
     */
    public List<String> toValues(int exampleLimit) {
        return Arrays.asList(padloc, defenseFinder, blastForward, blastReverse,
                String.valueOf(getProteinCount()), exampleProteins(exampleLimit), "", "", "");
    }
}
