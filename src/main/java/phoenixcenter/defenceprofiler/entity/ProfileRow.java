package phoenixcenter.defenceprofiler.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One protein of a genome defence profile.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProfileRow {

    public static final List<String> COLUMNS = Collections.unmodifiableList(Arrays.asList(
            "protein_id", "padloc_original", "padloc_final", "deffind_original", "deffind_final",
            "fwd_blast", "rev_blast", "status", "final_consensus", "explanation",
            "final_system_type", "final_system_subtype", "final_system_outcome"));

    private String proteinId;

    private String padlocOriginal;

    private String padlocFinal;

    private String deffindOriginal;

    private String deffindFinal;

    private String fwdBlast;

    private String revBlast;

    private ConsensusStatus status;

    private String finalConsensus;

    private String explanation;

    private String finalSystemType;

    private String finalSystemSubtype;

    private String finalSystemOutcome;

    /**
     * Values in {@link #COLUMNS} order.
     */
    public List<String> toValues() {
        return Arrays.asList(proteinId, padlocOriginal, padlocFinal, deffindOriginal, deffindFinal,
                fwdBlast, revBlast, status.name(), finalConsensus, explanation,
                finalSystemType, finalSystemSubtype, finalSystemOutcome);
    }
}
