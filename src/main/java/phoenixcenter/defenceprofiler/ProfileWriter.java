package phoenixcenter.defenceprofiler;

import phoenixcenter.defenceprofiler.entity.BlastMetrics;
import phoenixcenter.defenceprofiler.entity.Classification;
import phoenixcenter.defenceprofiler.entity.ConsensusResult;
import phoenixcenter.defenceprofiler.entity.ProfileRow;
import phoenixcenter.defenceprofiler.entity.ProteinEvidence;
import phoenixcenter.defenceprofiler.entity.ToolCall;
import phoenixcenter.defenceprofiler.io.DelimitedWriter;
import phoenixcenter.defenceprofiler.io.Delimiter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Builds and writes the rows of a genome defence profile (comma separated).
 */
public class ProfileWriter {

    public ProfileRow toRow(ProteinEvidence evidence, ConsensusResult result, Classification classification) {
        if (result.isDropped()) {
            throw new IllegalArgumentException(evidence.getProteinId() + " is " + result.getStatus()
                    + " and has no profile row");
        }
        ToolCall padloc = evidence.getPadloc();
        ToolCall defenseFinder = evidence.getDefenseFinder();
        return ProfileRow.builder()
                .proteinId(evidence.getProteinId())
                .padlocOriginal(original(padloc))
                .padlocFinal(canonical(padloc))
                .deffindOriginal(original(defenseFinder))
                .deffindFinal(canonical(defenseFinder))
                .fwdBlast(BlastMetrics.nameOf(evidence.getForwardBlast()).orElse(BlastMetrics.NO_HIT))
                .revBlast(BlastMetrics.nameOf(evidence.getReverseBlast()).orElse(BlastMetrics.NO_HIT))
                .status(result.getStatus())
                .finalConsensus(result.getFinalName())
                .explanation(result.getExplanation())
                .finalSystemType(classification.getSystemType())
                .finalSystemSubtype(result.getFinalName())
                .finalSystemOutcome(classification.getSystemOutcome())
                .build();
    }

    /**
     * Write the header and all rows; an empty list leaves a header-only file.
     */
    public void write(Path output, List<ProfileRow> rows) throws IOException {
        try (DelimitedWriter writer = new DelimitedWriter(output, Delimiter.COMMA)) {
            writer.writeRow(ProfileRow.COLUMNS);
            for (ProfileRow row : rows) {
                writer.writeRow(row.toValues());
            }
        }
    }

    private static String original(ToolCall call) {
        return call == null ? BlastMetrics.NO_HIT : call.getOriginal();
    }

    private static String canonical(ToolCall call) {
        return call == null ? BlastMetrics.NO_HIT : call.getCanonical().orElse(BlastMetrics.NO_HIT);
    }
}
