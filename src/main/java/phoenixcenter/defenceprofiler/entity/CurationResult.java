package phoenixcenter.defenceprofiler.entity;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * What a pattern extraction run produced.
 */
@Data
@AllArgsConstructor
public class CurationResult {

    public enum Outcome {
        /** curation template written */
        WRITTEN,
        /** no profile files, or no MAPPING / CONFLICT rows in them; nothing written */
        NOTHING_TO_CURATE
    }

    private final Outcome outcome;

    private final int profileFiles;

    private final int problematicProteins;

    private final List<UnresolvedPattern> patterns;

    private final Path output;

    public static CurationResult nothingToCurate(int profileFiles) {
        return new CurationResult(Outcome.NOTHING_TO_CURATE, profileFiles, 0, Collections.emptyList(), null);
    }
}
