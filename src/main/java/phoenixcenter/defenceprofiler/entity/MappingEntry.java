package phoenixcenter.defenceprofiler.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of the master tool key. Tool-specific columns hold {@code null} when the row has no name
 * for that tool ("/" or empty in the file).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MappingEntry {

    private String padlocSystem;

    private String defenseFinderSubtype;

    private String novelSubtype;

    private String novelType;

    private String defenceOutcome;
}
