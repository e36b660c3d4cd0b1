package phoenixcenter.defenceprofiler.entity;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * One usable row of a directional BLAST table, keyed by the genome protein it describes.
 */
@Data
@AllArgsConstructor
public class BlastHit {

    private String proteinId;

    private BlastMetrics metrics;

    private double bitScore;
}
