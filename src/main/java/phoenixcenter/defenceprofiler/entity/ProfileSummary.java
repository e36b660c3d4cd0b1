package phoenixcenter.defenceprofiler.entity;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counts for one genome run.
 */
@Data
@NoArgsConstructor
public class ProfileSummary {

    private String genomeId;

    private int totalProteins;

    private int profileRows;

    private Map<ConsensusStatus, Integer> statusCounts = new EnumMap<>(ConsensusStatus.class);

    private int mappedRows;

    private int unmappedRows;

    private Map<String, Integer> outcomeCounts = new LinkedHashMap<>();

    public void countStatus(ConsensusStatus status) {
        statusCounts.merge(status, 1, Integer::sum);
    }

    public int getStatusCount(ConsensusStatus status) {
        return statusCounts.getOrDefault(status, 0);
    }
}
