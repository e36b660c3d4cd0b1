package phoenixcenter.defenceprofiler.entity;

import lombok.Data;

import java.util.Objects;

@Data
public class ConsensusResult {

    /**
     * null exactly when the status is FILTERED or ERROR
     */
    private final SystemCall finalCall;

    private final ConsensusStatus status;

    private final String explanation;

    private ConsensusResult(SystemCall finalCall, ConsensusStatus status, String explanation) {
        this.finalCall = finalCall;
        this.status = status;
        this.explanation = explanation;
    }

    public static ConsensusResult called(SystemCall finalCall, ConsensusStatus status, String explanation) {
        if (status == ConsensusStatus.FILTERED || status == ConsensusStatus.ERROR) {
            throw new IllegalArgumentException(status + " results carry no call");
        }
        return new ConsensusResult(Objects.requireNonNull(finalCall, "finalCall"), status, explanation);
    }

    public static ConsensusResult filtered(String explanation) {
        return new ConsensusResult(null, ConsensusStatus.FILTERED, explanation);
    }

    public static ConsensusResult error(String explanation) {
        return new ConsensusResult(null, ConsensusStatus.ERROR, explanation);
    }

    public boolean isDropped() {
        return finalCall == null;
    }

    /**
     * Serialized final call, null when dropped.
     */
    public String getFinalName() {
        return finalCall == null ? null : finalCall.format();
    }
}
