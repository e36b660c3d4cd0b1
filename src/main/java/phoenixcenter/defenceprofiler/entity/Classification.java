package phoenixcenter.defenceprofiler.entity;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class Classification {

    public static final String UNMAPPED_TYPE = "UNMAPPED_TYPE";

    public static final String UNMAPPED_OUTCOME = "UNMAPPED_OUTCOME";

    public static final Classification UNMAPPED = new Classification(UNMAPPED_TYPE, UNMAPPED_OUTCOME);

    private final String systemType;

    private final String systemOutcome;

    public boolean isMapped() {
        return !UNMAPPED_TYPE.equals(systemType);
    }
}
