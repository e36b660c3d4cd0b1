package phoenixcenter.defenceprofiler.entity;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class FilterVerdict {

    private final boolean passed;

    private final String reason;
}
