package phoenixcenter.defenceprofiler.entity;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Everything known about one genome protein. Each of the four sources owns one field; a field left
 * {@code null} means that source said nothing about the protein.
 */
@Data
@NoArgsConstructor
public class ProteinEvidence {

    private String proteinId;

    private ToolCall padloc;

    private ToolCall defenseFinder;

    /**
     * name(identity%, E=evalue, L=length, Q=qlen, S=slen)
     */
    private String forwardBlast;

    /**
     * name(identity%, E=evalue)
     */
    private String reverseBlast;

    public ProteinEvidence(String proteinId) {
        this.proteinId = proteinId;
    }
}
