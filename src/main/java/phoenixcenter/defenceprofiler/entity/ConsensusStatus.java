package phoenixcenter.defenceprofiler.entity;

/**
 * Outcome of the consensus decision for one protein.
 */
public enum ConsensusStatus {
    /** Both classifiers map to the same canonical subtype. */
    AGREE,

    /** Classifiers disagree and BLAST votes picked a mapped winner. */
    RESOLVED,

    /** Classifiers disagree on two mapped subtypes and the votes tie. */
    CONFLICT,

    /** A master key entry is missing for the call that matters. */
    MAPPING,

    /** Only one classifier reported the protein, and its call is mapped. */
    SINGLE,

    /** No classifier call; forward and reverse BLAST agree and pass the metric filter. */
    BLAST,

    /** No confident call, the protein is left out of the profile. */
    FILTERED,

    /** Evidence combination the decision procedure does not cover. */
    ERROR;

    /**
     * Statuses that put a protein in front of a curator.
     */
    public boolean needsCuration() {
        return this == MAPPING || this == CONFLICT;
    }
}
