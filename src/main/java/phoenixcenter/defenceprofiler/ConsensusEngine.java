package phoenixcenter.defenceprofiler;

import phoenixcenter.defenceprofiler.entity.BlastMetrics;
import phoenixcenter.defenceprofiler.entity.ConsensusResult;
import phoenixcenter.defenceprofiler.entity.ConsensusStatus;
import phoenixcenter.defenceprofiler.entity.FilterVerdict;
import phoenixcenter.defenceprofiler.entity.ProteinEvidence;
import phoenixcenter.defenceprofiler.entity.SystemCall;
import phoenixcenter.defenceprofiler.entity.ToolCall;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides one system call per protein from its classifier and BLAST evidence.
 * <ol>
 * <li>No classifier call: forward and reverse BLAST must name the same system and the forward hit
 * must pass the {@link BlastMetricFilter} (BLAST), otherwise the protein is FILTERED.</li>
 * <li>One classifier: its canonical subtype (SINGLE), or a one-sided composite of its own call when
 * the master key has no entry (MAPPING).</li>
 * <li>Both classifiers: equal canonical subtypes are AGREE. Otherwise each classifier starts with one
 * vote, and each BLAST direction naming a classifier's canonical subtype adds one. A strict winner
 * with a mapping is RESOLVED; a tie between two mappings is a CONFLICT; anything involving a missing
 * mapping is MAPPING with both original calls.</li>
 * </ol>
 */
public class ConsensusEngine {

    private static final String PADLOC = "PADLOC";

    private static final String DEFENSE_FINDER = "DefenseFinder";

    private final BlastMetricFilter blastMetricFilter;

    public ConsensusEngine() {
        this(new BlastMetricFilter());
    }

    public ConsensusEngine(BlastMetricFilter blastMetricFilter) {
        this.blastMetricFilter = blastMetricFilter;
    }

    public ConsensusResult decide(ProteinEvidence evidence) {
        ToolCall padloc = evidence.getPadloc();
        ToolCall defenseFinder = evidence.getDefenseFinder();
        Optional<String> forwardName = BlastMetrics.nameOf(evidence.getForwardBlast());
        Optional<String> reverseName = BlastMetrics.nameOf(evidence.getReverseBlast());

        boolean hasPadloc = padloc != null;
        boolean hasDefenseFinder = defenseFinder != null;

        if (!hasPadloc && !hasDefenseFinder) {
            return decideBlastOnly(evidence.getForwardBlast(), forwardName, reverseName);
        } else if (hasPadloc && !hasDefenseFinder) {
            if (padloc.hasMapping()) {
                return ConsensusResult.called(SystemCall.of(padloc.getCanonical().get()),
                        ConsensusStatus.SINGLE, "PADLOC only with mapping");
            }
            return ConsensusResult.called(SystemCall.composite(padloc.getOriginal(), null),
                    ConsensusStatus.MAPPING, "PADLOC only without mapping");
        } else if (!hasPadloc) {
            if (defenseFinder.hasMapping()) {
                return ConsensusResult.called(SystemCall.of(defenseFinder.getCanonical().get()),
                        ConsensusStatus.SINGLE, "DefenseFinder only with mapping");
            }
            return ConsensusResult.called(SystemCall.composite(null, defenseFinder.getOriginal()),
                    ConsensusStatus.MAPPING, "DefenseFinder only without mapping");
        } else if (padloc.hasMapping() || defenseFinder.hasMapping()) {
            return decideByVote(padloc, defenseFinder, forwardName, reverseName);
        } else if (!padloc.hasMapping() && !defenseFinder.hasMapping()) {
            return ConsensusResult.called(originalComposite(padloc, defenseFinder),
                    ConsensusStatus.MAPPING, "Both tools without mapping");
        }
        return ConsensusResult.error("Unexpected case in consensus logic");
    }

    private ConsensusResult decideBlastOnly(String forwardSummary,
                                            Optional<String> forwardName,
                                            Optional<String> reverseName) {
        if (!forwardName.isPresent() || !reverseName.isPresent()) {
            return ConsensusResult.filtered("Insufficient BLAST evidence (need both forward and reverse)");
        }
        if (!forwardName.get().equals(reverseName.get())) {
            return ConsensusResult.filtered("BLAST names disagree: " + forwardName.get() + " vs " + reverseName.get());
        }
        Optional<BlastMetrics> metrics = BlastMetrics.parseForward(forwardSummary);
        if (!metrics.isPresent()) {
            return ConsensusResult.filtered("Could not parse forward BLAST metrics");
        }
        FilterVerdict verdict = blastMetricFilter.check(metrics.get());
        if (!verdict.isPassed()) {
            return ConsensusResult.filtered("BLAST-only hit failed filtering: " + verdict.getReason());
        }
        return ConsensusResult.called(SystemCall.of(forwardName.get()), ConsensusStatus.BLAST,
                "BLAST-only hit passed filtering: " + verdict.getReason());
    }

    /**
     * At least one of the two calls is mapped here.
     */
    private ConsensusResult decideByVote(ToolCall padloc,
                                         ToolCall defenseFinder,
                                         Optional<String> forwardName,
                                         Optional<String> reverseName) {
        if (padloc.hasMapping() && defenseFinder.hasMapping()
                && padloc.getCanonical().get().equals(defenseFinder.getCanonical().get())) {
            return ConsensusResult.called(SystemCall.of(padloc.getCanonical().get()),
                    ConsensusStatus.AGREE, "Both tools agree on consensus");
        }

        // each tool votes for itself
        int[] votes = {1, 1};
        List<String> blastEvidence = new ArrayList<>();
        forwardName.ifPresent(name -> vote("Forward", name, padloc, defenseFinder, votes, blastEvidence));
        reverseName.ifPresent(name -> vote("Reverse", name, padloc, defenseFinder, votes, blastEvidence));
        int padlocVotes = votes[0];
        int defenseFinderVotes = votes[1];
        String support = String.join("; ", blastEvidence);

        if (padlocVotes > defenseFinderVotes) {
            return winner(PADLOC, padloc, padlocVotes, defenseFinderVotes, support, padloc, defenseFinder);
        } else if (defenseFinderVotes > padlocVotes) {
            return winner(DEFENSE_FINDER, defenseFinder, defenseFinderVotes, padlocVotes, support, padloc, defenseFinder);
        }
        if (padloc.hasMapping() && defenseFinder.hasMapping()) {
            return ConsensusResult.called(
                    SystemCall.composite(padloc.getCanonical().get(), defenseFinder.getCanonical().get()),
                    ConsensusStatus.CONFLICT,
                    "Tied votes " + padlocVotes + "vs" + defenseFinderVotes + ": " + support);
        }
        // TODO: a tie with one mapped side drops that mapping for both original calls; decide whether the mapped side should win
        return ConsensusResult.called(originalComposite(padloc, defenseFinder), ConsensusStatus.MAPPING,
                "Tied votes with mapping issues: " + support);
    }

    /**
     * Score one BLAST direction. PADLOC is checked first; a call without mapping never gets support.
     */
    private static void vote(String direction,
                             String blastName,
                             ToolCall padloc,
                             ToolCall defenseFinder,
                             int[] votes,
                             List<String> blastEvidence) {
        if (supports(blastName, padloc)) {
            votes[0]++;
            blastEvidence.add(direction + " supports " + PADLOC + " (" + blastName + ")");
        } else if (supports(blastName, defenseFinder)) {
            votes[1]++;
            blastEvidence.add(direction + " supports " + DEFENSE_FINDER + " (" + blastName + ")");
        } else {
            blastEvidence.add(direction + " supports neither (" + blastName + ")");
        }
    }

    private static boolean supports(String blastName, ToolCall call) {
        return call.getCanonical().map(blastName::equals).orElse(false);
    }

    private static ConsensusResult winner(String tool,
                                          ToolCall winning,
                                          int winnerVotes,
                                          int loserVotes,
                                          String support,
                                          ToolCall padloc,
                                          ToolCall defenseFinder) {
        if (winning.hasMapping()) {
            return ConsensusResult.called(SystemCall.of(winning.getCanonical().get()), ConsensusStatus.RESOLVED,
                    tool + " wins voting " + winnerVotes + "vs" + loserVotes + ": " + support);
        }
        return ConsensusResult.called(originalComposite(padloc, defenseFinder), ConsensusStatus.MAPPING,
                tool + " wins voting but no mapping: " + support);
    }

    private static SystemCall originalComposite(ToolCall padloc, ToolCall defenseFinder) {
        return SystemCall.composite(padloc.getOriginal(), defenseFinder.getOriginal());
    }
}
