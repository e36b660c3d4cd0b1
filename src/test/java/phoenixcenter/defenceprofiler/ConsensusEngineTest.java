package phoenixcenter.defenceprofiler;

import org.junit.Test;
import phoenixcenter.defenceprofiler.entity.ConsensusResult;
import phoenixcenter.defenceprofiler.entity.ConsensusStatus;
import phoenixcenter.defenceprofiler.entity.ProteinEvidence;
import phoenixcenter.defenceprofiler.entity.ToolCall;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class ConsensusEngineTest {

    static final String FWD_CBASS = "CBASS_IIs(98.2%, E=0.0e+00, L=410, Q=412, S=410)";

    static final String REV_CBASS = "CBASS_IIs(98.0%, E=1.0e-120)";

    ConsensusEngine engine = new ConsensusEngine(new BlastMetricFilter(0.8, 1.25));

    static ProteinEvidence evidence(ToolCall padloc, ToolCall defenseFinder, String forward, String reverse) {
        ProteinEvidence evidence = new ProteinEvidence("1004153.3@BC_00042");
        evidence.setPadloc(padloc);
        evidence.setDefenseFinder(defenseFinder);
        evidence.setForwardBlast(forward);
        evidence.setReverseBlast(reverse);
        return evidence;
    }

    @Test
    public void agree() {
        ConsensusResult result = engine.decide(evidence(
                ToolCall.mapped("cbass_type_II", "CBASS_IIs"), ToolCall.mapped("CBASS_IIs", "CBASS_IIs"), null, null));
        assertEquals(ConsensusStatus.AGREE, result.getStatus());
        assertEquals("CBASS_IIs", result.getFinalName());
        assertEquals("Both tools agree on consensus", result.getExplanation());
    }

    @Test
    public void agreeIgnoresBlast() {
        ConsensusResult result = engine.decide(evidence(
                ToolCall.mapped("gabija", "Gabija"), ToolCall.mapped("Gabija", "Gabija"),
                "Zorya_I(40.0%, E=1.0e-10, L=100, Q=300, S=310)", null));
        assertEquals(ConsensusStatus.AGREE, result.getStatus());
        assertEquals("Gabija", result.getFinalName());
    }

    @Test
    public void resolvedByBlastVotes() {
        ConsensusResult result = engine.decide(evidence(
                ToolCall.unmapped("CBASS_other"), ToolCall.mapped("CBASS_IIs", "CBASS_IIs"), FWD_CBASS, REV_CBASS));
        assertEquals(ConsensusStatus.RESOLVED, result.getStatus());
        assertEquals("CBASS_IIs", result.getFinalName());
        assertEquals("DefenseFinder wins voting 3vs1: Forward supports DefenseFinder (CBASS_IIs); "
                + "Reverse supports DefenseFinder (CBASS_IIs)", result.getExplanation());
    }

    @Test
    public void padlocWins() {
        ConsensusResult result = engine.decide(evidence(
                ToolCall.mapped("cbass_type_II", "CBASS_IIs"), ToolCall.mapped("CBASS_II", "CBASS_II"),
                FWD_CBASS, null));
        assertEquals(ConsensusStatus.RESOLVED, result.getStatus());
        assertEquals("CBASS_IIs", result.getFinalName());
        assertEquals("PADLOC wins voting 2vs1: Forward supports PADLOC (CBASS_IIs)", result.getExplanation());
    }

    @Test
    public void conflictOnTie() {
        ConsensusResult result = engine.decide(evidence(
                ToolCall.mapped("dynamins", "Dynamins"), ToolCall.mapped("Eleos", "Eleos"),
                "Dynamins(88.0%, E=1.0e-90, L=600, Q=610, S=620)", "Eleos(60.0%, E=1.0e-30)"));
        assertEquals(ConsensusStatus.CONFLICT, result.getStatus());
        assertEquals("(p::Dynamins|d::Eleos)", result.getFinalName());
        assertEquals("Tied votes 2vs2: Forward supports PADLOC (Dynamins); Reverse supports DefenseFinder (Eleos)",
                result.getExplanation());
    }

    @Test
    public void conflictWithoutBlast() {
        ConsensusResult result = engine.decide(evidence(
                ToolCall.mapped("dynamins", "Dynamins"), ToolCall.mapped("Eleos", "Eleos"), null, null));
        assertEquals(ConsensusStatus.CONFLICT, result.getStatus());
        assertEquals("(p::Dynamins|d::Eleos)", result.getFinalName());
        assertEquals("Tied votes 1vs1: ", result.getExplanation());
    }

    @Test
    public void tieWithOneMappingKeepsOriginals() {
        ConsensusResult result = engine.decide(evidence(
                ToolCall.unmapped("CBASS_other"), ToolCall.mapped("CBASS_IIs", "CBASS_IIs"),
                "Gabija(70.0%, E=1.0e-80, L=300, Q=300, S=300)", null));
        assertEquals(ConsensusStatus.MAPPING, result.getStatus());
        assertEquals("(p::CBASS_other|d::CBASS_IIs)", result.getFinalName());
        assertEquals("Tied votes with mapping issues: Forward supports neither (Gabija)", result.getExplanation());
    }

    @Test
    public void bothWithoutMapping() {
        ConsensusResult result = engine.decide(evidence(
                ToolCall.unmapped("PDC-S70"), ToolCall.unmapped("Olokun"), FWD_CBASS, REV_CBASS));
        assertEquals(ConsensusStatus.MAPPING, result.getStatus());
        assertEquals("(p::PDC-S70|d::Olokun)", result.getFinalName());
        assertEquals("Both tools without mapping", result.getExplanation());
    }

    @Test
    public void singlePadloc() {
        ConsensusResult result = engine.decide(evidence(ToolCall.mapped("gabija", "Gabija"), null, null, null));
        assertEquals(ConsensusStatus.SINGLE, result.getStatus());
        assertEquals("Gabija", result.getFinalName());
        assertEquals("PADLOC only with mapping", result.getExplanation());
    }

    @Test
    public void singleDefenseFinderWithoutMapping() {
        ConsensusResult result = engine.decide(evidence(null, ToolCall.unmapped("Olokun"), FWD_CBASS, null));
        assertEquals(ConsensusStatus.MAPPING, result.getStatus());
        assertEquals("(p::|d::Olokun)", result.getFinalName());
        assertEquals("DefenseFinder only without mapping", result.getExplanation());
    }

    @Test
    public void singlePadlocWithoutMapping() {
        ConsensusResult result = engine.decide(evidence(ToolCall.unmapped("PDC-S70"), null, null, null));
        assertEquals(ConsensusStatus.MAPPING, result.getStatus());
        assertEquals("(p::PDC-S70|d::)", result.getFinalName());
    }

    @Test
    public void blastOnly() {
        ConsensusResult result = engine.decide(evidence(null, null,
                "SystemX(95.0%, E=1.0e-50, L=300, Q=300, S=305)", "SystemX(94.0%, E=2.0e-40)"));
        assertEquals(ConsensusStatus.BLAST, result.getStatus());
        assertEquals("SystemX", result.getFinalName());
        assertEquals("BLAST-only hit passed filtering: Passed filtering", result.getExplanation());
    }

    @Test
    public void blastOnlyLengthMismatch() {
        ConsensusResult result = engine.decide(evidence(null, null,
                "SystemX(95.0%, E=1.0e-50, L=300, Q=300, S=500)", "SystemX(94.0%, E=2.0e-40)"));
        assertEquals(ConsensusStatus.FILTERED, result.getStatus());
        assertNull(result.getFinalName());
        assertTrue(result.isDropped());
        assertEquals("BLAST-only hit failed filtering: Q/S ratio 0.600 outside 0.8-1.25", result.getExplanation());
    }

    @Test
    public void blastOnlyNamesDisagree() {
        ConsensusResult result = engine.decide(evidence(null, null, FWD_CBASS, "Gabija(94.0%, E=2.0e-40)"));
        assertEquals(ConsensusStatus.FILTERED, result.getStatus());
        assertEquals("BLAST names disagree: CBASS_IIs vs Gabija", result.getExplanation());
    }

    @Test
    public void blastOnlyOneDirection() {
        ConsensusResult result = engine.decide(evidence(null, null, FWD_CBASS, null));
        assertEquals(ConsensusStatus.FILTERED, result.getStatus());
        assertEquals("Insufficient BLAST evidence (need both forward and reverse)", result.getExplanation());

        assertEquals(ConsensusStatus.FILTERED, engine.decide(evidence(null, null, null, REV_CBASS)).getStatus());
        assertEquals(ConsensusStatus.FILTERED, engine.decide(evidence(null, null, "No_hit", REV_CBASS)).getStatus());
    }

    @Test
    public void blastOnlyUnparseableMetrics() {
        ConsensusResult result = engine.decide(evidence(null, null, "CBASS_IIs(98.0%, E=1.0e-120)", REV_CBASS));
        assertEquals(ConsensusStatus.FILTERED, result.getStatus());
        assertEquals("Could not parse forward BLAST metrics", result.getExplanation());
    }

    @Test
    public void votesNeverReachUnmappedSide() {
        // BLAST naming the unmapped original call does not count for it
        ConsensusResult result = engine.decide(evidence(
                ToolCall.unmapped("CBASS_other"), ToolCall.mapped("Gabija", "Gabija"),
                "CBASS_other(90.0%, E=1.0e-90, L=300, Q=300, S=300)", "CBASS_other(90.0%, E=1.0e-90)"));
        assertEquals(ConsensusStatus.MAPPING, result.getStatus());
        assertEquals("(p::CBASS_other|d::Gabija)", result.getFinalName());
        assertTrue(result.getExplanation().contains("Forward supports neither (CBASS_other)"));
    }
}
