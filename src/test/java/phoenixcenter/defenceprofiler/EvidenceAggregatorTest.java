package phoenixcenter.defenceprofiler;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import phoenixcenter.defenceprofiler.entity.ProteinEvidence;
import phoenixcenter.defenceprofiler.entity.ToolCall;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class EvidenceAggregatorTest {

    static final String PADLOC = String.join("\n",
            "system.number,seqid,system,target.name,hmm.accession",
            "1,contig_1,cbass_type_II,GCF_1@p1,PF18144",
            "2,contig_1,gabija_1,GCF_1@p2,PF13175",
            "3,contig_1,,GCF_1@p3,PF00001",
            "4,contig_1,PDC-S70,GCF_1@p6,PDC00070",
            "");

    static final String DEFENSE_FINDER = String.join("\n",
            "replicon\thit_id\tgene_name\tsubtype",
            "contig_1\tGCF_1@p1\tCapV\tCBASS_IIs",
            "contig_1\tGCF_1@p4\tDrmA\tDISARM_1",
            "contig_1\t\tDrmB\tDISARM_1",
            "");

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    EvidenceAggregator aggregator;

    @Before
    public void setUp() {
        MappingTable table = MappingTable.build(Arrays.asList(
                ClassificationResolverTest.entry("cbass_type_II", "CBASS_IIs", "CBASS_IIs", "CBASS", "Abi"),
                ClassificationResolverTest.entry("gabija", "Gabija", "Gabija", "Gabija", "Abi"),
                ClassificationResolverTest.entry(null, "DISARM_1", "DISARM_1", "DISARM", "RM-like")));
        aggregator = new EvidenceAggregator(table, new SystemNames(Arrays.asList("DISARM_1", "PD-T7-5_1", "GAO_19")));
    }

    static String blastLine(String qseqid, String sseqid, String pident, String length, String evalue,
                            String bitscore, String qlen, String slen) {
        return String.join("\t", qseqid, sseqid, pident, length, "0", "0", "1", length, "1", length,
                evalue, bitscore, "100", qlen, slen);
    }

    Path write(String name, String content) throws IOException {
        Path file = folder.getRoot().toPath().resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    public void classifiers() throws IOException {
        Map<String, ProteinEvidence> evidence = aggregator.aggregate(
                write("GCF_1_padloc.csv", PADLOC), write("GCF_1_defense_finder_genes.tsv", DEFENSE_FINDER),
                null, null);

        assertEquals(Arrays.asList("GCF_1@p1", "GCF_1@p2", "GCF_1@p4", "GCF_1@p6"),
                Arrays.asList(evidence.keySet().toArray()));
        ProteinEvidence p1 = evidence.get("GCF_1@p1");
        assertEquals(ToolCall.mapped("cbass_type_II", "CBASS_IIs"), p1.getPadloc());
        assertEquals(ToolCall.mapped("CBASS_IIs", "CBASS_IIs"), p1.getDefenseFinder());
        assertNull(p1.getForwardBlast());

        assertEquals(ToolCall.mapped("gabija", "Gabija"), evidence.get("GCF_1@p2").getPadloc());
        assertEquals(ToolCall.mapped("DISARM_1", "DISARM_1"), evidence.get("GCF_1@p4").getDefenseFinder());
        assertEquals(ToolCall.unmapped("PDC-S70"), evidence.get("GCF_1@p6").getPadloc());
    }

    @Test
    public void bestBlastHitPerProtein() throws IOException {
        Path forward = write("fwd.tsv", String.join("\n",
                blastLine("GCF_1@p5", "ref_9#SystemY", "60.0", "280", "1e-20", "200", "300", "290"),
                blastLine("GCF_1@p5", "ref_1#SystemX_1", "95.0", "300", "1e-50", "500", "300", "305"),
                blastLine("GCF_1@p7", "ref_2#Gabija", "abc", "300", "1e-50", "500", "300", "305"),
                ""));
        Path reverse = write("rev.tsv", String.join("\n",
                blastLine("ref_1#SystemX", "GCF_1@p5", "94.0", "300", "2e-40", "450", "305", "300"),
                blastLine("ref_3#SystemZ", "GCF_1@p5", "99.0", "300", "1e-90", "100", "305", "300"),
                ""));

        Map<String, ProteinEvidence> evidence = aggregator.aggregate(null, null, forward, reverse);

        assertEquals(1, evidence.size());
        ProteinEvidence p5 = evidence.get("GCF_1@p5");
        assertNull(p5.getPadloc());
        assertNull(p5.getDefenseFinder());
        assertEquals("SystemX(95.0%, E=1.0e-50, L=300, Q=300, S=305)", p5.getForwardBlast());
        assertEquals("SystemX(94.0%, E=2.0e-40)", p5.getReverseBlast());
    }

    @Test
    public void blastNamesKeepExceptions() throws IOException {
        Path forward = write("fwd.tsv",
                blastLine("GCF_1@p8", "ref_4#DISARM_1", "90.0", "300", "1e-60", "400", "300", "300") + "\n");
        Map<String, ProteinEvidence> evidence = aggregator.aggregate(null, null, forward, null);
        assertEquals("DISARM_1(90.0%, E=1.0e-60, L=300, Q=300, S=300)",
                evidence.get("GCF_1@p8").getForwardBlast());
    }

    @Test
    public void missingAndEmptySources() throws IOException {
        Path empty = write("empty_padloc.csv", "");
        Path headerOnly = write("header_only.tsv", "replicon\thit_id\tgene_name\tsubtype\n");
        Map<String, ProteinEvidence> evidence = aggregator.aggregate(empty, headerOnly,
                folder.getRoot().toPath().resolve("missing_fwd.tsv"), null);
        assertTrue(evidence.isEmpty());
    }

    @Test
    public void invalidRowsAreSkipped() throws IOException {
        Map<String, ProteinEvidence> evidence = aggregator.aggregate(write("GCF_1_padloc.csv", PADLOC),
                null, null, null);
        assertFalse(evidence.containsKey("GCF_1@p3"));
        assertEquals(3, evidence.size());
    }

    @Test
    public void callEmptyAfterNormalizationIsSkipped() throws IOException {
        Map<String, ProteinEvidence> evidence = aggregator.aggregate(
                write("GCF_2_padloc.csv", "system,target.name\n_1,GCF_2@p1\ngabija,GCF_2@p2\n"),
                write("GCF_2_genes.tsv", "hit_id\tsubtype\nGCF_2@p3\t_1\n"),
                null, null);
        assertEquals(Arrays.asList("GCF_2@p2"), Arrays.asList(evidence.keySet().toArray()));
    }

    @Test
    public void classifierFormatDoesNotDependOnFileName() throws IOException {
        Map<String, ProteinEvidence> evidence = aggregator.aggregate(
                write("GCF_3_padloc.out", "system,target.name\ngabija,GCF_3@p1\n"),
                write("GCF_3_genes.txt", "hit_id\tsubtype\nGCF_3@p1\tGabija\n"),
                null, null);
        ProteinEvidence p1 = evidence.get("GCF_3@p1");
        assertEquals(ToolCall.mapped("gabija", "Gabija"), p1.getPadloc());
        assertEquals(ToolCall.mapped("Gabija", "Gabija"), p1.getDefenseFinder());
    }

    @Test
    public void repeatedProteinKeepsLastValidRow() throws IOException {
        Map<String, ProteinEvidence> evidence = aggregator.aggregate(
                write("GCF_4_padloc.csv", "system,target.name\ngabija,GCF_4@p1\ncbass_type_II,GCF_4@p1\n,GCF_4@p1\n"),
                null, null, null);
        assertEquals(1, evidence.size());
        assertEquals(ToolCall.mapped("cbass_type_II", "CBASS_IIs"), evidence.get("GCF_4@p1").getPadloc());
    }

    @Test(expected = IllegalStateException.class)
    public void classifierWithoutIdColumn() throws IOException {
        aggregator.aggregate(write("bad_padloc.csv", "seqid,system\ncontig_1,gabija\n"), null, null, null);
    }
}
