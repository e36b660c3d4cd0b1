package phoenixcenter.defenceprofiler;

import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class SystemNamesTest {

    SystemNames systemNames = new SystemNames(Arrays.asList("DISARM_1", "PD-T7-5_1", "GAO_19"));

    @Test
    public void normalize() {
        assertEquals("Gabija", systemNames.normalize("Gabija_1"));
        assertEquals("CBASS_II", systemNames.normalize("CBASS_II"));
        // only one suffix goes
        assertEquals("Zorya_1", systemNames.normalize("Zorya_1_1"));
        // _11 and _21 are not the first-variant marker
        assertEquals("Thoeris_11", systemNames.normalize("Thoeris_11"));
    }

    @Test
    public void keepExceptions() {
        assertEquals("DISARM_1", systemNames.normalize("DISARM_1"));
        assertEquals("PD-T7-5_1", systemNames.normalize("PD-T7-5_1"));
        assertEquals("GAO_19", systemNames.normalize("GAO_19"));
    }

    @Test
    public void fromBlastId() {
        assertEquals("CBASS_IIs", systemNames.fromBlastId("BC_0123#CBASS_IIs_1"));
        assertEquals("DISARM_1", systemNames.fromBlastId("BC_0456#DISARM_1"));
        assertEquals("Gabija", systemNames.fromBlastId("Gabija_1"));
    }

    @Test
    public void exceptionsFromConfig() {
        assertTrue(new SystemNames().getExceptions().containsAll(Arrays.asList("DISARM_1", "PD-T7-5_1", "GAO_19")));
    }
}
