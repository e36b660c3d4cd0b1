package phoenixcenter.defenceprofiler;

import phoenixcenter.defenceprofiler.entity.Classification;
import phoenixcenter.defenceprofiler.entity.SystemCall;

import java.util.Optional;
import java.util.function.Function;

/**
 * Resolves the system type and defence outcome of a final call. A composite call resolves each side
 * on its own, giving {@code (p::<type>|d::<type>)} and {@code (p::<outcome>|d::<outcome>)} with
 * {@code UNMAPPED} for a side that is empty or unknown.
 */
public class ClassificationResolver {

    static final String UNMAPPED_SIDE = "UNMAPPED";

    private final MappingTable mappingTable;

    public ClassificationResolver(MappingTable mappingTable) {
        this.mappingTable = mappingTable;
    }

    public Classification resolve(String finalName) {
        return resolve(SystemCall.parse(finalName));
    }

    public Classification resolve(SystemCall call) {
        if (!call.isComposite()) {
            return mappingTable.classify(call.getName());
        }
        Optional<Classification> padloc = call.getPadlocSide()
                .filter(mappingTable::isClassified)
                .map(mappingTable::classify);
        Optional<Classification> defenseFinder = call.getDefenseFinderSide()
                .filter(mappingTable::isClassified)
                .map(mappingTable::classify);
        return new Classification(
                composite(padloc, defenseFinder, Classification::getSystemType),
                composite(padloc, defenseFinder, Classification::getSystemOutcome));
    }

    private static String composite(Optional<Classification> padloc,
                                    Optional<Classification> defenseFinder,
                                    Function<Classification, String> field) {
        return "(p::" + padloc.map(field).orElse(UNMAPPED_SIDE)
                + "|d::" + defenseFinder.map(field).orElse(UNMAPPED_SIDE) + ")";
    }
}
