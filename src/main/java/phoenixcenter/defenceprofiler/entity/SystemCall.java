package phoenixcenter.defenceprofiler.entity;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The final call of the consensus engine: either a single system name, or a composite that keeps one
 * slot for the PADLOC side and one for the DefenseFinder side when the engine could not pick.
 * <p>
 * A composite serializes as {@code (p::<padloc>|d::<defensefinder>)}, each slot possibly empty.
 */
@EqualsAndHashCode
public final class SystemCall {

    private static final Pattern COMPOSITE = Pattern.compile("\\(p::([^|]*)\\|d::([^)]*)\\)");

    /**
     * null for a composite
     */
    @Getter
    private final String name;

    private final String padlocSide;

    private final String defenseFinderSide;

    private SystemCall(String name, String padlocSide, String defenseFinderSide) {
        this.name = name;
        this.padlocSide = padlocSide;
        this.defenseFinderSide = defenseFinderSide;
    }

    public static SystemCall of(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("system name must not be empty");
        }
        return new SystemCall(name, null, null);
    }

    /**
     * @param padlocSide        null for an empty slot
     * @param defenseFinderSide null for an empty slot
     */
    public static SystemCall composite(String padlocSide, String defenseFinderSide) {
        return new SystemCall(null, nullToEmpty(padlocSide), nullToEmpty(defenseFinderSide));
    }

    /**
     * Read a serialized call. Text that looks like a composite but does not parse is kept as a plain
     * name.
     */
    public static SystemCall parse(String text) {
        if (text.startsWith("(p::") && text.contains("|d::")) {
            Matcher m = COMPOSITE.matcher(text);
            if (m.lookingAt()) {
                return composite(m.group(1).trim(), m.group(2).trim());
            }
        }
        return of(text);
    }

    public boolean isComposite() {
        return name == null;
    }

    public Optional<String> getPadlocSide() {
        return slot(padlocSide);
    }

    public Optional<String> getDefenseFinderSide() {
        return slot(defenseFinderSide);
    }

    public String format() {
        return isComposite() ? "(p::" + padlocSide + "|d::" + defenseFinderSide + ")" : name;
    }

    @Override
    public String toString() {
        return format();
    }

    private static Optional<String> slot(String side) {
        return side == null || side.isEmpty() ? Optional.empty() : Optional.of(side);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
