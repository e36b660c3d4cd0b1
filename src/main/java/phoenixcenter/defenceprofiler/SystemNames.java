package phoenixcenter.defenceprofiler;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Normalizes system names reported by the tools and the BLAST reference set.
 * <p>
 * The tools tag the first (often only) variant of a system with a trailing {@code _1}; it is dropped
 * so that {@code Gabija_1} and {@code Gabija} resolve to the same master key entry. Names listed as
 * exceptions keep their suffix.
 */
public class SystemNames {

    private static final String FIRST_VARIANT_SUFFIX = "_1";

    private final Set<String> exceptions;

    public SystemNames() {
        this(GlobalConfig.getListValue("name.suffix.exceptions"));
    }

    public SystemNames(Collection<String> exceptions) {
        this.exceptions = Collections.unmodifiableSet(new LinkedHashSet<>(exceptions));
    }

    /**
     * Drop one trailing {@code _1} unless the name is an exception.
     */
    public String normalize(String name) {
        if (exceptions.contains(name)) {
            return name;
        }
        if (name.endsWith(FIRST_VARIANT_SUFFIX)) {
            return name.substring(0, name.length() - FIRST_VARIANT_SUFFIX.length());
        }
        return name;
    }

    /**
     * System name of a BLAST reference identifier {@code locus#systemname[_1]}, normalized. An
     * identifier without {@code #} is taken as the system name itself.
     */
    public String fromBlastId(String blastId) {
        int idx = blastId.indexOf('#');
        String system = idx == -1 ? blastId : blastId.substring(idx + 1);
        int next = system.indexOf('#');
        if (next != -1) {
            system = system.substring(0, next);
        }
        return normalize(system.trim());
    }

    public Set<String> getExceptions() {
        return exceptions;
    }
}
