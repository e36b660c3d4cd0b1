package phoenixcenter.defenceprofiler.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Alignment metrics of a directional BLAST hit, and the summary strings carried in evidence and
 * profile rows.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BlastMetrics {

    public static final String NO_HIT = "No_hit";

    private static final Pattern FORWARD_SUMMARY = Pattern.compile(
            "([^(]+)\\(([0-9.]+)%, E=([0-9.e+-]+), L=([0-9]+), Q=([0-9]+), S=([0-9]+)\\)");

    private static final Pattern LEADING_NAME = Pattern.compile("^([^(]+)");

    private String systemName;

    private double identity;

    private double evalue;

    private int length;

    private int queryLength;

    private int subjectLength;

    public String toForwardSummary() {
        return String.format(Locale.ROOT, "%s(%.1f%%, E=%.1e, L=%d, Q=%d, S=%d)",
                systemName, identity, evalue, length, queryLength, subjectLength);
    }

    public String toReverseSummary() {
        return String.format(Locale.ROOT, "%s(%.1f%%, E=%.1e)", systemName, identity, evalue);
    }

    /**
     * Parse a forward summary back into metrics.
     *
     * @param summary forward summary, may be null
     * @return empty when the summary is absent, {@value #NO_HIT} or not in forward format
     */
    public static Optional<BlastMetrics> parseForward(String summary) {
        if (summary == null || NO_HIT.equals(summary)) {
            return Optional.empty();
        }
        Matcher m = FORWARD_SUMMARY.matcher(summary);
        if (!m.lookingAt()) {
            return Optional.empty();
        }
        try {
            return Optional.of(BlastMetrics.builder()
                    .systemName(m.group(1).trim())
                    .identity(Double.parseDouble(m.group(2)))
                    .evalue(Double.parseDouble(m.group(3)))
                    .length(Integer.parseInt(m.group(4)))
                    .queryLength(Integer.parseInt(m.group(5)))
                    .subjectLength(Integer.parseInt(m.group(6)))
                    .build());
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * System name of a summary string, i.e. the text before the metrics in parentheses.
     *
     * @return empty for a null summary or {@value #NO_HIT}
     */
    public static Optional<String> nameOf(String summary) {
        if (summary == null || NO_HIT.equals(summary)) {
            return Optional.empty();
        }
        Matcher m = LEADING_NAME.matcher(summary);
        if (m.find()) {
            return Optional.of(m.group(1).trim());
        }
        return Optional.of(summary);
    }
}
