package phoenixcenter.defenceprofiler;

import phoenixcenter.defenceprofiler.entity.BlastMetrics;
import phoenixcenter.defenceprofiler.entity.FilterVerdict;

import java.util.Locale;

/**
 * Admissibility check for BLAST-only calls. Both the query/subject length ratio and the alignment
 * coverage of the average protein length must fall in {@code [min, max]}, which rejects truncated or
 * fused proteins and partial alignments.
 */
public class BlastMetricFilter {

    private final double min;

    private final double max;

    public BlastMetricFilter() {
        this(GlobalConfig.getDoubleValue("blast.ratio.min"), GlobalConfig.getDoubleValue("blast.ratio.max"));
    }

    public BlastMetricFilter(double min, double max) {
        if (min > max) {
            throw new IllegalArgumentException("ratio window [" + min + ", " + max + "] is empty");
        }
        this.min = min;
        this.max = max;
    }

    public FilterVerdict check(BlastMetrics metrics) {
        if (metrics == null) {
            return new FilterVerdict(false, "No metrics");
        }
        int q = metrics.getQueryLength();
        int s = metrics.getSubjectLength();
        int l = metrics.getLength();

        double qsRatio = s > 0 ? (double) q / s : 0;
        if (outside(qsRatio)) {
            return new FilterVerdict(false, String.format(Locale.ROOT, "Q/S ratio %.3f outside %s-%s",
                    qsRatio, min, max));
        }

        double avgLength = (q + s) / 2.0;
        double coverage = avgLength > 0 ? l / avgLength : 0;
        if (outside(coverage)) {
            return new FilterVerdict(false, String.format(Locale.ROOT, "Coverage %.3f outside %s-%s",
                    coverage, min, max));
        }
        return new FilterVerdict(true, "Passed filtering");
    }

    private boolean outside(double ratio) {
        return ratio < min || ratio > max;
    }
}
