package phoenixcenter.defenceprofiler.entity;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;
import java.util.Optional;

/**
 * A classifier call: the tool's own (suffix-normalized) name and, when the master key knows it,
 * the canonical subtype.
 */
@EqualsAndHashCode
@ToString
public final class ToolCall {

    @Getter
    private final String original;

    private final String canonical;

    private ToolCall(String original, String canonical) {
        this.original = Objects.requireNonNull(original, "original");
        this.canonical = canonical;
    }

    public static ToolCall mapped(String original, String canonical) {
        return new ToolCall(original, Objects.requireNonNull(canonical, "canonical"));
    }

    public static ToolCall unmapped(String original) {
        return new ToolCall(original, null);
    }

    public static ToolCall of(String original, Optional<String> canonical) {
        return new ToolCall(original, canonical.orElse(null));
    }

    public Optional<String> getCanonical() {
        return Optional.ofNullable(canonical);
    }

    public boolean hasMapping() {
        return canonical != null;
    }
}
