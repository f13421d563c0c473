package dev.schemaeval.schema;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import javax.annotation.Nonnull;

/**
 * A single schema violation found in a model output.
 *
 * @param message human readable description
 * @param path property names ({@link String}) and array indices ({@link Integer}) leading from
 *     the document root to the offending value. Empty for the root itself.
 * @param rule the rule that was broken
 */
public record Violation(
        @Nonnull String message, @Nonnull List<Object> path, @Nonnull RuleKind rule) {

    public Violation {
        path = List.copyOf(path);
    }

    public static Violation parseError(String message) {
        return new Violation(message, List.of(), RuleKind.PARSE);
    }

    /** Renders the path as {@code address.lines[2]}, or {@code $} for the document root. */
    @JsonIgnore
    public String pathString() {
        if (path.isEmpty()) {
            return "$";
        }
        var sb = new StringBuilder();
        for (Object element : path) {
            if (element instanceof Integer) {
                sb.append('[').append(element).append(']');
            } else {
                if (sb.length() > 0) {
                    sb.append('.');
                }
                sb.append(element);
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "%s: %s (%s)".formatted(pathString(), message, rule);
    }
}
