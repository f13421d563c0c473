package dev.schemaeval.schema;

import com.fasterxml.jackson.databind.JsonNode;
import javax.annotation.Nullable;

/** Outcome of parsing a raw model output: either a document or the reason there is none. */
public record ParsedOutput(@Nullable JsonNode document, @Nullable Violation parseError) {

    public static ParsedOutput parsed(JsonNode document) {
        return new ParsedOutput(document, null);
    }

    public static ParsedOutput failed(String message) {
        return new ParsedOutput(null, Violation.parseError(message));
    }

    public boolean isParsed() {
        return document != null;
    }
}
