package dev.schemaeval.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * Turns raw model text into a JSON document.
 *
 * <p>Models frequently wrap JSON in a markdown code fence, so a single surrounding fence (with or
 * without a language tag) is removed before parsing. Parsing is otherwise strict: trailing
 * content after the first value is rejected.
 */
public final class OutputParser {
    private static final String FENCE = "```";
    private static final Pattern LANGUAGE_TAG = Pattern.compile("[A-Za-z0-9_+-]*");

    // floats stay exact so out-of-range literals like 1e309 do not become Infinity
    private final ObjectMapper mapper =
            JsonMapper.builder()
                    .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                    .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                    .build();

    public ParsedOutput parse(@Nullable String raw) {
        if (raw == null || raw.isBlank()) {
            return ParsedOutput.failed("output is empty");
        }
        var text = stripCodeFence(raw);
        try {
            JsonNode document = mapper.readTree(text);
            if (document == null || document.isMissingNode()) {
                return ParsedOutput.failed("output is empty");
            }
            return ParsedOutput.parsed(document);
        } catch (JsonProcessingException e) {
            var location = e.getLocation();
            var where =
                    location == null
                            ? ""
                            : " at line %d, column %d"
                                    .formatted(location.getLineNr(), location.getColumnNr());
            return ParsedOutput.failed(
                    "output is not valid JSON%s: %s".formatted(where, e.getOriginalMessage()));
        }
    }

    static String stripCodeFence(String raw) {
        var text = raw.strip();
        if (!text.startsWith(FENCE)) {
            return text;
        }
        text = text.substring(FENCE.length());
        int newline = text.indexOf('\n');
        if (newline >= 0 && LANGUAGE_TAG.matcher(text.substring(0, newline).strip()).matches()) {
            text = text.substring(newline + 1);
        } else if (text.regionMatches(true, 0, "json", 0, 4)) {
            text = text.substring(4);
        }
        if (text.endsWith(FENCE)) {
            text = text.substring(0, text.length() - FENCE.length());
        }
        return text.strip();
    }
}
