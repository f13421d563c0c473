package dev.schemaeval.prompt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import javax.annotation.Nonnull;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Renders a prompt template for a single mock item.
 *
 * <p>Every occurrence of the placeholder is replaced with the item serialized as compact JSON.
 * Nothing else in the template is interpreted.
 */
public final class PromptRenderer {
    public static final String DEFAULT_PLACEHOLDER = "{{INPUT_DATA}}";

    // no naming strategy: items are written exactly as stored
    private static final ObjectMapper ITEM_WRITER = new ObjectMapper();

    @Getter
    @Accessors(fluent = true)
    private final String placeholder;

    public PromptRenderer() {
        this(DEFAULT_PLACEHOLDER);
    }

    public PromptRenderer(@Nonnull String placeholder) {
        if (placeholder.isEmpty()) {
            throw new IllegalArgumentException("placeholder must not be empty");
        }
        this.placeholder = placeholder;
    }

    public boolean hasPlaceholder(@Nonnull String template) {
        return template.contains(placeholder);
    }

    public String render(@Nonnull String template, @Nonnull JsonNode item) {
        if (!hasPlaceholder(template)) {
            throw new PromptRenderException(
                    "template does not contain the placeholder " + placeholder);
        }
        return template.replace(placeholder, serialize(item));
    }

    private static String serialize(JsonNode item) {
        try {
            return ITEM_WRITER.writeValueAsString(item);
        } catch (JsonProcessingException e) {
            throw new PromptRenderException("unable to serialize item: " + e.getOriginalMessage());
        }
    }
}
