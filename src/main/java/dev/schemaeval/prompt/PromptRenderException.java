package dev.schemaeval.prompt;

/** Thrown when a template cannot be rendered for an item. */
public class PromptRenderException extends RuntimeException {
    public PromptRenderException(String message) {
        super(message);
    }
}
