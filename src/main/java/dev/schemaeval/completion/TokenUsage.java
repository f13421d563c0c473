package dev.schemaeval.completion;

import javax.annotation.Nullable;

/** Token accounting reported by the completion service. Any field may be absent. */
public record TokenUsage(
        @Nullable Long promptTokens, @Nullable Long completionTokens, @Nullable Long totalTokens) {

    /** Total tokens, falling back to prompt + completion when the service omits the total. */
    @Nullable
    public Long total() {
        if (totalTokens != null) {
            return totalTokens;
        }
        if (promptTokens == null && completionTokens == null) {
            return null;
        }
        return (promptTokens == null ? 0L : promptTokens)
                + (completionTokens == null ? 0L : completionTokens);
    }
}
