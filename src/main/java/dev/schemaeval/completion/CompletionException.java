package dev.schemaeval.completion;

import javax.annotation.Nullable;
import lombok.Getter;
import lombok.experimental.Accessors;

/** A completion call failed before producing a response. */
@Getter
@Accessors(fluent = true)
public class CompletionException extends RuntimeException {
    public enum Kind {
        TIMEOUT,
        RATE_LIMITED,
        TRANSPORT,
        SERVICE
    }

    private final Kind kind;

    /** HTTP status of the failed call, if there was one. */
    @Nullable private final Integer statusCode;

    public CompletionException(Kind kind, String message) {
        this(kind, null, message, null);
    }

    public CompletionException(Kind kind, String message, Throwable cause) {
        this(kind, null, message, cause);
    }

    public CompletionException(
            Kind kind, @Nullable Integer statusCode, String message, @Nullable Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }
}
