package com.tessera.core.llm;

/**
 * Thrown when the text generation service does not deliver usable text.
 */
public class GenerationFailureException extends RuntimeException {

    public enum Kind {
        TIMEOUT,
        EMPTY,
        UPSTREAM,
        INTERRUPTED
    }

    private final Kind kind;

    public GenerationFailureException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GenerationFailureException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
