package com.hivemind.core.llm;

/**
 * Thrown when a model exchange cannot be opened.
 */
public class ModelStreamException extends RuntimeException {

    private final ModelErrorKind kind;

    public ModelStreamException(ModelErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ModelStreamException(ModelErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ModelErrorKind getKind() {
        return kind;
    }
}
