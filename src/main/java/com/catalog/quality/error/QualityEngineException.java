package com.catalog.quality.error;

/**
 * Root of the engine's unchecked exception hierarchy.
 */
public class QualityEngineException extends RuntimeException {

    private final ErrorKind kind;

    public QualityEngineException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public QualityEngineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
