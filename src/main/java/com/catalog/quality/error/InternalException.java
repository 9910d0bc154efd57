package com.catalog.quality.error;

public class InternalException extends QualityEngineException {

    public InternalException(String message, Throwable cause) {
        super(ErrorKind.INTERNAL, message, cause);
    }
}
