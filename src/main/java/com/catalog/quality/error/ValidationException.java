package com.catalog.quality.error;

public class ValidationException extends QualityEngineException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
