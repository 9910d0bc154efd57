package com.catalog.quality.error;

public class NotFoundException extends QualityEngineException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public static NotFoundException of(String what, Object id) {
        return new NotFoundException(what + " not found: " + id);
    }
}
