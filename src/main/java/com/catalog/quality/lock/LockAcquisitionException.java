package com.catalog.quality.lock;

import com.catalog.quality.error.ErrorKind;
import com.catalog.quality.error.QualityEngineException;

/**
 * Thrown when an entity lock cannot be acquired within the configured timeout.
 */
public class LockAcquisitionException extends QualityEngineException {

    public LockAcquisitionException(String message) {
        super(ErrorKind.INTERNAL, message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(ErrorKind.INTERNAL, message, cause);
    }
}
