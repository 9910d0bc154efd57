package com.catalog.quality.error;

/**
 * A target database is unreachable or corrupt.
 */
public class UpstreamException extends QualityEngineException {

    private final String databaseKey;

    public UpstreamException(String databaseKey, String message) {
        super(ErrorKind.UPSTREAM, message);
        this.databaseKey = databaseKey;
    }

    public UpstreamException(String databaseKey, String message, Throwable cause) {
        super(ErrorKind.UPSTREAM, message, cause);
        this.databaseKey = databaseKey;
    }

    public String getDatabaseKey() {
        return databaseKey;
    }
}
