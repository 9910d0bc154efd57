package com.catalog.quality.error;

/**
 * Failure taxonomy shared by the engine and its REST surface.
 */
public enum ErrorKind {
    /** Malformed scope, id or filter. */
    VALIDATION,
    /** Unknown session, group, violation, suggestion, project or database. */
    NOT_FOUND,
    /** A state transition that has already happened or is in progress. */
    CONFLICT,
    /** A target database that cannot be opened or queried. */
    UPSTREAM,
    /** Anything unexpected. */
    INTERNAL
}
