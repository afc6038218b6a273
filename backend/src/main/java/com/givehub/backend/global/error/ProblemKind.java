package com.givehub.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Closed set of failure categories a workflow operation may report.
 * Each kind maps to exactly one HTTP status at the presentation boundary.
 */
public enum ProblemKind {

    /** Malformed, missing or out-of-range input. Never touches storage. */
    VALIDATION(HttpStatus.BAD_REQUEST),

    /** Referenced entity does not exist. */
    NOT_FOUND(HttpStatus.NOT_FOUND),

    /** Caller lacks the required role or ownership. */
    AUTHORIZATION(HttpStatus.FORBIDDEN),

    /** Requested transition is illegal from the entity's current state. */
    STATE(HttpStatus.UNPROCESSABLE_ENTITY),

    /** A uniqueness or one-outstanding invariant would be violated. */
    CONFLICT(HttpStatus.CONFLICT);

    private final HttpStatus status;

    ProblemKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
