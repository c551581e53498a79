package com.openforge.taskmanager.error;

import org.springframework.http.HttpStatus;

/**
 * The fixed error taxonomy of the API. Every kind maps to exactly one HTTP
 * status and one machine-readable code.
 */
public enum ErrorKind {

    /** Duplicate email or username. */
    CONFLICT(HttpStatus.BAD_REQUEST, "CONFLICT"),

    /** Missing, invalid or expired token; bad credentials. */
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED, "UNAUTHENTICATED"),

    /** Authenticated but not owner/admin, or account disabled. */
    FORBIDDEN(HttpStatus.FORBIDDEN, "FORBIDDEN"),

    NOT_FOUND(HttpStatus.NOT_FOUND, "NOT_FOUND"),

    /** Field constraint violation: length, enum membership, password strength. */
    VALIDATION(HttpStatus.UNPROCESSABLE_ENTITY, "VALIDATION_ERROR");

    private final HttpStatus status;
    private final String     code;

    ErrorKind(HttpStatus status, String code) {
        this.status = status;
        this.code   = code;
    }

    public HttpStatus status() {
        return status;
    }

    public String code() {
        return code;
    }
}
