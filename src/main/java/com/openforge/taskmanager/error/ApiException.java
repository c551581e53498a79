package com.openforge.taskmanager.error;

import lombok.Getter;

/**
 * Base of every error that is reported to API clients as-is. The message is
 * user-facing; nothing internal should go into it.
 */
@Getter
public abstract class ApiException extends RuntimeException {

    private final ErrorKind kind;

    protected ApiException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }
}
