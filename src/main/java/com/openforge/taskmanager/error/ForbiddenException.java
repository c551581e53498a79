package com.openforge.taskmanager.error;

public class ForbiddenException extends ApiException {

    public ForbiddenException(String message) {
        super(ErrorKind.FORBIDDEN, message);
    }
}
