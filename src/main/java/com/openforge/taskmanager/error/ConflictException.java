package com.openforge.taskmanager.error;

public class ConflictException extends ApiException {

    public ConflictException(String message) {
        super(ErrorKind.CONFLICT, message);
    }
}
