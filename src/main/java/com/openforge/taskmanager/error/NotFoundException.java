package com.openforge.taskmanager.error;

public class NotFoundException extends ApiException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
