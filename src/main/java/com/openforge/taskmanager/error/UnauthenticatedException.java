package com.openforge.taskmanager.error;

public class UnauthenticatedException extends ApiException {

    public UnauthenticatedException(String message) {
        super(ErrorKind.UNAUTHENTICATED, message);
    }
}
