package com.openforge.taskmanager.error;

import lombok.Getter;

import java.util.Map;

/**
 * Raised by checks that Bean Validation annotations cannot express
 * (password strength, username shape). Carries per-field messages.
 */
@Getter
public class ValidationException extends ApiException {

    private final Map<String, String> fields;

    public ValidationException(String field, String message) {
        super(ErrorKind.VALIDATION, message);
        this.fields = Map.of(field, message);
    }
}
