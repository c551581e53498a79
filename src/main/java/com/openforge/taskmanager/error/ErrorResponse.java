package com.openforge.taskmanager.error;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String              error,
        String              message,
        Map<String, String> fields,
        Instant             timestamp,
        String              path
) {

    public ErrorResponse(String error, String message, String path) {
        this(error, message, null, Instant.now(), path);
    }

    public ErrorResponse(String error, String message, Map<String, String> fields, String path) {
        this(error, message, fields, Instant.now(), path);
    }
}
