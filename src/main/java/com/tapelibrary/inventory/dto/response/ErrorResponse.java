package com.tapelibrary.inventory.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
    int status,
    String error,
    String message,
    String operation,
    Instant timestamp,
    String path,
    List<FieldError> fieldErrors
) {
    public ErrorResponse(int status, String error, String message,
                         Instant timestamp, String path) {
        this(status, error, message, null, timestamp, path, List.of());
    }

    public ErrorResponse(int status, String error, String message, String operation,
                         Instant timestamp, String path) {
        this(status, error, message, operation, timestamp, path, List.of());
    }

    public record FieldError(String field, String message) {}
}
