package com.nosota.bounty.api.response;

import java.time.LocalDateTime;

/**
 * Structured error body. {@code kind} is a {@link com.nosota.bounty.api.model.LifecycleErrorKind} name,
 * or VALIDATION_FAILED / INTERNAL_ERROR for failures outside the lifecycle taxonomy.
 */
public record ErrorResponse(
        LocalDateTime timestamp,
        int status,
        String kind,
        String error,
        String message,
        String path
) {
    public static ErrorResponse of(int status, String kind, String error, String message, String path) {
        return new ErrorResponse(LocalDateTime.now(), status, kind, error, message, path);
    }
}
