package com.nosota.assetpay.dto;

import java.time.LocalDateTime;

/**
 * Error body returned by {@link com.nosota.assetpay.exception.GlobalExceptionHandler}.
 */
public record ErrorResponse(
        LocalDateTime timestamp,
        int status,
        String error,
        String message,
        String path
) {
    public static ErrorResponse of(int status, String error, String message, String path) {
        return new ErrorResponse(LocalDateTime.now(), status, error, message, path);
    }
}
