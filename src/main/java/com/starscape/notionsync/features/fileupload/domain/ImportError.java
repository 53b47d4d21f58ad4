package com.starscape.notionsync.features.fileupload.domain;

/**
 * Error reported by the server for a failed import.
 */
public record ImportError(
    String code,
    String message
) {
    
    public ImportError {
        if (message == null || message.isBlank()) {
            message = "Unknown error";
        }
    }
}
