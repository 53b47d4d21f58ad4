package com.starscape.notionsync.common.exception;

/**
 * Malformed upload request detected before any network call.
 */
public class InvalidUploadRequestException extends NotionApiException {
    
    public InvalidUploadRequestException(String message) {
        super(ErrorKind.INVALID_ARGUMENT, message);
    }
    
    public InvalidUploadRequestException(String message, Throwable cause) {
        super(ErrorKind.INVALID_ARGUMENT, message, cause);
    }
}
