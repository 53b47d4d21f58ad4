package com.starscape.notionsync.common.exception;

/**
 * Failure anywhere in the file upload subsystem: creation, part transfer,
 * completion, polling timeout or an explicit failed import.
 */
public class NotionFileUploadException extends NotionApiException {
    
    private final UploadFailureReason reason;
    
    public NotionFileUploadException(UploadFailureReason reason, String message) {
        this(reason, message, null, null, null, null);
    }
    
    public NotionFileUploadException(UploadFailureReason reason, String message, Throwable cause) {
        this(reason, message, null, null, null, cause);
    }
    
    public NotionFileUploadException(
            UploadFailureReason reason,
            String message,
            Integer statusCode,
            String errorCode,
            String rawBody,
            Throwable cause) {
        super(ErrorKind.UPLOAD_FAILURE, message, statusCode, errorCode, rawBody, cause);
        this.reason = reason;
    }
    
    /**
     * Re-labels any client failure raised while transferring file bytes.
     * Status code, error code and raw body of the original failure are kept.
     */
    public static NotionFileUploadException partTransfer(String message, NotionApiException cause) {
        return new NotionFileUploadException(
            UploadFailureReason.PART_TRANSFER,
            message + ": " + cause.getMessage(),
            cause.getStatusCode(),
            cause.getErrorCode(),
            cause.getRawBody(),
            cause
        );
    }
    
    public UploadFailureReason getReason() {
        return reason;
    }
}
