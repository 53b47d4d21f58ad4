package com.starscape.notionsync.common.exception;

/**
 * Base type for every failure raised by the Notion client.
 * Carries the failure kind plus the HTTP status, API error code and raw
 * response body when the failure came from a response.
 */
public class NotionApiException extends RuntimeException {
    
    private final ErrorKind kind;
    private final Integer statusCode;
    private final String errorCode;
    private final String rawBody;
    
    public NotionApiException(ErrorKind kind, String message) {
        this(kind, message, null, null, null, null);
    }
    
    public NotionApiException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, null, null, null, cause);
    }
    
    public NotionApiException(
            ErrorKind kind,
            String message,
            Integer statusCode,
            String errorCode,
            String rawBody,
            Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
        this.errorCode = errorCode;
        this.rawBody = rawBody;
    }
    
    public ErrorKind getKind() {
        return kind;
    }
    
    public Integer getStatusCode() {
        return statusCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
    
    public String getRawBody() {
        return rawBody;
    }
}
