package com.starscape.notionsync.common.exception;

/**
 * Connection, timeout or malformed-response failure.
 */
public class NotionTransportException extends NotionApiException {
    
    public NotionTransportException(String message, Throwable cause) {
        super(ErrorKind.TRANSPORT, message, cause);
    }
    
    public NotionTransportException(String message, Integer statusCode, String rawBody, Throwable cause) {
        super(ErrorKind.TRANSPORT, message, statusCode, null, rawBody, cause);
    }
}
