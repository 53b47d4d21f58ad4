package com.starscape.notionsync.common.exception;

/**
 * Page or block mutation failure.
 */
public class NotionPageException extends NotionApiException {
    
    public NotionPageException(String message) {
        super(ErrorKind.PAGE_OPERATION_FAILURE, message);
    }
    
    public NotionPageException(String message, Integer statusCode, String errorCode, String rawBody) {
        super(ErrorKind.PAGE_OPERATION_FAILURE, message, statusCode, errorCode, rawBody, null);
    }
}
