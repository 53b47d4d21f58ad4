package com.starscape.notionsync.common.exception;

/**
 * Failure domains surfaced to callers.
 * Upload and page failures are kept apart so callers can retry an upload
 * without abandoning the page it was meant for.
 */
public enum ErrorKind {
    TRANSPORT,
    UPLOAD_FAILURE,
    PAGE_OPERATION_FAILURE,
    INVALID_ARGUMENT
}
