package com.starscape.notionsync.common.exception;

public enum UploadFailureReason {
    /** The upload endpoint answered with an error status. */
    REJECTED,
    /** A part (or the single-part body) could not be transferred. */
    PART_TRANSFER,
    /** The server reported the import as failed. */
    IMPORT_FAILED,
    /** Polling ran out of attempts before a terminal status. */
    TIMEOUT,
    /** The waiting thread was interrupted. */
    INTERRUPTED
}
