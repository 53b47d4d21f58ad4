package com.starscape.notionsync.features.fileupload.domain;

/**
 * Server-side state of an upload job.
 * PENDING is the only non-terminal state; it also stands in for any wire
 * status this client does not know about.
 */
public enum UploadState {
    PENDING,
    UPLOADED,
    FAILED;
    
    public static UploadState fromWire(String status) {
        if ("uploaded".equals(status)) {
            return UPLOADED;
        }
        if ("failed".equals(status)) {
            return FAILED;
        }
        return PENDING;
    }
}
