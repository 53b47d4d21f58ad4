package com.starscape.notionsync.features.fileupload.domain;

/**
 * One observation of an upload job. Each poll produces a fresh value.
 */
public record UploadStatus(
    String uploadId,
    UploadState state,
    ImportError error
) {
    
    public UploadStatus {
        if (state == null) {
            throw new IllegalArgumentException("State cannot be null");
        }
    }
}
