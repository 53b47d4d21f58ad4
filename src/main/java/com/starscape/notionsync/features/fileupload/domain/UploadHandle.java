package com.starscape.notionsync.features.fileupload.domain;

public record UploadHandle(
    String uploadId,
    String uploadUrl,
    UploadPlan plan
) {
    
    public UploadHandle {
        if (uploadId == null || uploadId.isBlank()) {
            throw new IllegalArgumentException("Upload id cannot be blank");
        }
    }
}
