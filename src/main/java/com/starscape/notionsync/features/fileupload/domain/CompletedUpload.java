package com.starscape.notionsync.features.fileupload.domain;

/**
 * A server-confirmed upload, ready to be referenced from a file block.
 */
public record CompletedUpload(
    String uploadId,
    String fileName,
    String contentType,
    UploadMode mode
) {
    
    public FileBlockType blockType() {
        return FileBlockType.forMimeType(contentType);
    }
}
