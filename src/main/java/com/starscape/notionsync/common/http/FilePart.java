package com.starscape.notionsync.common.http;

import com.starscape.notionsync.common.exception.InvalidUploadRequestException;

/**
 * Binary field of a multipart request.
 */
public record FilePart(
    String fileName,
    String contentType,
    byte[] content
) {
    
    public FilePart {
        if (fileName == null || fileName.isBlank()) {
            throw new InvalidUploadRequestException("File name cannot be blank");
        }
        if (content == null) {
            throw new InvalidUploadRequestException("Content cannot be null");
        }
    }
}
