package com.starscape.notionsync.features.fileupload.domain;

import com.starscape.notionsync.common.exception.InvalidUploadRequestException;

/**
 * What the caller wants uploaded.
 * Either {@code fileSizeBytes} (bytes come from a file source) or
 * {@code externalUrl} (the server fetches the file itself) drives planning.
 */
public record UploadRequest(
    String fileName,
    String contentType,
    Long fileSizeBytes,
    String externalUrl
) {
    
    public UploadRequest {
        if (fileName == null || fileName.isBlank()) {
            throw new InvalidUploadRequestException("File name cannot be blank");
        }
        if (fileSizeBytes != null && fileSizeBytes < 0) {
            throw new InvalidUploadRequestException("File size cannot be negative: " + fileSizeBytes);
        }
    }
    
    public static UploadRequest ofFile(String fileName, String contentType, long fileSizeBytes) {
        return new UploadRequest(fileName, contentType, fileSizeBytes, null);
    }
    
    public static UploadRequest ofExternalUrl(String fileName, String contentType, String externalUrl) {
        return new UploadRequest(fileName, contentType, null, externalUrl);
    }
    
    public boolean isExternal() {
        return externalUrl != null && !externalUrl.isBlank();
    }
}
