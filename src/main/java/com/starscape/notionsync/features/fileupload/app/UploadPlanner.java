package com.starscape.notionsync.features.fileupload.app;

import com.starscape.notionsync.common.config.NotionProperties;
import com.starscape.notionsync.common.exception.InvalidUploadRequestException;
import com.starscape.notionsync.features.fileupload.domain.UploadPlan;
import com.starscape.notionsync.features.fileupload.domain.UploadRequest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Chooses the upload mode for a file. Pure: the same inputs always give the same plan.
 *
 * <ul>
 *   <li>external URL set: {@code external_url}, the URL must be https</li>
 *   <li>size unknown or at most the threshold: {@code single_part}</li>
 *   <li>larger: {@code multi_part} with ceil(size / partSize) parts</li>
 * </ul>
 */
@Service
public class UploadPlanner {
    
    public static final long DEFAULT_THRESHOLD_BYTES = 20L * 1024 * 1024; // 20MB
    public static final long DEFAULT_PART_SIZE_BYTES = 10L * 1024 * 1024; // 10MB
    
    private static final String SECURE_SCHEME = "https://";
    
    private final long thresholdBytes;
    private final long partSizeBytes;
    
    public UploadPlanner() {
        this(DEFAULT_THRESHOLD_BYTES, DEFAULT_PART_SIZE_BYTES);
    }
    
    @Autowired
    public UploadPlanner(NotionProperties properties) {
        this(properties.getUpload().getThresholdBytes(), properties.getUpload().getPartSizeBytes());
    }
    
    public UploadPlanner(long thresholdBytes, long partSizeBytes) {
        if (thresholdBytes <= 0 || partSizeBytes <= 0) {
            throw new IllegalArgumentException("Threshold and part size must be positive");
        }
        // both are sent or read as one in-memory array
        if (thresholdBytes > Integer.MAX_VALUE || partSizeBytes > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Threshold and part size must not exceed " + Integer.MAX_VALUE + " bytes");
        }
        this.thresholdBytes = thresholdBytes;
        this.partSizeBytes = partSizeBytes;
    }
    
    public UploadPlan plan(UploadRequest request) {
        return plan(request.fileSizeBytes(), request.externalUrl());
    }
    
    public UploadPlan plan(Long fileSizeBytes, String externalUrl) {
        if (externalUrl != null && !externalUrl.isBlank()) {
            if (!isSecure(externalUrl)) {
                throw new InvalidUploadRequestException("external_url must start with https://: " + externalUrl);
            }
            return UploadPlan.externalUrl(partSizeBytes);
        }
        
        if (!shouldUseMultipart(fileSizeBytes)) {
            return UploadPlan.singlePart(partSizeBytes);
        }
        return UploadPlan.multiPart(partCount(fileSizeBytes), partSizeBytes);
    }
    
    public boolean shouldUseMultipart(Long fileSizeBytes) {
        return fileSizeBytes != null && fileSizeBytes > thresholdBytes;
    }
    
    public int partCount(long fileSizeBytes) {
        long parts = (fileSizeBytes + partSizeBytes - 1) / partSizeBytes;
        if (parts > Integer.MAX_VALUE) {
            throw new InvalidUploadRequestException("File too large for a multi-part upload: " + fileSizeBytes + " bytes");
        }
        return (int) parts;
    }
    
    public long getThresholdBytes() {
        return thresholdBytes;
    }
    
    public long getPartSizeBytes() {
        return partSizeBytes;
    }
    
    private static boolean isSecure(String url) {
        return url.regionMatches(true, 0, SECURE_SCHEME, 0, SECURE_SCHEME.length());
    }
}
