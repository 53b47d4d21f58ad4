package com.starscape.notionsync.features.fileupload.domain;

/**
 * How a file will be transferred.
 * {@code numberOfParts} is set for multi-part plans only.
 */
public record UploadPlan(
    UploadMode mode,
    Integer numberOfParts,
    long partSizeBytes
) {
    
    public UploadPlan {
        if (mode == null) {
            throw new IllegalArgumentException("Mode cannot be null");
        }
        if (partSizeBytes <= 0) {
            throw new IllegalArgumentException("Part size must be positive");
        }
        if (mode == UploadMode.MULTI_PART) {
            if (numberOfParts == null || numberOfParts < 1) {
                throw new IllegalArgumentException("Multi-part plan needs a positive number of parts");
            }
        } else if (numberOfParts != null) {
            throw new IllegalArgumentException("Number of parts only applies to multi-part plans");
        }
    }
    
    public static UploadPlan singlePart(long partSizeBytes) {
        return new UploadPlan(UploadMode.SINGLE_PART, null, partSizeBytes);
    }
    
    public static UploadPlan multiPart(int numberOfParts, long partSizeBytes) {
        return new UploadPlan(UploadMode.MULTI_PART, numberOfParts, partSizeBytes);
    }
    
    public static UploadPlan externalUrl(long partSizeBytes) {
        return new UploadPlan(UploadMode.EXTERNAL_URL, null, partSizeBytes);
    }
    
    /**
     * Byte offset where the given 1-based part starts.
     */
    public long partOffset(int partNumber) {
        return (partNumber - 1) * partSizeBytes;
    }
    
    /**
     * Length of the given 1-based part; the last part may be shorter.
     */
    public int partLength(int partNumber, long fileSizeBytes) {
        long start = partOffset(partNumber);
        long end = Math.min(fileSizeBytes, start + partSizeBytes);
        return (int) Math.max(0, end - start);
    }
}
