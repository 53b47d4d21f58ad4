package com.starscape.notionsync.features.fileupload.app;

import com.starscape.notionsync.common.config.NotionProperties;
import com.starscape.notionsync.common.exception.NotionApiException;
import com.starscape.notionsync.common.exception.NotionFileUploadException;
import com.starscape.notionsync.common.exception.UploadFailureReason;
import com.starscape.notionsync.features.fileupload.domain.UploadState;
import com.starscape.notionsync.features.fileupload.domain.UploadStatus;
import com.starscape.notionsync.features.fileupload.infra.FileUploadApi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;

import static com.starscape.notionsync.common.logging.LogIds.shortId;

/**
 * Polls an upload job until the server reports a terminal state.
 *
 * Each attempt is one status query. {@code uploaded} returns at once,
 * {@code failed} fails at once without another query. A pending status or an
 * error while querying uses up the attempt and waits before the next one,
 * the delay doubling every time. When the attempts run out the upload fails
 * with a timeout. No wait follows the last attempt.
 */
@Service
public class UploadStatusPoller {
    
    private static final Logger log = LoggerFactory.getLogger(UploadStatusPoller.class);
    
    public static final int DEFAULT_MAX_ATTEMPTS = 6;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(5);
    
    private final FileUploadApi fileUploadApi;
    private final Sleeper sleeper;
    private final int defaultMaxAttempts;
    private final Duration defaultInitialDelay;
    
    public UploadStatusPoller(FileUploadApi fileUploadApi, Sleeper sleeper) {
        this(fileUploadApi, sleeper, DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_DELAY);
    }
    
    @Autowired
    public UploadStatusPoller(FileUploadApi fileUploadApi, Sleeper sleeper, NotionProperties properties) {
        this(fileUploadApi, sleeper,
            properties.getUpload().getPollMaxAttempts(), properties.getUpload().getPollInitialDelay());
    }
    
    public UploadStatusPoller(
            FileUploadApi fileUploadApi,
            Sleeper sleeper,
            int defaultMaxAttempts,
            Duration defaultInitialDelay) {
        this.fileUploadApi = fileUploadApi;
        this.sleeper = sleeper;
        this.defaultMaxAttempts = defaultMaxAttempts;
        this.defaultInitialDelay = defaultInitialDelay;
    }
    
    public UploadStatus waitForCompletion(String uploadId) {
        return waitForCompletion(uploadId, defaultMaxAttempts, defaultInitialDelay);
    }
    
    public UploadStatus waitForCompletion(String uploadId, int maxAttempts, Duration initialDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        log.debug("Waiting for file upload - upload_id: {}... - max_attempts: {} - initial_delay: {}",
            shortId(uploadId), maxAttempts, initialDelay);
        
        Duration delay = initialDelay;
        NotionApiException lastError = null;
        
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            UploadStatus status = null;
            try {
                status = fileUploadApi.status(uploadId);
                lastError = null;
            } catch (NotionApiException e) {
                lastError = e;
                log.warn("Error checking file upload status - upload_id: {}... - attempt: {}/{} - error_type: {} - error: {}",
                    shortId(uploadId), attempt, maxAttempts, e.getKind(), e.getMessage());
            }
            
            if (status != null) {
                if (status.state() == UploadState.UPLOADED) {
                    log.info("File upload completed - upload_id: {}... - attempts: {}", shortId(uploadId), attempt);
                    return status;
                }
                if (status.state() == UploadState.FAILED) {
                    log.error("File upload failed - upload_id: {}... - error_code: {} - error: {}",
                        shortId(uploadId), status.error().code(), status.error().message());
                    throw new NotionFileUploadException(
                        UploadFailureReason.IMPORT_FAILED,
                        "File upload failed: " + status.error().message(),
                        null,
                        status.error().code(),
                        null,
                        null
                    );
                }
                log.debug("File upload still pending - upload_id: {}... - attempt: {}/{} - delay: {}",
                    shortId(uploadId), attempt, maxAttempts, delay);
            }
            
            if (attempt < maxAttempts) {
                pause(uploadId, delay);
                delay = delay.multipliedBy(2);
            }
        }
        
        throw timeout(uploadId, maxAttempts, lastError);
    }
    
    private void pause(String uploadId, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotionFileUploadException(
                UploadFailureReason.INTERRUPTED,
                "Interrupted while waiting for file upload " + uploadId,
                e
            );
        }
    }
    
    private NotionFileUploadException timeout(String uploadId, int maxAttempts, NotionApiException lastError) {
        String message = String.format("Timed out waiting for file upload %s after %d attempts", uploadId, maxAttempts);
        log.error("File upload timed out - upload_id: {}... - attempts: {} - last_error: {}",
            shortId(uploadId), maxAttempts, lastError != null ? lastError.getMessage() : null);
        if (lastError == null) {
            return new NotionFileUploadException(UploadFailureReason.TIMEOUT, message);
        }
        return new NotionFileUploadException(
            UploadFailureReason.TIMEOUT,
            message + ": " + lastError.getMessage(),
            lastError.getStatusCode(),
            lastError.getErrorCode(),
            lastError.getRawBody(),
            lastError
        );
    }
}
