package com.starscape.notionsync.features.fileupload.app;

import com.starscape.notionsync.common.exception.InvalidUploadRequestException;
import com.starscape.notionsync.common.exception.NotionApiException;
import com.starscape.notionsync.common.exception.NotionFileUploadException;
import com.starscape.notionsync.common.exception.UploadFailureReason;
import com.starscape.notionsync.common.http.FilePart;
import com.starscape.notionsync.features.fileupload.domain.CompletedUpload;
import com.starscape.notionsync.features.fileupload.domain.FileSource;
import com.starscape.notionsync.features.fileupload.domain.UploadHandle;
import com.starscape.notionsync.features.fileupload.domain.UploadPlan;
import com.starscape.notionsync.features.fileupload.domain.UploadRequest;
import com.starscape.notionsync.features.fileupload.infra.FileUploadApi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;

import java.io.IOException;

import static com.starscape.notionsync.common.logging.LogIds.shortId;

/**
 * Runs one upload from plan to server confirmation.
 *
 * Parts go out one at a time in ascending order. A failed part aborts the
 * whole upload; parts already sent stay on the server and the caller has to
 * start over with a fresh plan.
 */
@Service
public class FileUploadDriver {

    private static final Logger log = LoggerFactory.getLogger(FileUploadDriver.class);

    private final UploadPlanner planner;
    private final FileUploadApi fileUploadApi;
    private final UploadStatusPoller statusPoller;

    public FileUploadDriver(UploadPlanner planner, FileUploadApi fileUploadApi, UploadStatusPoller statusPoller) {
        this.planner = planner;
        this.fileUploadApi = fileUploadApi;
        this.statusPoller = statusPoller;
    }

    /**
     * Uploads a file and waits until Notion has imported it.
     *
     * @param request what to upload; its size is taken from the source when not given
     * @param source the file bytes, may be null for external URL uploads
     * @return the confirmed upload
     */
    public CompletedUpload execute(UploadRequest request, FileSource source) {
        checkContentType(request);
        UploadRequest resolved = resolveSize(request, source);
        UploadPlan plan = planner.plan(resolved);
        if (!resolved.isExternal() && source == null) {
            throw new InvalidUploadRequestException("A file source is required for " + plan.mode().getWireValue() + " uploads");
        }

        log.debug("Uploading file - file_name: {} - content_type: {} - mode: {} - file_size: {}",
            resolved.fileName(), resolved.contentType(), plan.mode().getWireValue(), resolved.fileSizeBytes());

        try {
            UploadHandle handle = fileUploadApi.create(resolved, plan);

            switch (plan.mode()) {
                case SINGLE_PART -> sendSinglePart(handle, resolved, source);
                case MULTI_PART -> {
                    sendParts(handle, resolved, source);
                    fileUploadApi.complete(handle.uploadId());
                }
                case EXTERNAL_URL -> log.debug("Notion fetches the file itself - upload_id: {}...",
                    shortId(handle.uploadId()));
            }

            statusPoller.waitForCompletion(handle.uploadId());

            log.info("Successfully uploaded file {} - upload_id: {}... - mode: {}",
                resolved.fileName(), shortId(handle.uploadId()), plan.mode().getWireValue());
            return new CompletedUpload(handle.uploadId(), resolved.fileName(), resolved.contentType(), plan.mode());
        } catch (NotionApiException e) {
            log.error("Failed to upload file {} - error_type: {} - error: {}", resolved.fileName(), e.getKind(), e.getMessage());
            throw e;
        }
    }

    private void sendSinglePart(UploadHandle handle, UploadRequest request, FileSource source) {
        int length = (int) request.fileSizeBytes().longValue();
        byte[] content = readRange(source, 0, length, null);
        try {
            fileUploadApi.send(handle, new FilePart(request.fileName(), request.contentType(), content), null);
            log.debug("File sent - upload_id: {}... - size: {}", shortId(handle.uploadId()), length);
        } catch (NotionApiException e) {
            throw NotionFileUploadException.partTransfer("Failed to send file " + request.fileName(), e);
        }
    }

    private void sendParts(UploadHandle handle, UploadRequest request, FileSource source) {
        UploadPlan plan = handle.plan();
        long fileSize = request.fileSizeBytes();

        for (int partNumber = 1; partNumber <= plan.numberOfParts(); partNumber++) {
            long offset = plan.partOffset(partNumber);
            int length = plan.partLength(partNumber, fileSize);
            byte[] content = readRange(source, offset, length, partNumber);

            log.debug("Uploading file part - part_number: {}/{} - content_type: {} - part_size: {}",
                partNumber, plan.numberOfParts(), request.contentType(), length);
            try {
                fileUploadApi.send(handle, new FilePart(request.fileName(), request.contentType(), content), partNumber);
            } catch (NotionApiException e) {
                log.error("Failed to upload file part - part_number: {} - upload_id: {}... - error_type: {}",
                    partNumber, shortId(handle.uploadId()), e.getKind());
                throw NotionFileUploadException.partTransfer(
                    String.format("Failed to upload part %d of %d", partNumber, plan.numberOfParts()), e);
            }
        }
    }

    private static void checkContentType(UploadRequest request) {
        if (request.contentType() == null || request.contentType().isBlank()) {
            return;
        }
        try {
            MediaType.parseMediaType(request.contentType());
        } catch (InvalidMediaTypeException e) {
            throw new InvalidUploadRequestException(
                "Invalid content type for " + request.fileName() + ": " + e.getMessage(), e);
        }
    }
    
    private UploadRequest resolveSize(UploadRequest request, FileSource source) {
        if (request.isExternal() || source == null) {
            return request;
        }
        long actualSize;
        try {
            actualSize = source.size();
        } catch (IOException e) {
            throw new NotionFileUploadException(
                UploadFailureReason.PART_TRANSFER, "Cannot determine size of " + request.fileName(), e);
        }
        if (request.fileSizeBytes() == null) {
            return UploadRequest.ofFile(request.fileName(), request.contentType(), actualSize);
        }
        if (request.fileSizeBytes() != actualSize) {
            throw new InvalidUploadRequestException(String.format(
                "Declared size %d of %s does not match the source size %d",
                request.fileSizeBytes(), request.fileName(), actualSize));
        }
        return request;
    }

    private static byte[] readRange(FileSource source, long offset, int length, Integer partNumber) {
        try {
            return source.read(offset, length);
        } catch (IOException e) {
            String what = partNumber == null ? "file" : "part " + partNumber;
            throw new NotionFileUploadException(
                UploadFailureReason.PART_TRANSFER, "Failed to read " + what + " from source: " + e.getMessage(), e);
        }
    }
}
