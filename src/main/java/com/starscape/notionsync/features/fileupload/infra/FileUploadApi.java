package com.starscape.notionsync.features.fileupload.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.starscape.notionsync.common.exception.NotionFileUploadException;
import com.starscape.notionsync.common.exception.UploadFailureReason;
import com.starscape.notionsync.common.http.FilePart;
import com.starscape.notionsync.common.http.NotionApiClient;
import com.starscape.notionsync.features.fileupload.domain.ImportError;
import com.starscape.notionsync.features.fileupload.domain.UploadHandle;
import com.starscape.notionsync.features.fileupload.domain.UploadMode;
import com.starscape.notionsync.features.fileupload.domain.UploadPlan;
import com.starscape.notionsync.features.fileupload.domain.UploadRequest;
import com.starscape.notionsync.features.fileupload.domain.UploadState;
import com.starscape.notionsync.features.fileupload.domain.UploadStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

import static com.starscape.notionsync.common.logging.LogIds.shortId;

/**
 * The four calls of the file upload endpoints: create, send, complete, status.
 */
@Service
public class FileUploadApi {
    
    private static final Logger log = LoggerFactory.getLogger(FileUploadApi.class);
    
    static final String FILE_UPLOADS_PATH = "/file_uploads";
    
    private final NotionApiClient apiClient;
    private final ObjectMapper objectMapper;
    
    public FileUploadApi(NotionApiClient apiClient, ObjectMapper objectMapper) {
        this.apiClient = apiClient;
        this.objectMapper = objectMapper;
    }
    
    /**
     * Submits the plan and returns the server-issued handle.
     */
    public UploadHandle create(UploadRequest request, UploadPlan plan) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("mode", plan.mode().getWireValue());
        payload.put("filename", request.fileName());
        if (plan.mode() == UploadMode.EXTERNAL_URL) {
            payload.put("external_url", request.externalUrl());
        } else {
            if (request.contentType() != null) {
                payload.put("content_type", request.contentType());
            }
            if (plan.mode() == UploadMode.MULTI_PART) {
                payload.put("number_of_parts", plan.numberOfParts());
            }
        }
        
        JsonNode response = apiClient.post(FILE_UPLOADS_PATH, payload);
        String uploadId = response.path("id").asText(null);
        if (uploadId == null || uploadId.isBlank()) {
            throw new NotionFileUploadException(
                UploadFailureReason.REJECTED,
                "Notion did not return an upload id",
                null, null, response.toString(), null
            );
        }
        
        String uploadUrl = response.path("upload_url").asText(null);
        log.info("File upload object created - upload_id: {}... - mode: {} - number_of_parts: {}",
            shortId(uploadId), plan.mode().getWireValue(), plan.numberOfParts());
        return new UploadHandle(uploadId, uploadUrl, plan);
    }
    
    /**
     * Sends file bytes to the upload URL. {@code partNumber} is null for single-part uploads.
     */
    public void send(UploadHandle handle, FilePart filePart, Integer partNumber) {
        Map<String, String> fields = partNumber == null
            ? Map.of()
            : Map.of("part_number", String.valueOf(partNumber));
        apiClient.postMultipart(uploadUrlOf(handle), filePart, fields);
    }
    
    public void complete(String uploadId) {
        log.debug("Completing multi-part upload - upload_id: {}...", shortId(uploadId));
        apiClient.post(FILE_UPLOADS_PATH + "/" + uploadId + "/complete", null);
        log.info("Multi-part upload completed - upload_id: {}...", shortId(uploadId));
    }
    
    public UploadStatus status(String uploadId) {
        JsonNode response = apiClient.get(FILE_UPLOADS_PATH + "/" + uploadId);
        String wireStatus = response.path("status").asText(null);
        UploadState state = UploadState.fromWire(wireStatus);
        
        ImportError error = null;
        if (state == UploadState.FAILED) {
            JsonNode errorNode = response.path("file_import_result").path("error");
            error = new ImportError(
                errorNode.path("code").asText(null),
                errorNode.path("message").asText(null)
            );
        }
        
        log.debug("File upload status - upload_id: {}... - status: {}", shortId(uploadId), wireStatus);
        return new UploadStatus(uploadId, state, error);
    }
    
    private String uploadUrlOf(UploadHandle handle) {
        if (handle.uploadUrl() != null && !handle.uploadUrl().isBlank()) {
            return handle.uploadUrl();
        }
        return FILE_UPLOADS_PATH + "/" + handle.uploadId() + "/send";
    }
}
