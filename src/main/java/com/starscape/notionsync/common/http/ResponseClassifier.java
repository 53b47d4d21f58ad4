package com.starscape.notionsync.common.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.notionsync.common.exception.NotionApiException;
import com.starscape.notionsync.common.exception.NotionFileUploadException;
import com.starscape.notionsync.common.exception.NotionPageException;
import com.starscape.notionsync.common.exception.NotionTransportException;
import com.starscape.notionsync.common.exception.UploadFailureReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Turns a raw transport response into either a parsed JSON body or a
 * {@link NotionApiException} of the right kind.
 *
 * <ul>
 *   <li>2xx: body parsed as JSON; a body that is not JSON is a transport failure</li>
 *   <li>other: structured error {@code {message, code}} when present, else status text</li>
 *   <li>requests to the file upload endpoints fail as uploads, everything else as page operations</li>
 * </ul>
 */
@Service
public class ResponseClassifier {

    private static final Logger log = LoggerFactory.getLogger(ResponseClassifier.class);

    static final String UPLOAD_PATH_MARKER = "file_uploads";
    private static final String UNKNOWN_ERROR = "Unknown error";

    private final ObjectMapper objectMapper;

    public ResponseClassifier(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode classify(TransportResponse response, String requestUrl) {
        if (response.isSuccess()) {
            return parseSuccess(response, requestUrl);
        }
        throw toApiError(response, requestUrl);
    }

    /**
     * Splits the API message into sentences, one bullet line each.
     * "A. B." becomes "Error details:\n- A\n- B."
     */
    public static String formatErrorMessage(String message) {
        String source = message == null || message.isBlank() ? UNKNOWN_ERROR : message;
        String details = Arrays.stream(source.split("\\. "))
                .filter(detail -> !detail.isBlank())
                .map(detail -> "- " + detail)
                .collect(Collectors.joining("\n"));
        return "Error details:\n" + details;
    }

    static boolean isUploadRequest(String requestUrl) {
        return requestUrl != null && requestUrl.contains(UPLOAD_PATH_MARKER);
    }

    private JsonNode parseSuccess(TransportResponse response, String requestUrl) {
        String body = response.body();
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode data = objectMapper.readTree(body);
            log.debug("Notion API response success - status_code: {} - endpoint: {}",
                response.statusCode(), RestClientNotionTransport.endpointOf(requestUrl));
            return data;
        } catch (JsonProcessingException e) {
            log.error("Notion API returned a malformed success response - status_code: {} - endpoint: {}",
                response.statusCode(), RestClientNotionTransport.endpointOf(requestUrl), e);
            throw new NotionTransportException(
                "Malformed response from Notion API: " + e.getOriginalMessage(),
                response.statusCode(),
                body,
                e
            );
        }
    }

    private NotionApiException toApiError(TransportResponse response, String requestUrl) {
        boolean upload = isUploadRequest(requestUrl);
        String body = response.body();

        String detail;
        String errorCode = null;
        JsonNode errorData = readErrorBody(body);
        if (errorData != null) {
            detail = formatErrorMessage(errorData.path("message").asText(null));
            errorCode = errorData.path("code").asText("unknown_error");
            log.error("Notion API response error - status_code: {} - endpoint: {} - error_type: {} - error_code: {} - error_message: {} - request_url: {}",
                response.statusCode(), RestClientNotionTransport.endpointOf(requestUrl),
                upload ? "file_upload" : "page_operation", errorCode, detail, requestUrl);
        } else {
            detail = statusLine(response);
            log.error("Notion API response error - status_code: {} - endpoint: {} - error_type: {} - response_body: {} - request_url: {}",
                response.statusCode(), RestClientNotionTransport.endpointOf(requestUrl),
                upload ? "file_upload" : "page_operation", body, requestUrl);
        }

        if (upload) {
            return new NotionFileUploadException(
                UploadFailureReason.REJECTED,
                "Notion file upload failed: " + detail,
                response.statusCode(),
                errorCode,
                body,
                null
            );
        }
        return new NotionPageException(
            "Notion page operation failed: " + detail,
            response.statusCode(),
            errorCode,
            body
        );
    }

    private JsonNode readErrorBody(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            log.debug("Error response body is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static String statusLine(TransportResponse response) {
        String text = response.statusText();
        return text == null || text.isBlank()
            ? String.valueOf(response.statusCode())
            : response.statusCode() + " " + text;
    }
}
