package com.starscape.notionsync.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.starscape.notionsync.common.config.NotionProperties;
import com.starscape.notionsync.common.exception.InvalidUploadRequestException;
import com.starscape.notionsync.common.exception.NotionFileUploadException;
import com.starscape.notionsync.common.exception.NotionPageException;
import com.starscape.notionsync.common.exception.UploadFailureReason;
import com.starscape.notionsync.common.http.NotionTransport;
import com.starscape.notionsync.features.fileupload.app.FileUploadDriver;
import com.starscape.notionsync.features.fileupload.domain.CompletedUpload;
import com.starscape.notionsync.features.fileupload.domain.FileSource;
import com.starscape.notionsync.features.fileupload.domain.UploadRequest;
import com.starscape.notionsync.features.fileupload.infra.PathFileSource;
import com.starscape.notionsync.features.pages.app.PageService;
import com.starscape.notionsync.features.pages.domain.PageProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static com.starscape.notionsync.common.logging.LogIds.shortId;

/**
 * Entry point for callers: page operations against one target database and
 * file ingestion into pages. Closing the client releases the transport.
 */
@Service
public class NotionClient implements AutoCloseable {
    
    private static final Logger log = LoggerFactory.getLogger(NotionClient.class);
    
    static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";
    
    private final NotionTransport transport;
    private final FileUploadDriver uploadDriver;
    private final PageService pageService;
    
    private volatile String parentDatabaseId;
    
    @Autowired
    public NotionClient(
            NotionTransport transport,
            FileUploadDriver uploadDriver,
            PageService pageService,
            NotionProperties properties) {
        this(transport, uploadDriver, pageService, properties.getDatabaseId());
    }
    
    public NotionClient(
            NotionTransport transport,
            FileUploadDriver uploadDriver,
            PageService pageService,
            String parentDatabaseId) {
        this.transport = transport;
        this.uploadDriver = uploadDriver;
        this.pageService = pageService;
        this.parentDatabaseId = parentDatabaseId == null || parentDatabaseId.isBlank() ? null : parentDatabaseId;
    }
    
    public String getParentDatabaseId() {
        return parentDatabaseId;
    }
    
    /**
     * Changes the database new pages are created in.
     */
    public void setParentDatabaseId(String databaseId) {
        if (databaseId == null || databaseId.isBlank()) {
            throw new NotionPageException("Parent database id cannot be blank");
        }
        this.parentDatabaseId = databaseId;
        log.info("Parent database changed - database_id: {}...", shortId(databaseId));
    }
    
    public String createPage(String title, String contentText, PageProperties properties) {
        return createPage(title, contentText, properties, null);
    }
    
    /**
     * @param databaseId target database, or null for the configured one
     */
    public String createPage(String title, String contentText, PageProperties properties, String databaseId) {
        return pageService.createPage(title, properties, resolveDatabaseId(databaseId), contentText);
    }
    
    public void appendText(String pageId, String text) {
        pageService.appendText(pageId, text);
    }
    
    public JsonNode appendFileBlock(String pageId, CompletedUpload upload) {
        return pageService.appendFileBlock(pageId, upload);
    }
    
    public JsonNode getPage(String pageId) {
        return pageService.getPage(pageId);
    }
    
    public PageProperties getPageProperties(String pageId) {
        return pageService.getPageProperties(pageId);
    }
    
    public JsonNode updatePage(String pageId, Map<String, ?> properties) {
        return pageService.updatePage(pageId, properties);
    }
    
    public JsonNode updatePage(String pageId, PageProperties properties) {
        return pageService.updatePage(pageId, properties);
    }
    
    public CompletedUpload uploadFile(UploadRequest request, FileSource source) {
        return uploadDriver.execute(request, source);
    }
    
    /**
     * Uploads a local file and embeds it in the page.
     *
     * @param contentType MIME type, detected from the file when null
     */
    public CompletedUpload uploadFileToPage(String pageId, Path file, String contentType) {
        if (file.getFileName() == null) {
            throw new InvalidUploadRequestException("Not a file path: " + file);
        }
        String fileName = file.getFileName().toString();
        String resolvedType = contentType != null ? contentType : detectContentType(file);
        
        CompletedUpload upload = uploadDriver.execute(
            new UploadRequest(fileName, resolvedType, null, null), new PathFileSource(file));
        pageService.appendFileBlock(pageId, upload);
        return upload;
    }
    
    /**
     * Has Notion fetch a file from an https URL and embeds it in the page.
     */
    public CompletedUpload attachExternalFile(String pageId, String fileName, String contentType, String externalUrl) {
        CompletedUpload upload = uploadDriver.execute(
            UploadRequest.ofExternalUrl(fileName, contentType, externalUrl), null);
        pageService.appendFileBlock(pageId, upload);
        return upload;
    }
    
    @Override
    public void close() {
        transport.close();
    }
    
    private String resolveDatabaseId(String databaseId) {
        if (databaseId != null && !databaseId.isBlank()) {
            return databaseId;
        }
        String configured = parentDatabaseId;
        if (configured == null) {
            throw new NotionPageException("No parent database configured; set notion.database-id or pass one");
        }
        return configured;
    }
    
    private static String detectContentType(Path file) {
        try {
            String detected = Files.probeContentType(file);
            return detected != null ? detected : DEFAULT_CONTENT_TYPE;
        } catch (IOException e) {
            throw new NotionFileUploadException(
                UploadFailureReason.PART_TRANSFER, "Cannot read " + file + ": " + e.getMessage(), e);
        }
    }
}
