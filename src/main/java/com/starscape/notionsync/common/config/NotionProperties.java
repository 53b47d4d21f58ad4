package com.starscape.notionsync.common.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the Notion API client.
 * Binds to notion.* properties from application.yml
 */
@Validated
@ConfigurationProperties(prefix = "notion")
public class NotionProperties {
    
    @NotBlank(message = "notion.api-key is required")
    private String apiKey;
    
    @NotBlank
    private String version = "2022-06-28";
    
    @NotBlank
    private String baseUrl = "https://api.notion.com/v1";
    
    private String databaseId;
    
    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(10);
    
    @NotNull
    private Duration readTimeout = Duration.ofSeconds(60);
    
    @Valid
    private final Upload upload = new Upload();
    
    public String getApiKey() {
        return apiKey;
    }
    
    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }
    
    public String getVersion() {
        return version;
    }
    
    public void setVersion(String version) {
        this.version = version;
    }
    
    public String getBaseUrl() {
        return baseUrl;
    }
    
    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }
    
    public String getDatabaseId() {
        return databaseId;
    }
    
    public void setDatabaseId(String databaseId) {
        this.databaseId = databaseId;
    }
    
    public Duration getConnectTimeout() {
        return connectTimeout;
    }
    
    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }
    
    public Duration getReadTimeout() {
        return readTimeout;
    }
    
    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }
    
    public Upload getUpload() {
        return upload;
    }
    
    /**
     * Headers sent with every request.
     * Content-Type is left out; it depends on the body.
     */
    public Map<String, String> defaultHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", "Bearer " + apiKey);
        headers.put("Notion-Version", version);
        return headers;
    }
    
    public static class Upload {
        
        @Positive
        @Max(Integer.MAX_VALUE)
        private long thresholdBytes = 20L * 1024 * 1024;
        
        @Positive
        @Max(Integer.MAX_VALUE)
        private long partSizeBytes = 10L * 1024 * 1024;
        
        @Min(1)
        private int pollMaxAttempts = 6;
        
        @NotNull
        private Duration pollInitialDelay = Duration.ofSeconds(5);
        
        public long getThresholdBytes() {
            return thresholdBytes;
        }
        
        public void setThresholdBytes(long thresholdBytes) {
            this.thresholdBytes = thresholdBytes;
        }
        
        public long getPartSizeBytes() {
            return partSizeBytes;
        }
        
        public void setPartSizeBytes(long partSizeBytes) {
            this.partSizeBytes = partSizeBytes;
        }
        
        public int getPollMaxAttempts() {
            return pollMaxAttempts;
        }
        
        public void setPollMaxAttempts(int pollMaxAttempts) {
            this.pollMaxAttempts = pollMaxAttempts;
        }
        
        public Duration getPollInitialDelay() {
            return pollInitialDelay;
        }
        
        public void setPollInitialDelay(Duration pollInitialDelay) {
            this.pollInitialDelay = pollInitialDelay;
        }
    }
}
