package com.starscape.notionsync.common.http;

import com.starscape.notionsync.common.config.NotionProperties;
import com.starscape.notionsync.common.exception.InvalidUploadRequestException;
import com.starscape.notionsync.common.exception.NotionTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link NotionTransport} backed by Spring's {@link RestClient}.
 *
 * The client is opened on the first request. When no builder is supplied the
 * transport owns a {@code java.net.http.HttpClient} and its executor, both
 * released by {@link #close()}.
 */
public class RestClientNotionTransport implements NotionTransport {

    private static final Logger log = LoggerFactory.getLogger(RestClientNotionTransport.class);

    private final NotionProperties properties;
    private final RestClient.Builder suppliedBuilder;

    private RestClient restClient;
    private ExecutorService executor;
    private boolean closed;

    public RestClientNotionTransport(NotionProperties properties) {
        this(properties, null);
    }

    /**
     * Uses the given builder as-is for connection handling; the caller keeps
     * ownership of whatever request factory it carries.
     */
    public RestClientNotionTransport(NotionProperties properties, RestClient.Builder builder) {
        this.properties = properties;
        this.suppliedBuilder = builder;
    }

    @Override
    public TransportResponse exchange(TransportRequest request) {
        RestClient client = client();
        try {
            RestClient.RequestBodySpec spec = client.method(request.method())
                    .uri(URI.create(request.url()));

            if (request.isMultipart()) {
                spec.contentType(MediaType.MULTIPART_FORM_DATA)
                        .body(toMultipartBody(request));
            } else if (request.jsonBody() != null) {
                spec.contentType(MediaType.APPLICATION_JSON)
                        .body(request.jsonBody());
            }

            return spec.exchange((clientRequest, clientResponse) -> new TransportResponse(
                clientResponse.getStatusCode().value(),
                clientResponse.getStatusText(),
                readBody(clientResponse.getBody())
            ));
        } catch (RestClientException e) {
            log.error("Notion API request failed - method: {} - endpoint: {} - error_type: {} - error: {}",
                request.method(), endpointOf(request.url()), e.getClass().getSimpleName(), e.getMessage(), e);
            throw new NotionTransportException("Notion API request failed: " + e.getMessage(), e);
        } catch (InvalidMediaTypeException e) {
            throw new InvalidUploadRequestException("Invalid content type for multipart request: " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        restClient = null;
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            executor = null;
        }
        log.debug("Notion transport closed");
    }

    private synchronized RestClient client() {
        if (closed) {
            throw new NotionTransportException("Notion transport is closed", null);
        }
        if (restClient == null) {
            RestClient.Builder builder = suppliedBuilder != null ? suppliedBuilder : ownedBuilder();
            restClient = builder
                    .defaultHeaders(headers -> properties.defaultHeaders().forEach(headers::set))
                    .build();
            log.debug("Notion transport opened - version: {} - owns_connections: {}",
                properties.getVersion(), suppliedBuilder == null);
        }
        return restClient;
    }

    private RestClient.Builder ownedBuilder() {
        AtomicInteger threadCount = new AtomicInteger();
        executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "notion-http-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .executor(executor)
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(properties.getReadTimeout());
        return RestClient.builder().requestFactory(requestFactory);
    }

    private MultiValueMap<String, Object> toMultipartBody(TransportRequest request) {
        FilePart filePart = request.filePart();

        HttpHeaders fileHeaders = new HttpHeaders();
        if (filePart.contentType() != null && !filePart.contentType().isBlank()) {
            fileHeaders.setContentType(MediaType.parseMediaType(filePart.contentType()));
        }
        ByteArrayResource resource = new ByteArrayResource(filePart.content()) {
            @Override
            public String getFilename() {
                return filePart.fileName();
            }
        };

        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("file", new HttpEntity<>(resource, fileHeaders));
        request.formFields().forEach(body::add);
        return body;
    }

    private static String readBody(InputStream body) throws IOException {
        if (body == null) {
            return "";
        }
        return StreamUtils.copyToString(body, StandardCharsets.UTF_8);
    }

    static String endpointOf(String url) {
        int lastSlash = url.lastIndexOf('/');
        return lastSlash >= 0 ? url.substring(lastSlash + 1) : url;
    }
}
