package com.codescan.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Base class for adapters that POST a JSON body and read a JSON response.
 *
 * <p>Owns the shared {@link HttpClient} and the mapping of transport failures and status
 * codes to {@link ProviderException.Kind}:
 * <ul>
 *   <li>401 and 403 map to {@code AUTH}</li>
 *   <li>408 and 504, and request timeouts, map to {@code TIMEOUT}</li>
 *   <li>other I/O failures map to {@code CONNECTION}</li>
 *   <li>every other non-2xx status and unreadable payloads map to {@code OTHER}</li>
 * </ul>
 *
 * <p>Subclasses supply the endpoint, headers and body, and extract the completion text.
 */
public abstract class HttpAnalysisAdapter implements AnalysisAdapter {

    private static final Logger log = LoggerFactory.getLogger(HttpAnalysisAdapter.class);

    protected static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(15);

    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final String displayName;

    protected HttpAnalysisAdapter(String displayName, Duration requestTimeout) {
        this(displayName, requestTimeout, HttpClient.newBuilder()
            .connectTimeout(CONNECT_TIMEOUT)
            .build());
    }

    protected HttpAnalysisAdapter(String displayName, Duration requestTimeout, HttpClient httpClient) {
        this.displayName = displayName;
        this.requestTimeout = requestTimeout;
        this.httpClient = httpClient;
    }

    @Override
    public final String analyze(String prompt) throws ProviderException {
        checkReady();
        URI uri = endpoint();
        String body;
        try {
            body = MAPPER.writeValueAsString(requestBody(prompt));
        } catch (IOException e) {
            throw new ProviderException(ProviderException.Kind.OTHER,
                displayName + " request could not be encoded: " + e.getMessage(), e);
        }

        HttpRequest.Builder builder;
        try {
            builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
            headers().forEach(builder::header);
        } catch (IllegalArgumentException e) {
            throw new ProviderException(ProviderException.Kind.OTHER,
                displayName + " request is invalid: " + e.getMessage(), e);
        }

        log.debug("Calling {} at {}", displayName, uri);
        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new ProviderException(ProviderException.Kind.TIMEOUT,
                displayName + " request timed out after " + requestTimeout.toSeconds() + "s", e);
        } catch (IOException e) {
            throw new ProviderException(ProviderException.Kind.CONNECTION,
                displayName + " connection failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(ProviderException.Kind.OTHER,
                displayName + " request interrupted", e);
        }

        int status = response.statusCode();
        if (status == 401 || status == 403) {
            throw new ProviderException(ProviderException.Kind.AUTH,
                displayName + " authentication failed (HTTP " + status + "): " + truncate(response.body(), 200));
        }
        if (status == 408 || status == 504) {
            throw new ProviderException(ProviderException.Kind.TIMEOUT,
                displayName + " timed out (HTTP " + status + ")");
        }
        if (status < 200 || status >= 300) {
            throw new ProviderException(ProviderException.Kind.OTHER,
                displayName + " returned HTTP " + status + ": " + truncate(response.body(), 300));
        }

        JsonNode root;
        try {
            root = MAPPER.readTree(response.body());
        } catch (IOException e) {
            throw new ProviderException(ProviderException.Kind.OTHER,
                displayName + " returned an unreadable payload: " + truncate(response.body(), 200), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new ProviderException(ProviderException.Kind.OTHER, displayName + " returned an empty payload");
        }
        return extractText(root);
    }

    /**
     * Verifies the adapter can issue a request at all, before any network activity.
     *
     * @throws ProviderException if the adapter is not usable
     */
    protected void checkReady() throws ProviderException {
    }

    protected abstract URI endpoint() throws ProviderException;

    protected abstract Map<String, String> headers();

    protected abstract Object requestBody(String prompt);

    protected abstract String extractText(JsonNode root) throws ProviderException;

    protected String displayName() {
        return displayName;
    }

    /**
     * Joins a base URL and a path without doubling the slash.
     *
     * @param base base URL
     * @param path path starting with {@code /}
     * @return endpoint URI
     * @throws ProviderException if the result is not a valid URI
     */
    protected URI join(String base, String path) throws ProviderException {
        String trimmed = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        try {
            return URI.create(trimmed + path);
        } catch (IllegalArgumentException e) {
            throw new ProviderException(ProviderException.Kind.OTHER, "Invalid " + displayName + " URL: " + base, e);
        }
    }

    static String truncate(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }
}
